package com.rankfusion.query.retrieval;

public enum RetrievalPath {
    NATIVE_HYBRID,
    MANUAL_RRF,
    DENSE_ONLY
}
