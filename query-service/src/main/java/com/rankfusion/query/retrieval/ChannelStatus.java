package com.rankfusion.query.retrieval;

/**
 * How one retrieval channel finished for a single query.
 */
public enum ChannelStatus {
    OK,
    EMPTY,
    UNSUPPORTED,
    ERROR,
    TIMEOUT,
    NOT_ATTEMPTED;

    public boolean degraded() {
        return this == ERROR || this == TIMEOUT || this == UNSUPPORTED;
    }
}
