package com.rankfusion.bandit.store;

public enum LoadStatus {
    MISSING,
    LOADED,
    CORRUPT;

    public boolean degraded() {
        return this == CORRUPT;
    }
}
