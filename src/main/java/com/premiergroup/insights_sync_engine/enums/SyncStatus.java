package com.premiergroup.insights_sync_engine.enums;

public enum SyncStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
