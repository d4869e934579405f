package com.premiergroup.insights_sync_engine.enums;

public enum BackfillStatus {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    FAILED
}
