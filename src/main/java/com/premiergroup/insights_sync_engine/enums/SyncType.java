package com.premiergroup.insights_sync_engine.enums;

public enum SyncType {
    DAILY,
    BACKFILL,
    WEEKLY_AGGREGATION,
    MONTHLY_AGGREGATION
}
