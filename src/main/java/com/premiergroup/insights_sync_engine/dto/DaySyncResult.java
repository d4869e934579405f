package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;

import java.time.LocalDate;

public record DaySyncResult(
        LocalDate date,
        EntityLevel level,
        SyncStatus status,
        int entitiesSynced,
        String error,
        boolean retryable
) {

    public static DaySyncResult succeeded(LocalDate date, EntityLevel level, int entitiesSynced) {
        return new DaySyncResult(date, level, SyncStatus.SUCCEEDED, entitiesSynced, null, false);
    }

    public static DaySyncResult failed(LocalDate date, EntityLevel level, String error, boolean retryable) {
        return new DaySyncResult(date, level, SyncStatus.FAILED, 0, error, retryable);
    }

    public boolean isSuccess() {
        return status == SyncStatus.SUCCEEDED;
    }
}
