package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.entity.SyncAttempt;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record SyncAttemptView(
        UUID attemptId,
        SyncType syncType,
        String scope,
        LocalDate rangeStart,
        LocalDate rangeEnd,
        SyncStatus status,
        int entitiesSynced,
        List<String> errors,
        Instant startedAt,
        Instant completedAt
) {

    public static SyncAttemptView from(SyncAttempt attempt) {
        return new SyncAttemptView(
                attempt.getAttemptId(),
                attempt.getSyncType(),
                attempt.getScope(),
                attempt.getRangeStart(),
                attempt.getRangeEnd(),
                attempt.getStatus(),
                attempt.getEntitiesSynced(),
                List.copyOf(attempt.getErrors()),
                attempt.getStartedAt(),
                attempt.getCompletedAt());
    }
}
