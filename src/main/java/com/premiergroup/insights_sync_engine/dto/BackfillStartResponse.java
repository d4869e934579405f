package com.premiergroup.insights_sync_engine.dto;

public record BackfillStartResponse(String status, long totalDays) {

    public static BackfillStartResponse started(long totalDays) {
        return new BackfillStartResponse("started", totalDays);
    }
}
