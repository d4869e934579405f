package com.premiergroup.insights_sync_engine.dto;

import java.math.BigDecimal;

public record SyncSummary(
        long totalAttempts,
        long succeeded,
        long partial,
        long failed,
        long running,
        BigDecimal successRate
) {
}
