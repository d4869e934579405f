package com.premiergroup.insights_sync_engine.dto;

import java.math.BigDecimal;
import java.util.Map;

public record PeriodComparison(
        String entityId,
        PeriodRange current,
        PeriodRange previous,
        CanonicalMetrics currentMetrics,
        CanonicalMetrics previousMetrics,
        Map<String, BigDecimal> percentChange
) {
}
