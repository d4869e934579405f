package com.premiergroup.insights_sync_engine.enums;

import com.premiergroup.insights_sync_engine.dto.PeriodRange;

import java.time.LocalDate;

public enum DateFilter {

    YESTERDAY,
    THIS_WEEK,
    LAST_WEEK,
    THIS_MONTH,
    LAST_MONTH,
    LAST_7_DAYS,
    LAST_30_DAYS,
    LAST_90_DAYS,
    CUSTOM;

    /**
     * Resolves the filter against {@code today}. Week and month filters produce exactly the
     * bounds of the precomputed rollups so those rows can be served directly.
     */
    public PeriodRange resolve(LocalDate today, LocalDate customStart, LocalDate customEnd) {
        return switch (this) {
            case YESTERDAY -> new PeriodRange(today.minusDays(1), today.minusDays(1));
            case THIS_WEEK -> PeriodRange.weekOf(today);
            case LAST_WEEK -> PeriodRange.weekOf(today.minusWeeks(1));
            case THIS_MONTH -> PeriodRange.monthOf(today);
            case LAST_MONTH -> PeriodRange.monthOf(today.minusMonths(1));
            case LAST_7_DAYS -> new PeriodRange(today.minusDays(7), today.minusDays(1));
            case LAST_30_DAYS -> new PeriodRange(today.minusDays(30), today.minusDays(1));
            case LAST_90_DAYS -> new PeriodRange(today.minusDays(90), today.minusDays(1));
            case CUSTOM -> {
                if (customStart == null || customEnd == null) {
                    throw new IllegalArgumentException("CUSTOM date range requires startDate and endDate");
                }
                yield new PeriodRange(customStart, customEnd);
            }
        };
    }
}
