package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.SyncStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Which days of a window hold daily rows and whether every week and month touching the
 * window has a rollup row for each entity with daily data.
 */
public record RollupCoverage(
        PeriodRange window,
        long daysWithData,
        List<LocalDate> missingDays,
        List<PeriodCoverage> weeks,
        List<PeriodCoverage> months
) {

    public record PeriodCoverage(
            LocalDate start,
            LocalDate end,
            int entitiesWithDailyData,
            long rollupRows,
            SyncStatus lastAggregation,
            boolean complete
    ) {
    }
}
