package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;
import java.util.List;

/**
 * @param delaySeconds pause between two days; null means the configured default
 * @param levels       entity levels to sync each day; null or empty means the configured default
 * @param forceRefresh re-sync days that already have daily rows
 */
public record BackfillRequest(
        @NotNull LocalDate startDate,
        @NotNull LocalDate endDate,
        @PositiveOrZero Double delaySeconds,
        List<EntityLevel> levels,
        boolean forceRefresh
) {
}
