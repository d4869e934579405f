package com.premiergroup.insights_sync_engine.config;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;

import java.time.Duration;
import java.util.List;

public record BackfillSettings(
        Duration defaultDelay,
        List<EntityLevel> levels,
        boolean aggregateOnCompletion
) {

    public BackfillSettings {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("At least one backfill level is required");
        }
        levels = List.copyOf(levels);
        defaultDelay = defaultDelay == null ? Duration.ZERO : defaultDelay;
    }
}
