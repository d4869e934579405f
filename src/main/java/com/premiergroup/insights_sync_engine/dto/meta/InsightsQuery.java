package com.premiergroup.insights_sync_engine.dto.meta;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;

import java.time.LocalDate;
import java.util.List;

public record InsightsQuery(
        LocalDate since,
        LocalDate until,
        EntityLevel level,
        List<String> breakdowns,
        List<String> entityIds
) {

    public InsightsQuery {
        if (since == null || until == null || level == null) {
            throw new IllegalArgumentException("since, until and level are required");
        }
        if (since.isAfter(until)) {
            throw new IllegalArgumentException("since " + since + " is after until " + until);
        }
        breakdowns = breakdowns == null ? List.of() : List.copyOf(breakdowns);
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
    }

    public static InsightsQuery singleDay(LocalDate day, EntityLevel level) {
        return new InsightsQuery(day, day, level, List.of(), List.of());
    }
}
