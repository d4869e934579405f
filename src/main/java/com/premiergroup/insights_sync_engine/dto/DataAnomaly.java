package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.AnomalySeverity;
import com.premiergroup.insights_sync_engine.enums.AnomalyType;

import java.time.LocalDate;

/**
 * One suspicious observation. {@code entityId} and {@code date} are null when the anomaly
 * concerns the whole account or the whole period.
 */
public record DataAnomaly(AnomalyType type, String entityId, LocalDate date, String detail) {

    public AnomalySeverity severity() {
        return type.getSeverity();
    }
}
