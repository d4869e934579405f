package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.AnomalySeverity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Anomalies found in the stored daily rows of a period, scored from 100 down by the
 * penalty of each anomaly.
 */
public record DataQualityReport(
        PeriodRange period,
        int score,
        String qualityLevel,
        Map<AnomalySeverity, Long> bySeverity,
        List<DataAnomaly> anomalies
) {

    public static DataQualityReport of(PeriodRange period, List<DataAnomaly> anomalies) {
        Map<AnomalySeverity, Long> bySeverity = new EnumMap<>(AnomalySeverity.class);
        int penalty = 0;
        for (AnomalySeverity severity : AnomalySeverity.values()) {
            bySeverity.put(severity, 0L);
        }
        for (DataAnomaly anomaly : anomalies) {
            bySeverity.merge(anomaly.severity(), 1L, Long::sum);
            penalty += anomaly.severity().getPenalty();
        }
        int score = Math.max(0, 100 - penalty);
        return new DataQualityReport(period, score, levelOf(score), bySeverity, List.copyOf(anomalies));
    }

    private static String levelOf(int score) {
        if (score >= 90) {
            return "excellent";
        }
        if (score >= 75) {
            return "good";
        }
        if (score >= 60) {
            return "fair";
        }
        return "poor";
    }
}
