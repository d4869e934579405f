package com.premiergroup.insights_sync_engine.enums;

public enum AnomalyType {
    NO_DATA(AnomalySeverity.HIGH),
    MISSING_DAY(AnomalySeverity.MEDIUM),
    HIGH_SPEND(AnomalySeverity.MEDIUM),
    EXTREME_ROAS(AnomalySeverity.LOW),
    ZERO_ROAS_WITH_SPEND(AnomalySeverity.MEDIUM),
    CLICKS_EXCEED_IMPRESSIONS(AnomalySeverity.HIGH),
    CONVERSIONS_EXCEED_CLICKS(AnomalySeverity.HIGH);

    private final AnomalySeverity severity;

    AnomalyType(AnomalySeverity severity) {
        this.severity = severity;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }
}
