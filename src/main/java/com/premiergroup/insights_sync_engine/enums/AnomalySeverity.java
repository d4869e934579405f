package com.premiergroup.insights_sync_engine.enums;

/**
 * Weight of an anomaly in the data-quality score.
 */
public enum AnomalySeverity {
    HIGH(10),
    MEDIUM(5),
    LOW(1);

    private final int penalty;

    AnomalySeverity(int penalty) {
        this.penalty = penalty;
    }

    public int getPenalty() {
        return penalty;
    }
}
