package com.premiergroup.insights_sync_engine.dto;

public record AggregationResult(PeriodRange period, int rowsWritten) {
}
