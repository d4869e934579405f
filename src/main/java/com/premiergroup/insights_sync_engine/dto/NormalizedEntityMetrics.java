package com.premiergroup.insights_sync_engine.dto;

/**
 * Canonical metrics of one entity together with the identifiers needed to store them.
 */
public record NormalizedEntityMetrics(
        String entityId,
        String entityName,
        String parentId,
        CanonicalMetrics metrics
) {
}
