package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.dto.NormalizedEntityMetrics;
import com.premiergroup.insights_sync_engine.dto.meta.InsightsQuery;
import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import com.premiergroup.insights_sync_engine.exception.InsightsFetchException;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fetches, normalizes and stores one day of insights for one entity level.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class DailySyncService {

    private final InsightsFetcher insightsFetcher;
    private final MetricsNormalizer metricsNormalizer;
    private final DailyMetricWriter dailyMetricWriter;
    private final DailyMetricRepository dailyMetricRepository;
    private final SyncStateStore syncStateStore;
    private final AggregationService aggregationService;

    /**
     * Failures come back as a FAILED result and the attempt is closed as FAILED. Nothing is
     * written for the day in that case.
     */
    public DaySyncResult syncDay(LocalDate day, EntityLevel level) {
        UUID attemptId = syncStateStore.open(SyncType.DAILY, level.name(), day, day);
        try {
            return sync(attemptId, day, level);
        } catch (RuntimeException e) {
            log.error("Unexpected failure syncing {} insights for {}", level, day, e);
            return fail(attemptId, day, level, "Unexpected failure: " + e.getMessage(), false);
        }
    }

    /**
     * Live sync outside a backfill: after a successful day the week and month containing it
     * are re-aggregated so stored rollups never lag behind their daily rows.
     */
    public DaySyncResult syncDayAndRefreshRollups(LocalDate day, EntityLevel level) {
        DaySyncResult result = syncDay(day, level);
        if (result.isSuccess()) {
            aggregationService.refreshRollupsContaining(day);
        }
        return result;
    }

    private DaySyncResult sync(UUID attemptId, LocalDate day, EntityLevel level) {
        List<RawInsightsRecord> raw;
        try {
            raw = insightsFetcher.fetch(InsightsQuery.singleDay(day, level));
        } catch (InsightsFetchException e) {
            log.error("Fetching {} insights for {} failed (retryable={})", level, day, e.isRetryable(), e);
            return fail(attemptId, day, level, e.getMessage(), e.isRetryable());
        }

        List<NormalizedEntityMetrics> rows = normalizeAll(day, level, raw);
        if (rows.isEmpty()) {
            log.info("No {} insights with spend on {}", level, day);
            syncStateStore.close(attemptId, SyncStatus.SUCCEEDED, 0, List.of());
            return DaySyncResult.succeeded(day, level, 0);
        }

        int written;
        try {
            written = writeDay(day, level, rows);
        } catch (DataAccessException e) {
            log.error("Storing {} {} rows for {} failed", rows.size(), level, day, e);
            return fail(attemptId, day, level, "Storage failure: " + e.getMostSpecificCause().getMessage(),
                    e instanceof TransientDataAccessException);
        }

        syncStateStore.close(attemptId, SyncStatus.SUCCEEDED, written, List.of());
        log.info("Synced {} {} entities for {}", written, level, day);
        return DaySyncResult.succeeded(day, level, written);
    }

    /**
     * A concurrent writer may insert the same (entity, day) between our lookup and insert.
     * The second attempt runs in a fresh transaction and updates the row it now finds.
     */
    private int writeDay(LocalDate day, EntityLevel level, List<NormalizedEntityMetrics> rows) {
        try {
            return dailyMetricWriter.replaceDay(day, level, rows);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent insert of {} rows for {}, retrying as update: {}",
                    level, day, e.getMostSpecificCause().getMessage());
            return dailyMetricWriter.replaceDay(day, level, rows);
        }
    }

    public boolean hasDataFor(LocalDate day, EntityLevel level) {
        return dailyMetricRepository.existsByLevelAndStatsDate(level, day);
    }

    private List<NormalizedEntityMetrics> normalizeAll(LocalDate day, EntityLevel level, List<RawInsightsRecord> raw) {
        Map<String, NormalizedEntityMetrics> byEntity = new LinkedHashMap<>();
        for (RawInsightsRecord record : raw) {
            String entityId = level.entityIdOf(record);
            if (entityId == null || entityId.isBlank()) {
                log.warn("Skipping {} record without an id on {}: {}", level, day, record);
                continue;
            }
            if (record.getDateStart() != null && !day.toString().equals(record.getDateStart())) {
                log.warn("Record for {} reports date_start {} while syncing {}", entityId, record.getDateStart(), day);
            }
            NormalizedEntityMetrics row = new NormalizedEntityMetrics(
                    entityId,
                    level.entityNameOf(record),
                    level.parentIdOf(record),
                    metricsNormalizer.normalize(record));
            if (byEntity.put(entityId, row) != null) {
                log.warn("Duplicate {} record for {} on {}, keeping the last one", level, entityId, day);
            }
        }
        return new ArrayList<>(byEntity.values());
    }

    private DaySyncResult fail(UUID attemptId, LocalDate day, EntityLevel level, String error, boolean retryable) {
        syncStateStore.close(attemptId, SyncStatus.FAILED, 0, List.of(error));
        return DaySyncResult.failed(day, level, error, retryable);
    }
}
