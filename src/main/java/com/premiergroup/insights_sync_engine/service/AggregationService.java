package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.AggregationResult;
import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.MetricTotals;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.entity.WeeklyMetric;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.MonthlyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.WeeklyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.IntSupplier;

/**
 * Weekly and monthly rollups. A rollup is always the sum of the daily rows currently
 * stored for its period, with every ratio re-derived from the sums.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class AggregationService {

    private static final String ALL_ENTITIES = "ALL";

    private final DailyMetricRepository dailyMetricRepository;
    private final WeeklyMetricRepository weeklyMetricRepository;
    private final MonthlyMetricRepository monthlyMetricRepository;
    private final RollupWriter rollupWriter;
    private final MetricsNormalizer metricsNormalizer;
    private final SyncStateStore syncStateStore;

    /**
     * Sums whatever daily rows exist for the entity in the range. Missing days count as zero.
     */
    @Transactional(readOnly = true)
    public CanonicalMetrics aggregate(String entityId, LocalDate start, LocalDate end) {
        PeriodRange period = new PeriodRange(start, end);
        List<DailyMetric> rows = dailyMetricRepository
                .findByEntityIdAndStatsDateBetweenOrderByStatsDateAsc(entityId, period.start(), period.end());
        return metricsNormalizer.derive(RollupWriter.sum(rows));
    }

    /**
     * Serves the stored weekly or monthly row when the range matches its bounds exactly,
     * otherwise computes the range on demand.
     */
    @Transactional(readOnly = true)
    public CanonicalMetrics getAggregate(String entityId, LocalDate start, LocalDate end) {
        PeriodRange period = new PeriodRange(start, end);
        if (period.equals(PeriodRange.weekOf(start))) {
            var weekly = weeklyMetricRepository.findByEntityIdAndPeriodStartAndPeriodEnd(entityId, start, end);
            if (weekly.isPresent()) {
                return weekly.get().getMetrics().toCanonical();
            }
        }
        if (period.equals(PeriodRange.monthOf(start))) {
            var monthly = monthlyMetricRepository.findByEntityIdAndPeriodStartAndPeriodEnd(entityId, start, end);
            if (monthly.isPresent()) {
                return monthly.get().getMetrics().toCanonical();
            }
        }
        return aggregate(entityId, start, end);
    }

    public AggregationResult aggregateWeek(LocalDate reference) {
        PeriodRange week = PeriodRange.weekOf(reference);
        return logged(SyncType.WEEKLY_AGGREGATION, week, () -> rollupWriter.writeWeek(week));
    }

    public AggregationResult aggregateMonth(LocalDate reference) {
        PeriodRange month = PeriodRange.monthOf(reference);
        return logged(SyncType.MONTHLY_AGGREGATION, month, () -> rollupWriter.writeMonth(month));
    }

    /**
     * Refreshes the week and the month containing the day.
     */
    public List<AggregationResult> refreshRollupsContaining(LocalDate day) {
        return List.of(aggregateWeek(day), aggregateMonth(day));
    }

    /**
     * Refreshes every week and every month that overlaps the range.
     */
    public List<AggregationResult> aggregateRange(LocalDate start, LocalDate end) {
        PeriodRange range = new PeriodRange(start, end);
        List<AggregationResult> results = new ArrayList<>();
        for (PeriodRange week : range.weeks()) {
            results.add(aggregateWeek(week.start()));
        }
        for (PeriodRange month : range.months()) {
            results.add(aggregateMonth(month.start()));
        }
        log.info("Refreshed {} rollup periods for {}..{}", results.size(), start, end);
        return results;
    }

    /**
     * Compares every weekly row of the week against the sum of its daily rows and lists the
     * discrepancies. An empty list means the week is consistent.
     */
    @Transactional(readOnly = true)
    public List<String> verifyWeek(LocalDate weekStart) {
        PeriodRange week = PeriodRange.weekOf(weekStart);
        List<String> problems = new ArrayList<>();
        Set<String> withDailyData = new TreeSet<>(dailyMetricRepository.findEntityIdsWithDataBetween(week.start(), week.end()));

        for (WeeklyMetric weekly : weeklyMetricRepository.findByPeriodStartOrderByEntityIdAsc(week.start())) {
            withDailyData.remove(weekly.getEntityId());
            MetricTotals expected = RollupWriter.sum(dailyMetricRepository
                    .findByEntityIdAndStatsDateBetweenOrderByStatsDateAsc(weekly.getEntityId(), week.start(), week.end()));
            MetricTotals actual = weekly.getMetrics().toCanonical().totals();
            compare(problems, weekly.getEntityId(), "spend",
                    expected.spend().setScale(MetricsNormalizer.MONEY_SCALE, RoundingMode.HALF_UP), actual.spend());
            compare(problems, weekly.getEntityId(), "impressions", expected.impressions(), actual.impressions());
            compare(problems, weekly.getEntityId(), "clicks", expected.clicks(), actual.clicks());
            compare(problems, weekly.getEntityId(), "link_clicks", expected.linkClicks(), actual.linkClicks());
            for (AttributionWindow window : AttributionWindow.values()) {
                compare(problems, weekly.getEntityId(), window.getApiKey() + " conversions",
                        expected.conversion(window).count(), actual.conversion(window).count());
                compare(problems, weekly.getEntityId(), window.getApiKey() + " conversion value",
                        expected.conversion(window).value(), actual.conversion(window).value());
            }
        }
        withDailyData.forEach(entityId -> problems.add(entityId + ": weekly row missing for " + week.start()));

        if (!problems.isEmpty()) {
            log.warn("Week {} has {} inconsistencies", week.start(), problems.size());
        }
        return problems;
    }

    private AggregationResult logged(SyncType type, PeriodRange period, IntSupplier write) {
        UUID attemptId = syncStateStore.open(type, ALL_ENTITIES, period.start(), period.end());
        int rows;
        try {
            rows = writeWithRetry(type, period, write);
        } catch (RuntimeException e) {
            log.error("{} for {}..{} failed", type, period.start(), period.end(), e);
            syncStateStore.close(attemptId, SyncStatus.FAILED, 0, List.of(String.valueOf(e.getMessage())));
            throw e;
        }
        syncStateStore.close(attemptId, SyncStatus.SUCCEEDED, rows, List.of());
        log.info("{} for {}..{} wrote {} rows", type, period.start(), period.end(), rows);
        return new AggregationResult(period, rows);
    }

    private int writeWithRetry(SyncType type, PeriodRange period, IntSupplier write) {
        try {
            return write.getAsInt();
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent {} insert for {}..{}, retrying as update", type, period.start(), period.end());
            return write.getAsInt();
        }
    }

    private static void compare(List<String> problems, String entityId, String field, Object expected, Object actual) {
        boolean equal = expected instanceof BigDecimal e && actual instanceof BigDecimal a
                ? e.compareTo(a) == 0
                : Objects.equals(expected, actual);
        if (!equal) {
            problems.add(entityId + ": " + field + " weekly=" + actual + " daily=" + expected);
        }
    }
}
