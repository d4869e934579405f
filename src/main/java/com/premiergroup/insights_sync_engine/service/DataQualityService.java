package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.DataAnomaly;
import com.premiergroup.insights_sync_engine.dto.DataQualityReport;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.dto.RollupCoverage;
import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.entity.SyncAttempt;
import com.premiergroup.insights_sync_engine.enums.AnomalyType;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.MonthlyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.SyncAttemptRepository;
import com.premiergroup.insights_sync_engine.repository.WeeklyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only checks over the stored daily rows: outliers and inconsistent counters, days
 * without any data, and weeks or months whose rollups lag behind the daily rows.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class DataQualityService {

    static final BigDecimal SPEND_OUTLIER_FACTOR = BigDecimal.valueOf(5);
    static final BigDecimal ROAS_OUTLIER_FACTOR = BigDecimal.valueOf(10);

    private final DailyMetricRepository dailyMetricRepository;
    private final WeeklyMetricRepository weeklyMetricRepository;
    private final MonthlyMetricRepository monthlyMetricRepository;
    private final SyncAttemptRepository syncAttemptRepository;
    private final Clock clock;

    /**
     * The {@code days} days ending yesterday in the reporting zone.
     */
    public PeriodRange lastDays(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        return new PeriodRange(yesterday.minusDays(days - 1L), yesterday);
    }

    @Transactional(readOnly = true)
    public DataQualityReport assess(PeriodRange period) {
        List<DailyMetric> rows = dailyMetricRepository
                .findByStatsDateBetweenOrderByEntityIdAscStatsDateAsc(period.start(), period.end());
        List<DataAnomaly> anomalies = new ArrayList<>();
        if (rows.isEmpty()) {
            anomalies.add(new DataAnomaly(AnomalyType.NO_DATA, null, null,
                    "No daily rows between " + period.start() + " and " + period.end()));
        } else {
            scanRows(rows, anomalies);
            for (LocalDate day : missingDays(period)) {
                anomalies.add(new DataAnomaly(AnomalyType.MISSING_DAY, null, day, "No daily rows for " + day));
            }
        }
        DataQualityReport report = DataQualityReport.of(period, anomalies);
        log.info("Data quality for {}..{}: score {} ({}), {} anomalies",
                period.start(), period.end(), report.score(), report.qualityLevel(), anomalies.size());
        return report;
    }

    @Transactional(readOnly = true)
    public RollupCoverage coverage(PeriodRange period) {
        List<LocalDate> missing = missingDays(period);
        List<RollupCoverage.PeriodCoverage> weeks = period.weeks().stream()
                .map(week -> periodCoverage(week, SyncType.WEEKLY_AGGREGATION,
                        weeklyMetricRepository.countByPeriodStart(week.start())))
                .toList();
        List<RollupCoverage.PeriodCoverage> months = period.months().stream()
                .map(month -> periodCoverage(month, SyncType.MONTHLY_AGGREGATION,
                        monthlyMetricRepository.countByPeriodStart(month.start())))
                .toList();
        return new RollupCoverage(period, period.days() - missing.size(), missing, weeks, months);
    }

    private void scanRows(List<DailyMetric> rows, List<DataAnomaly> anomalies) {
        List<CanonicalMetrics> metrics = rows.stream().map(row -> row.getMetrics().toCanonical()).toList();
        BigDecimal spendLimit = outlierLimit(metrics, CanonicalMetrics::spend, SPEND_OUTLIER_FACTOR);
        BigDecimal roasLimit = outlierLimit(metrics, m -> m.roas(AttributionWindow.DEFAULT), ROAS_OUTLIER_FACTOR);

        for (int i = 0; i < rows.size(); i++) {
            DailyMetric row = rows.get(i);
            CanonicalMetrics m = metrics.get(i);
            BigDecimal roas = m.roas(AttributionWindow.DEFAULT);
            long conversions = m.conversion(AttributionWindow.DEFAULT).count();

            if (spendLimit != null && m.spend().compareTo(spendLimit) > 0) {
                add(anomalies, AnomalyType.HIGH_SPEND, row, "spend " + m.spend().toPlainString()
                        + " above " + spendLimit.toPlainString());
            }
            if (roasLimit != null && roas.compareTo(roasLimit) > 0) {
                add(anomalies, AnomalyType.EXTREME_ROAS, row, "roas " + roas.toPlainString()
                        + " above " + roasLimit.toPlainString());
            } else if (roas.signum() == 0 && m.spend().signum() > 0) {
                add(anomalies, AnomalyType.ZERO_ROAS_WITH_SPEND, row, "spend " + m.spend().toPlainString()
                        + " with zero roas");
            }
            if (m.clicks() > m.impressions()) {
                add(anomalies, AnomalyType.CLICKS_EXCEED_IMPRESSIONS, row,
                        m.clicks() + " clicks > " + m.impressions() + " impressions");
            }
            if (conversions > m.clicks()) {
                add(anomalies, AnomalyType.CONVERSIONS_EXCEED_CLICKS, row,
                        conversions + " conversions > " + m.clicks() + " clicks");
            }
        }
    }

    // factor times the mean of the positive values, null when no value is positive
    private static BigDecimal outlierLimit(List<CanonicalMetrics> metrics,
                                           Function<CanonicalMetrics, BigDecimal> field,
                                           BigDecimal factor) {
        List<BigDecimal> positive = metrics.stream().map(field).filter(v -> v.signum() > 0).toList();
        if (positive.isEmpty()) {
            return null;
        }
        BigDecimal mean = positive.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(positive.size()), 4, RoundingMode.HALF_UP);
        return mean.multiply(factor);
    }

    private static void add(List<DataAnomaly> anomalies, AnomalyType type, DailyMetric row, String detail) {
        anomalies.add(new DataAnomaly(type, row.getEntityId(), row.getStatsDate(), detail));
    }

    private List<LocalDate> missingDays(PeriodRange period) {
        Set<LocalDate> present = new HashSet<>(dailyMetricRepository.findDatesWithDataBetween(period.start(), period.end()));
        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate day = period.start(); !day.isAfter(period.end()); day = day.plusDays(1)) {
            if (!present.contains(day)) {
                missing.add(day);
            }
        }
        return missing;
    }

    private RollupCoverage.PeriodCoverage periodCoverage(PeriodRange period, SyncType type, long rollupRows) {
        int withDailyData = dailyMetricRepository.findEntityIdsWithDataBetween(period.start(), period.end()).size();
        var lastAggregation = syncAttemptRepository
                .findFirstBySyncTypeAndRangeStartOrderByStartedAtDesc(type, period.start())
                .map(SyncAttempt::getStatus)
                .orElse(null);
        return new RollupCoverage.PeriodCoverage(period.start(), period.end(), withDailyData, rollupRows,
                lastAggregation, rollupRows == withDailyData);
    }
}
