package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.MetricTotals;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.entity.MetricValues;
import com.premiergroup.insights_sync_engine.entity.MonthlyMetric;
import com.premiergroup.insights_sync_engine.entity.WeeklyMetric;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.MonthlyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.WeeklyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds weekly and monthly rows from the daily rows of their period. Rows are always
 * recomputed from scratch, never incremented.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class RollupWriter {

    private final DailyMetricRepository dailyMetricRepository;
    private final WeeklyMetricRepository weeklyMetricRepository;
    private final MonthlyMetricRepository monthlyMetricRepository;
    private final MetricsNormalizer metricsNormalizer;

    @Transactional
    public int writeWeek(PeriodRange week) {
        Map<String, List<DailyMetric>> byEntity = dailyRowsByEntity(week);
        byEntity.forEach((entityId, rows) -> {
            WeeklyMetric weekly = weeklyMetricRepository
                    .findByEntityIdAndPeriodStart(entityId, week.start())
                    .orElseGet(() -> WeeklyMetric.builder()
                            .entityId(entityId)
                            .periodStart(week.start())
                            .build());
            weekly.setLevel(rows.get(0).getLevel());
            weekly.setPeriodEnd(week.end());
            weekly.setDaysCovered(daysCovered(rows));
            weekly.setMetrics(MetricValues.from(metricsNormalizer.derive(sum(rows))));
            weeklyMetricRepository.save(weekly);
        });
        log.debug("Wrote {} weekly rows for {}..{}", byEntity.size(), week.start(), week.end());
        return byEntity.size();
    }

    @Transactional
    public int writeMonth(PeriodRange month) {
        Map<String, List<DailyMetric>> byEntity = dailyRowsByEntity(month);
        byEntity.forEach((entityId, rows) -> {
            MonthlyMetric monthly = monthlyMetricRepository
                    .findByEntityIdAndPeriodStart(entityId, month.start())
                    .orElseGet(() -> MonthlyMetric.builder()
                            .entityId(entityId)
                            .periodStart(month.start())
                            .build());
            monthly.setLevel(rows.get(0).getLevel());
            monthly.setPeriodEnd(month.end());
            monthly.setDaysCovered(daysCovered(rows));
            monthly.setMetrics(MetricValues.from(metricsNormalizer.derive(sum(rows))));
            monthlyMetricRepository.save(monthly);
        });
        log.debug("Wrote {} monthly rows for {}..{}", byEntity.size(), month.start(), month.end());
        return byEntity.size();
    }

    static MetricTotals sum(List<DailyMetric> rows) {
        return rows.stream()
                .map(d -> d.getMetrics().toCanonical().totals())
                .reduce(MetricTotals.ZERO, MetricTotals::plus);
    }

    private Map<String, List<DailyMetric>> dailyRowsByEntity(PeriodRange period) {
        Map<String, List<DailyMetric>> byEntity = new LinkedHashMap<>();
        for (DailyMetric row : dailyMetricRepository
                .findByStatsDateBetweenOrderByEntityIdAscStatsDateAsc(period.start(), period.end())) {
            byEntity.computeIfAbsent(row.getEntityId(), k -> new ArrayList<>()).add(row);
        }
        return byEntity;
    }

    private static int daysCovered(List<DailyMetric> rows) {
        return (int) rows.stream().map(DailyMetric::getStatsDate).distinct().count();
    }
}
