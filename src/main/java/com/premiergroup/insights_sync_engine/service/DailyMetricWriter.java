package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.NormalizedEntityMetrics;
import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.entity.MetricValues;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Component
@Log4j2
@RequiredArgsConstructor
public class DailyMetricWriter {

    private final DailyMetricRepository dailyMetricRepository;

    /**
     * Upserts every row of one day in a single transaction: either all rows of the day are
     * written or none are.
     */
    @Transactional
    public int replaceDay(LocalDate day, EntityLevel level, List<NormalizedEntityMetrics> rows) {
        for (NormalizedEntityMetrics row : rows) {
            // 1. reuse the row stored under the natural key, if any
            DailyMetric metric = dailyMetricRepository
                    .findByEntityIdAndStatsDate(row.entityId(), day)
                    .orElseGet(() -> DailyMetric.builder()
                            .entityId(row.entityId())
                            .statsDate(day)
                            .build());

            // 2. overwrite everything: a daily row is a snapshot, not an accumulator
            metric.setLevel(level);
            metric.setEntityName(row.entityName());
            metric.setParentId(row.parentId());
            metric.setMetrics(MetricValues.from(row.metrics()));

            dailyMetricRepository.save(metric);
        }
        log.debug("Upserted {} {} rows for {}", rows.size(), level, day);
        return rows.size();
    }
}
