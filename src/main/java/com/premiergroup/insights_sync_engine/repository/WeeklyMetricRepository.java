package com.premiergroup.insights_sync_engine.repository;

import com.premiergroup.insights_sync_engine.entity.WeeklyMetric;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface WeeklyMetricRepository extends JpaRepository<WeeklyMetric, Long> {

    Optional<WeeklyMetric> findByEntityIdAndPeriodStart(String entityId, LocalDate periodStart);

    Optional<WeeklyMetric> findByEntityIdAndPeriodStartAndPeriodEnd(String entityId, LocalDate periodStart, LocalDate periodEnd);

    List<WeeklyMetric> findByPeriodStartOrderByEntityIdAsc(LocalDate periodStart);

    long countByPeriodStart(LocalDate periodStart);
}
