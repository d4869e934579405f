package com.premiergroup.insights_sync_engine.repository;

import com.premiergroup.insights_sync_engine.entity.MonthlyMetric;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MonthlyMetricRepository extends JpaRepository<MonthlyMetric, Long> {

    Optional<MonthlyMetric> findByEntityIdAndPeriodStart(String entityId, LocalDate periodStart);

    Optional<MonthlyMetric> findByEntityIdAndPeriodStartAndPeriodEnd(String entityId, LocalDate periodStart, LocalDate periodEnd);

    List<MonthlyMetric> findByPeriodStartOrderByEntityIdAsc(LocalDate periodStart);

    long countByPeriodStart(LocalDate periodStart);
}
