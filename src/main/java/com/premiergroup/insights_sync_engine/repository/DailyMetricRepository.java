package com.premiergroup.insights_sync_engine.repository;

import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyMetricRepository extends JpaRepository<DailyMetric, Long> {

    Optional<DailyMetric> findByEntityIdAndStatsDate(String entityId, LocalDate statsDate);

    List<DailyMetric> findByEntityIdAndStatsDateBetweenOrderByStatsDateAsc(
            String entityId,
            LocalDate start,
            LocalDate end
    );

    List<DailyMetric> findByStatsDateBetweenOrderByEntityIdAscStatsDateAsc(LocalDate start, LocalDate end);

    List<DailyMetric> findByLevelAndStatsDateOrderByEntityIdAsc(EntityLevel level, LocalDate statsDate);

    boolean existsByLevelAndStatsDate(EntityLevel level, LocalDate statsDate);

    @Query("select distinct d.entityId from DailyMetric d where d.statsDate between :start and :end order by d.entityId")
    List<String> findEntityIdsWithDataBetween(@Param("start") LocalDate start, @Param("end") LocalDate end);

    @Query("select distinct d.statsDate from DailyMetric d where d.statsDate between :start and :end order by d.statsDate")
    List<LocalDate> findDatesWithDataBetween(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
