package com.premiergroup.insights_sync_engine.entity;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Complete metrics snapshot of one entity for one day. Re-syncing a day overwrites it.
 */
@Entity
@Table(name = "daily_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_metrics_entity_date", columnNames = {"entity_id", "stats_date"}),
        indexes = @Index(name = "idx_daily_metrics_date_level", columnList = "stats_date, entity_level"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_level", nullable = false, length = 16)
    private EntityLevel level;

    @Column(name = "entity_name")
    private String entityName;

    @Column(name = "parent_id")
    private String parentId;

    @Column(name = "stats_date", nullable = false)
    private LocalDate statsDate;

    @Embedded
    private MetricValues metrics;

}
