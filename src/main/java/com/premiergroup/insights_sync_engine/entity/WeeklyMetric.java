package com.premiergroup.insights_sync_engine.entity;

import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "weekly_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uk_weekly_metrics_entity_start", columnNames = {"entity_id", "period_start"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_level", length = 16)
    private EntityLevel level;

    // Monday
    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    // Sunday
    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "days_covered")
    private int daysCovered;

    @Embedded
    private MetricValues metrics;

}
