package com.premiergroup.insights_sync_engine.controller;

import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.PeriodComparison;
import com.premiergroup.insights_sync_engine.enums.DateFilter;
import com.premiergroup.insights_sync_engine.service.MetricsQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsQueryService metricsQueryService;

    @GetMapping("/daily/{entityId}")
    public ResponseEntity<CanonicalMetrics> getDailyMetrics(
            @PathVariable String entityId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return metricsQueryService.getDailyMetrics(entityId, date)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Example: GET api/metrics/aggregate/12345?dateRange=CUSTOM&startDate=2024-03-01&endDate=2024-03-10
     */
    @GetMapping("/aggregate/{entityId}")
    public ResponseEntity<CanonicalMetrics> getAggregate(
            @PathVariable String entityId,
            @RequestParam DateFilter dateRange,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(metricsQueryService.getAggregate(entityId, dateRange, startDate, endDate));
    }

    @GetMapping("/compare/{entityId}")
    public ResponseEntity<PeriodComparison> compare(
            @PathVariable String entityId,
            @RequestParam DateFilter dateRange,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(metricsQueryService.compareWithPreviousPeriod(entityId, dateRange, startDate, endDate));
    }
}
