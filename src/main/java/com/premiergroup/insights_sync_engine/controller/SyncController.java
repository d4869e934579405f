package com.premiergroup.insights_sync_engine.controller;

import com.premiergroup.insights_sync_engine.dto.AggregationResult;
import com.premiergroup.insights_sync_engine.dto.BackfillProgress;
import com.premiergroup.insights_sync_engine.dto.BackfillRequest;
import com.premiergroup.insights_sync_engine.dto.BackfillStartResponse;
import com.premiergroup.insights_sync_engine.dto.DataQualityReport;
import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.dto.RollupCoverage;
import com.premiergroup.insights_sync_engine.dto.SyncAttemptView;
import com.premiergroup.insights_sync_engine.dto.SyncSummary;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.service.AggregationService;
import com.premiergroup.insights_sync_engine.service.BackfillOrchestrator;
import com.premiergroup.insights_sync_engine.service.DailySyncService;
import com.premiergroup.insights_sync_engine.service.DataQualityService;
import com.premiergroup.insights_sync_engine.service.SyncStateStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/sync")
@Validated
@RequiredArgsConstructor
public class SyncController {

    private final DailySyncService dailySyncService;
    private final BackfillOrchestrator backfillOrchestrator;
    private final AggregationService aggregationService;
    private final SyncStateStore syncStateStore;
    private final DataQualityService dataQualityService;

    /**
     * Sync a single day for one entity level, then refresh the week and month containing it.
     * <p>
     * Example: POST api/sync/daily?date=2024-03-01&level=CAMPAIGN
     */
    @PostMapping("/daily")
    public ResponseEntity<DaySyncResult> syncDay(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "CAMPAIGN") EntityLevel level
    ) {
        DaySyncResult result = dailySyncService.syncDayAndRefreshRollups(date, level);
        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/backfill")
    public ResponseEntity<BackfillStartResponse> startBackfill(@Valid @RequestBody BackfillRequest request) {
        return ResponseEntity.accepted().body(backfillOrchestrator.start(request));
    }

    @GetMapping("/backfill/status")
    public ResponseEntity<BackfillProgress> backfillStatus() {
        return ResponseEntity.ok(backfillOrchestrator.status());
    }

    @PostMapping("/backfill/cancel")
    public ResponseEntity<BackfillProgress> cancelBackfill() {
        return ResponseEntity.ok(backfillOrchestrator.cancel());
    }

    @PostMapping("/aggregate/weekly")
    public ResponseEntity<AggregationResult> aggregateWeek(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekOf
    ) {
        return ResponseEntity.ok(aggregationService.aggregateWeek(weekOf));
    }

    @PostMapping("/aggregate/monthly")
    public ResponseEntity<AggregationResult> aggregateMonth(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate monthOf
    ) {
        return ResponseEntity.ok(aggregationService.aggregateMonth(monthOf));
    }

    @GetMapping("/verify/weekly")
    public ResponseEntity<List<String>> verifyWeek(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekOf
    ) {
        return ResponseEntity.ok(aggregationService.verifyWeek(weekOf));
    }

    @GetMapping("/attempts")
    public ResponseEntity<List<SyncAttemptView>> recentAttempts(
            @RequestParam(defaultValue = "20") @Positive @Max(500) int limit
    ) {
        return ResponseEntity.ok(syncStateStore.recent(limit));
    }

    @GetMapping("/summary")
    public ResponseEntity<SyncSummary> summary() {
        return ResponseEntity.ok(syncStateStore.summary());
    }

    /**
     * Outliers, inconsistent counters and missing days over the last {@code days} days,
     * with a 0..100 score.
     */
    @GetMapping("/quality")
    public ResponseEntity<DataQualityReport> quality(
            @RequestParam(defaultValue = "30") @Positive @Max(366) int days
    ) {
        return ResponseEntity.ok(dataQualityService.assess(dataQualityService.lastDays(days)));
    }

    @GetMapping("/coverage")
    public ResponseEntity<RollupCoverage> coverage(
            @RequestParam(defaultValue = "30") @Positive @Max(366) int days
    ) {
        return ResponseEntity.ok(dataQualityService.coverage(dataQualityService.lastDays(days)));
    }
}
