package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.config.BackfillSettings;
import com.premiergroup.insights_sync_engine.dto.BackfillProgress;
import com.premiergroup.insights_sync_engine.dto.BackfillRequest;
import com.premiergroup.insights_sync_engine.dto.BackfillStartResponse;
import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.enums.BackfillStatus;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import com.premiergroup.insights_sync_engine.exception.BackfillAlreadyRunningException;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs a historical backfill day by day on a single background thread.
 * <p>
 * Only one backfill runs at a time. A day that fails is recorded as an error and the
 * loop moves on; the run itself only fails when it is cancelled, interrupted or hits an
 * unexpected error.
 */
@Service
@Log4j2
public class BackfillOrchestrator {

    private final TaskExecutor taskExecutor;
    private final DailySyncService dailySyncService;
    private final AggregationService aggregationService;
    private final SyncStateStore syncStateStore;
    private final BackfillSettings settings;
    private final Clock clock;

    private final AtomicReference<BackfillProgress> progress = new AtomicReference<>(BackfillProgress.NOT_STARTED);
    // true from start() until the worker has published its terminal snapshot
    private final AtomicBoolean active = new AtomicBoolean(false);
    private volatile StopRequest stopRequest;
    private volatile Thread worker;

    public BackfillOrchestrator(
            @Qualifier("backfillTaskExecutor") TaskExecutor taskExecutor,
            DailySyncService dailySyncService,
            AggregationService aggregationService,
            SyncStateStore syncStateStore,
            BackfillSettings settings,
            Clock clock
    ) {
        this.taskExecutor = taskExecutor;
        this.dailySyncService = dailySyncService;
        this.aggregationService = aggregationService;
        this.syncStateStore = syncStateStore;
        this.settings = settings;
        this.clock = clock;
    }

    public synchronized BackfillStartResponse start(BackfillRequest request) {
        if (request == null || request.startDate() == null || request.endDate() == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        PeriodRange range = new PeriodRange(request.startDate(), request.endDate());
        Duration delay = resolveDelay(request.delaySeconds());
        List<EntityLevel> levels = request.levels() == null || request.levels().isEmpty()
                ? settings.levels()
                : List.copyOf(request.levels());

        if (!active.compareAndSet(false, true)) {
            throw new BackfillAlreadyRunningException("A backfill is already running (" + progress.get().completedDays()
                    + "/" + progress.get().totalDays() + " days done)");
        }

        stopRequest = null;
        UUID attemptId;
        try {
            attemptId = syncStateStore.open(SyncType.BACKFILL, scopeOf(levels), range.start(), range.end());
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }
        progress.set(BackfillProgress.running(range.days(), range.start(), Instant.now(clock)));
        log.info("Starting backfill {}..{} ({} days, levels={}, delay={}, forceRefresh={})",
                range.start(), range.end(), range.days(), levels, delay, request.forceRefresh());

        try {
            taskExecutor.execute(() -> run(range, levels, delay, request.forceRefresh(), attemptId));
        } catch (TaskRejectedException e) {
            log.error("Backfill task was rejected by the executor", e);
            BackfillProgress terminal = progress.updateAndGet(p ->
                    p.withError("Backfill could not be scheduled").finish(BackfillStatus.FAILED, Instant.now(clock)));
            closeAttempt(attemptId, 0, terminal);
            active.set(false);
            throw new BackfillAlreadyRunningException("The previous backfill is still stopping");
        }
        return BackfillStartResponse.started(range.days());
    }

    public BackfillProgress status() {
        return progress.get();
    }

    /**
     * Requests a stop. The day in flight finishes and no further day is started. The status
     * turns FAILED, keeping the progress made so far, once the worker has stopped.
     */
    public BackfillProgress cancel() {
        if (progress.get().isRunning() && stopRequest == null) {
            stopRequest = StopRequest.CANCEL;
            log.info("Backfill cancel requested after {} days", progress.get().completedDays());
        }
        return progress.get();
    }

    @PreDestroy
    public void shutdown() {
        stopRequest = StopRequest.SHUTDOWN;
        Thread current = worker;
        if (current != null) {
            current.interrupt();
        }
    }

    private void run(PeriodRange range, List<EntityLevel> levels, Duration delay, boolean forceRefresh, UUID attemptId) {
        worker = Thread.currentThread();
        int entities = 0;
        // replaced on every regular exit; what is left here means an Error escaped the loop
        String failure = "Backfill stopped unexpectedly";
        try {
            for (LocalDate day = range.start(); !day.isAfter(range.end()); day = day.plusDays(1)) {
                if (stopRequest != null) {
                    log.info("Backfill stopping before {}", day);
                    failure = stopMessage();
                    return;
                }

                DayOutcome outcome = processDay(day, levels, forceRefresh);
                entities += outcome.entities();
                LocalDate completed = day;
                progress.updateAndGet(p -> p.isRunning() ? p.dayCompleted(completed, outcome.error()) : p);
                syncStateStore.recordProgress(attemptId, entities, List.of());

                if (!delay.isZero() && day.isBefore(range.end())) {
                    Thread.sleep(delay.toMillis());
                }
            }

            if (stopRequest != null) {
                failure = stopMessage();
                return;
            }
            if (settings.aggregateOnCompletion()) {
                refreshRollups(range);
            }
            failure = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backfill interrupted at {}", progress.get().currentDate());
            failure = stopRequest != null ? stopMessage() : "Backfill interrupted";
        } catch (RuntimeException e) {
            log.error("Backfill aborted at {}", progress.get().currentDate(), e);
            failure = "Backfill aborted: " + e.getMessage();
        } finally {
            finish(range, attemptId, entities, failure);
        }
    }

    /**
     * Closes the attempt first, then publishes the terminal snapshot and releases the guard
     * together, so a caller that sees a terminal status can start the next backfill.
     */
    private void finish(PeriodRange range, UUID attemptId, int entities, String failure) {
        BackfillProgress last = progress.get();
        BackfillProgress terminal = failure == null
                ? last.finish(BackfillStatus.COMPLETED, Instant.now(clock))
                : last.withError(failure).finish(BackfillStatus.FAILED, Instant.now(clock));
        closeAttempt(attemptId, entities, terminal);
        synchronized (this) {
            progress.set(terminal);
            worker = null;
            active.set(false);
        }
        log.info("Backfill {}..{} finished as {} with {} errors",
                range.start(), range.end(), terminal.status(), terminal.errors().size());
    }

    private String stopMessage() {
        if (stopRequest == StopRequest.SHUTDOWN) {
            return "Backfill stopped by application shutdown";
        }
        BackfillProgress current = progress.get();
        return "Backfill cancelled after " + current.completedDays() + " of " + current.totalDays() + " days";
    }

    private DayOutcome processDay(LocalDate day, List<EntityLevel> levels, boolean forceRefresh) {
        int entities = 0;
        List<String> failures = new ArrayList<>();
        for (EntityLevel level : levels) {
            if (!forceRefresh && dailySyncService.hasDataFor(day, level)) {
                log.debug("Skipping {} {}, already synced", level, day);
                continue;
            }
            try {
                DaySyncResult result = dailySyncService.syncDay(day, level);
                if (result.isSuccess()) {
                    entities += result.entitiesSynced();
                } else {
                    failures.add(level + " " + result.error());
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure syncing {} for {}", level, day, e);
                failures.add(level + " " + e.getMessage());
            }
        }
        String error = failures.isEmpty() ? null : day + ": " + String.join("; ", failures);
        return new DayOutcome(entities, error);
    }

    private void refreshRollups(PeriodRange range) {
        try {
            aggregationService.aggregateRange(range.start(), range.end());
        } catch (RuntimeException e) {
            log.error("Rollup refresh after backfill {}..{} failed", range.start(), range.end(), e);
            progress.updateAndGet(p -> p.withError("Aggregation failed: " + e.getMessage()));
        }
    }

    private void closeAttempt(UUID attemptId, int entities, BackfillProgress terminal) {
        SyncStatus status = terminal.status() == BackfillStatus.COMPLETED
                ? (terminal.hasErrors() ? SyncStatus.PARTIAL : SyncStatus.SUCCEEDED)
                : SyncStatus.FAILED;
        try {
            syncStateStore.close(attemptId, status, entities, terminal.errors());
        } catch (RuntimeException e) {
            log.error("Could not record the outcome of backfill attempt {}", attemptId, e);
        }
    }

    private Duration resolveDelay(Double delaySeconds) {
        if (delaySeconds == null) {
            return settings.defaultDelay();
        }
        if (delaySeconds < 0 || delaySeconds.isNaN()) {
            throw new IllegalArgumentException("delaySeconds must not be negative");
        }
        return Duration.ofMillis(Math.round(delaySeconds * 1000));
    }

    private static String scopeOf(List<EntityLevel> levels) {
        return levels.stream().map(EntityLevel::name).collect(Collectors.joining(","));
    }

    private record DayOutcome(int entities, String error) {
    }

    private enum StopRequest {
        CANCEL,
        SHUTDOWN
    }
}
