package com.premiergroup.insights_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.premiergroup.insights_sync_engine.enums.BackfillStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of the backfill. Every change produces a new instance, so a reader
 * holding one never sees half of an update.
 */
public record BackfillProgress(
        BackfillStatus status,
        long totalDays,
        long completedDays,
        LocalDate currentDate,
        Instant startedAt,
        Instant finishedAt,
        List<String> errors
) {

    public static final BackfillProgress NOT_STARTED =
            new BackfillProgress(BackfillStatus.NOT_STARTED, 0, 0, null, null, null, List.of());

    public BackfillProgress {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BackfillProgress running(long totalDays, LocalDate firstDay, Instant startedAt) {
        return new BackfillProgress(BackfillStatus.RUNNING, totalDays, 0, firstDay, startedAt, null, List.of());
    }

    public BackfillProgress dayCompleted(LocalDate day, String error) {
        List<String> nextErrors = errors;
        if (error != null) {
            nextErrors = new ArrayList<>(errors);
            nextErrors.add(error);
        }
        return new BackfillProgress(status, totalDays, completedDays + 1, day, startedAt, finishedAt, nextErrors);
    }

    public BackfillProgress withError(String error) {
        List<String> nextErrors = new ArrayList<>(errors);
        nextErrors.add(error);
        return new BackfillProgress(status, totalDays, completedDays, currentDate, startedAt, finishedAt, nextErrors);
    }

    public BackfillProgress finish(BackfillStatus terminal, Instant at) {
        return new BackfillProgress(terminal, totalDays, completedDays, currentDate, startedAt, at, errors);
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == BackfillStatus.RUNNING;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @JsonProperty("percentage")
    public BigDecimal percentage() {
        if (totalDays == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(completedDays * 100)
                .divide(BigDecimal.valueOf(totalDays), 1, RoundingMode.HALF_UP);
    }
}
