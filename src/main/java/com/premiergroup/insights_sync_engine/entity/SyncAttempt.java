package com.premiergroup.insights_sync_engine.entity;

import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit row for one sync, aggregation or backfill run. Frozen once it reaches a terminal
 * status.
 */
@Entity
@Table(name = "sync_attempts", indexes = {
        @Index(name = "idx_sync_attempts_started_at", columnList = "started_at"),
        @Index(name = "idx_sync_attempts_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncAttempt {

    @Id
    @Column(name = "attempt_id")
    private UUID attemptId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_type", nullable = false, length = 32)
    private SyncType syncType;

    // entity levels or other scope label, e.g. "CAMPAIGN,AD"
    @Column(name = "scope", nullable = false)
    private String scope;

    @Column(name = "range_start", nullable = false)
    private LocalDate rangeStart;

    @Column(name = "range_end", nullable = false)
    private LocalDate rangeEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private SyncStatus status = SyncStatus.RUNNING;

    @Column(name = "entities_synced")
    private int entitiesSynced;

    private static final int MAX_ERROR_LENGTH = 2000;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sync_attempt_errors", joinColumns = @JoinColumn(name = "attempt_id"))
    @OrderColumn(name = "error_index")
    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        if (attemptId == null) {
            attemptId = UUID.randomUUID();
        }
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    public void recordProgress(int entitiesSynced, List<String> newErrors) {
        ensureOpen();
        this.entitiesSynced = entitiesSynced;
        if (newErrors != null) {
            newErrors.stream()
                    .filter(Objects::nonNull)
                    .map(e -> e.length() > MAX_ERROR_LENGTH ? e.substring(0, MAX_ERROR_LENGTH) : e)
                    .forEach(this.errors::add);
        }
    }

    public void finish(SyncStatus terminal, Instant at) {
        ensureOpen();
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        this.status = terminal;
        this.completedAt = at;
    }

    private void ensureOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Sync attempt " + attemptId + " is already " + status);
        }
    }
}
