package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.SyncAttemptView;
import com.premiergroup.insights_sync_engine.dto.SyncSummary;
import com.premiergroup.insights_sync_engine.entity.SyncAttempt;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import com.premiergroup.insights_sync_engine.repository.SyncAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit log of sync attempts.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class SyncStateStore {

    private final SyncAttemptRepository syncAttemptRepository;
    private final Clock clock;

    @Transactional
    public UUID open(SyncType type, String scope, LocalDate rangeStart, LocalDate rangeEnd) {
        SyncAttempt attempt = syncAttemptRepository.save(SyncAttempt.builder()
                .syncType(type)
                .scope(scope)
                .rangeStart(rangeStart)
                .rangeEnd(rangeEnd)
                .startedAt(Instant.now(clock))
                .build());
        log.debug("Opened {} attempt {} for {} {}..{}", type, attempt.getAttemptId(), scope, rangeStart, rangeEnd);
        return attempt.getAttemptId();
    }

    @Transactional
    public void recordProgress(UUID attemptId, int entitiesSynced, List<String> newErrors) {
        SyncAttempt attempt = load(attemptId);
        attempt.recordProgress(entitiesSynced, newErrors);
        syncAttemptRepository.save(attempt);
    }

    @Transactional
    public void close(UUID attemptId, SyncStatus status, int entitiesSynced, List<String> newErrors) {
        SyncAttempt attempt = load(attemptId);
        attempt.recordProgress(entitiesSynced, newErrors);
        attempt.finish(status, Instant.now(clock));
        syncAttemptRepository.save(attempt);
        log.debug("Closed attempt {} as {} ({} entities)", attemptId, status, entitiesSynced);
    }

    @Transactional(readOnly = true)
    public Optional<SyncAttemptView> find(UUID attemptId) {
        return syncAttemptRepository.findById(attemptId).map(SyncAttemptView::from);
    }

    @Transactional(readOnly = true)
    public List<SyncAttemptView> recent(int limit) {
        return syncAttemptRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit))).stream()
                .map(SyncAttemptView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public SyncSummary summary() {
        long total = syncAttemptRepository.count();
        long succeeded = syncAttemptRepository.countByStatus(SyncStatus.SUCCEEDED);
        long partial = syncAttemptRepository.countByStatus(SyncStatus.PARTIAL);
        long failed = syncAttemptRepository.countByStatus(SyncStatus.FAILED);
        long running = syncAttemptRepository.countByStatus(SyncStatus.RUNNING);
        BigDecimal successRate = total > 0
                ? BigDecimal.valueOf(succeeded * 100).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new SyncSummary(total, succeeded, partial, failed, running, successRate);
    }

    private SyncAttempt load(UUID attemptId) {
        return syncAttemptRepository.findById(attemptId)
                .orElseThrow(() -> new IllegalStateException("Sync attempt not found: " + attemptId));
    }
}
