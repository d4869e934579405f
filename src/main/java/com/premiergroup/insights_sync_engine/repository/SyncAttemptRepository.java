package com.premiergroup.insights_sync_engine.repository;

import com.premiergroup.insights_sync_engine.entity.SyncAttempt;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.enums.SyncType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SyncAttemptRepository extends JpaRepository<SyncAttempt, UUID> {

    List<SyncAttempt> findAllByOrderByStartedAtDesc(Pageable pageable);

    long countByStatus(SyncStatus status);

    Optional<SyncAttempt> findFirstBySyncTypeAndRangeStartOrderByStartedAtDesc(SyncType syncType, LocalDate rangeStart);
}
