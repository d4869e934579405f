package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Nightly job: syncs yesterday and refreshes the week and month it belongs to.
 */
@Service
@Log4j2
public class DailySyncScheduler {

    private final DailySyncService dailySyncService;
    private final AggregationService aggregationService;
    private final Clock clock;
    private final List<EntityLevel> levels;

    public DailySyncScheduler(
            DailySyncService dailySyncService,
            AggregationService aggregationService,
            Clock clock,
            @Value("${insights.sync.levels:CAMPAIGN,AD}") List<EntityLevel> levels
    ) {
        this.dailySyncService = dailySyncService;
        this.aggregationService = aggregationService;
        this.clock = clock;
        this.levels = List.copyOf(levels);
    }

    @Scheduled(cron = "${insights.sync.cron:0 0 3 * * *}")
    public void syncYesterday() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        log.info("Nightly sync for {} started", yesterday);

        int failures = 0;
        for (EntityLevel level : levels) {
            DaySyncResult result = dailySyncService.syncDay(yesterday, level);
            if (!result.isSuccess()) {
                failures++;
                log.warn("Nightly {} sync for {} failed (retryable={}): {}",
                        level, yesterday, result.retryable(), result.error());
            }
        }

        try {
            aggregationService.refreshRollupsContaining(yesterday);
        } catch (RuntimeException e) {
            log.error("Nightly rollup refresh for {} failed", yesterday, e);
        }
        log.info("Nightly sync for {} finished with {} failed levels", yesterday, failures);
    }
}
