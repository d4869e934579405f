package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.dto.SyncAttemptView;
import com.premiergroup.insights_sync_engine.dto.meta.InsightsQuery;
import com.premiergroup.insights_sync_engine.entity.DailyMetric;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.enums.SyncStatus;
import com.premiergroup.insights_sync_engine.repository.DailyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.MonthlyMetricRepository;
import com.premiergroup.insights_sync_engine.repository.SyncAttemptRepository;
import com.premiergroup.insights_sync_engine.repository.WeeklyMetricRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
class DailySyncPersistenceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Autowired
    private DailyMetricRepository dailyMetricRepository;

    @Autowired
    private WeeklyMetricRepository weeklyMetricRepository;

    @Autowired
    private MonthlyMetricRepository monthlyMetricRepository;

    @Autowired
    private SyncAttemptRepository syncAttemptRepository;

    @Autowired
    private TestEntityManager entityManager;

    private final InsightsFetcher insightsFetcher = mock(InsightsFetcher.class);
    private DailySyncService dailySyncService;
    private AggregationService aggregationService;
    private SyncStateStore syncStateStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-16T03:00:00Z"), ZoneOffset.UTC);
        MetricsNormalizer normalizer = InsightsTestData.normalizer();
        syncStateStore = new SyncStateStore(syncAttemptRepository, clock);
        aggregationService = new AggregationService(dailyMetricRepository, weeklyMetricRepository, monthlyMetricRepository,
                new RollupWriter(dailyMetricRepository, weeklyMetricRepository, monthlyMetricRepository, normalizer),
                normalizer, syncStateStore);
        dailySyncService = new DailySyncService(insightsFetcher, normalizer,
                new DailyMetricWriter(dailyMetricRepository), dailyMetricRepository, syncStateStore, aggregationService);
    }

    @Test
    void resyncingTheSameDayLeavesIdenticalRows() {
        when(insightsFetcher.fetch(any())).thenReturn(List.of(
                InsightsTestData.campaignRecord("c-1", DAY, "100.00", "2", "50"),
                InsightsTestData.campaignRecord("c-2", DAY, "33.33", "1", "19.99")));

        dailySyncService.syncDay(DAY, EntityLevel.CAMPAIGN);
        List<DailyMetric> first = snapshot();

        dailySyncService.syncDay(DAY, EntityLevel.CAMPAIGN);
        List<DailyMetric> second = snapshot();

        assertEquals(2, first.size());
        assertEquals(first, second);
    }

    @Test
    void laterSyncOverwritesEveryFieldOfTheDay() {
        when(insightsFetcher.fetch(any()))
                .thenReturn(List.of(InsightsTestData.campaignRecord("c-1", DAY, "100.00", "2", "50")))
                .thenReturn(List.of(InsightsTestData.campaignRecord("c-1", DAY, "120.00", "3", "90")));

        dailySyncService.syncDay(DAY, EntityLevel.CAMPAIGN);
        dailySyncService.syncDay(DAY, EntityLevel.CAMPAIGN);
        entityManager.flush();
        entityManager.clear();

        List<DailyMetric> rows = dailyMetricRepository.findAll();
        assertEquals(1, rows.size());
        CanonicalMetrics metrics = rows.get(0).getMetrics().toCanonical();
        assertEquals(0, new BigDecimal("120.00").compareTo(metrics.spend()));
        assertEquals(3, metrics.conversion(AttributionWindow.DEFAULT).count());
        assertEquals(0, new BigDecimal("0.7500").compareTo(metrics.roas(AttributionWindow.DEFAULT)));
    }

    @Test
    void everySyncIsRecordedAsAnAttempt() {
        when(insightsFetcher.fetch(any())).thenReturn(List.of(InsightsTestData.campaignRecord("c-1", DAY, "10", "0", "0")));

        DaySyncResult result = dailySyncService.syncDay(DAY, EntityLevel.CAMPAIGN);

        List<SyncAttemptView> attempts = syncStateStore.recent(10);
        assertEquals(1, attempts.size());
        assertEquals(SyncStatus.SUCCEEDED, attempts.get(0).status());
        assertEquals(result.entitiesSynced(), attempts.get(0).entitiesSynced());
        assertEquals(DAY, attempts.get(0).rangeStart());
        assertTrue(dailySyncService.hasDataFor(DAY, EntityLevel.CAMPAIGN));
        assertFalse(dailySyncService.hasDataFor(DAY, EntityLevel.AD));
    }

    @Test
    void liveResyncOfARolledUpDayRefreshesTheStoredWeekAndMonth() {
        LocalDate monday = LocalDate.of(2024, 1, 1);
        when(insightsFetcher.fetch(any())).thenAnswer(inv -> {
            InsightsQuery query = inv.getArgument(0);
            return List.of(InsightsTestData.campaignRecord("c-1", query.since(), "100", "1", "50"));
        });
        for (int i = 0; i < 7; i++) {
            dailySyncService.syncDayAndRefreshRollups(monday.plusDays(i), EntityLevel.CAMPAIGN);
        }
        assertEquals(0, new BigDecimal("700").compareTo(
                aggregationService.getAggregate("c-1", monday, monday.plusDays(6)).spend()));

        when(insightsFetcher.fetch(any())).thenReturn(List.of(InsightsTestData.campaignRecord("c-1", monday, "200", "1", "50")));
        DaySyncResult result = dailySyncService.syncDayAndRefreshRollups(monday, EntityLevel.CAMPAIGN);

        assertTrue(result.isSuccess());
        CanonicalMetrics served = aggregationService.getAggregate("c-1", monday, monday.plusDays(6));
        CanonicalMetrics dailySum = aggregationService.aggregate("c-1", monday, monday.plusDays(6));
        assertEquals(0, new BigDecimal("800").compareTo(served.spend()));
        assertEquals(0, dailySum.spend().compareTo(served.spend()));
        assertEquals(0, new BigDecimal("800").compareTo(monthlyMetricRepository
                .findByEntityIdAndPeriodStart("c-1", monday).orElseThrow().getMetrics().getSpend()));
        assertTrue(aggregationService.verifyWeek(monday).isEmpty());
    }

    @Test
    void unexpectedFailureClosesTheAttemptAsFailed() {
        when(insightsFetcher.fetch(any())).thenThrow(new IllegalStateException("Error while extracting response"));

        DaySyncResult result = dailySyncService.syncDayAndRefreshRollups(DAY, EntityLevel.CAMPAIGN);

        assertEquals(SyncStatus.FAILED, result.status());
        assertTrue(result.error().contains("Error while extracting response"));
        SyncAttemptView attempt = syncStateStore.recent(10).get(0);
        assertEquals(SyncStatus.FAILED, attempt.status());
        assertNotNull(attempt.completedAt());
        assertEquals(1, syncStateStore.recent(10).size());
        assertTrue(weeklyMetricRepository.findAll().isEmpty());
    }

    private List<DailyMetric> snapshot() {
        entityManager.flush();
        entityManager.clear();
        return dailyMetricRepository.findAll(Sort.by("entityId"));
    }
}
