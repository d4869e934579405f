package com.premiergroup.insights_sync_engine.controller;

import com.premiergroup.insights_sync_engine.dto.BackfillProgress;
import com.premiergroup.insights_sync_engine.dto.BackfillStartResponse;
import com.premiergroup.insights_sync_engine.dto.DataAnomaly;
import com.premiergroup.insights_sync_engine.dto.DataQualityReport;
import com.premiergroup.insights_sync_engine.dto.DaySyncResult;
import com.premiergroup.insights_sync_engine.dto.PeriodRange;
import com.premiergroup.insights_sync_engine.dto.SyncSummary;
import com.premiergroup.insights_sync_engine.enums.AnomalyType;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.exception.BackfillAlreadyRunningException;
import com.premiergroup.insights_sync_engine.service.AggregationService;
import com.premiergroup.insights_sync_engine.service.BackfillOrchestrator;
import com.premiergroup.insights_sync_engine.service.DailySyncService;
import com.premiergroup.insights_sync_engine.service.DataQualityService;
import com.premiergroup.insights_sync_engine.service.SyncStateStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyncController.class)
class SyncControllerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DailySyncService dailySyncService;

    @MockBean
    private BackfillOrchestrator backfillOrchestrator;

    @MockBean
    private AggregationService aggregationService;

    @MockBean
    private SyncStateStore syncStateStore;

    @MockBean
    private DataQualityService dataQualityService;

    @Test
    void startsBackfill() throws Exception {
        when(backfillOrchestrator.start(any())).thenReturn(BackfillStartResponse.started(7));

        mockMvc.perform(post("/api/sync/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"startDate":"2024-01-01","endDate":"2024-01-07","delaySeconds":1.5}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("started"))
                .andExpect(jsonPath("$.totalDays").value(7));
    }

    @Test
    void secondBackfillIsConflict() throws Exception {
        when(backfillOrchestrator.start(any())).thenThrow(new BackfillAlreadyRunningException("A backfill is already running"));

        mockMvc.perform(post("/api/sync/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2024-01-01\",\"endDate\":\"2024-01-07\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("BACKFILL_RUNNING"));
    }

    @Test
    void backfillWithoutDatesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sync/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"endDate\":\"2024-01-07\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(backfillOrchestrator);
    }

    @Test
    void invertedBackfillRangeIsBadRequest() throws Exception {
        when(backfillOrchestrator.start(any())).thenThrow(new IllegalArgumentException("Period start 2024-01-07 is after end 2024-01-01"));

        mockMvc.perform(post("/api/sync/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2024-01-07\",\"endDate\":\"2024-01-01\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void reportsBackfillProgress() throws Exception {
        BackfillProgress progress = BackfillProgress.running(4, DAY, Instant.parse("2024-02-01T10:00:00Z"))
                .dayCompleted(DAY, null);
        when(backfillOrchestrator.status()).thenReturn(progress);

        mockMvc.perform(get("/api/sync/backfill/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.completedDays").value(1))
                .andExpect(jsonPath("$.totalDays").value(4))
                .andExpect(jsonPath("$.percentage").value(25.0))
                .andExpect(jsonPath("$.currentDate").value("2024-01-15"));
    }

    @Test
    void failedDailySyncIsBadGateway() throws Exception {
        when(dailySyncService.syncDayAndRefreshRollups(DAY, EntityLevel.AD))
                .thenReturn(DaySyncResult.failed(DAY, EntityLevel.AD, "Meta API error 500", true));

        mockMvc.perform(post("/api/sync/daily").param("date", "2024-01-15").param("level", "AD"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void successfulDailySync() throws Exception {
        when(dailySyncService.syncDayAndRefreshRollups(DAY, EntityLevel.CAMPAIGN))
                .thenReturn(DaySyncResult.succeeded(DAY, EntityLevel.CAMPAIGN, 12));

        mockMvc.perform(post("/api/sync/daily").param("date", "2024-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entitiesSynced").value(12));
    }

    @Test
    void malformedDateIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sync/daily").param("date", "15/01/2024"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dailySyncService);
    }

    @Test
    void summary() throws Exception {
        when(syncStateStore.summary()).thenReturn(new SyncSummary(4, 3, 0, 1, 0, new BigDecimal("75.00")));

        mockMvc.perform(get("/api/sync/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAttempts").value(4))
                .andExpect(jsonPath("$.successRate").value(75.0));
    }

    @Test
    void qualityReportForTheRequestedDays() throws Exception {
        PeriodRange period = new PeriodRange(DAY.minusDays(6), DAY);
        when(dataQualityService.lastDays(7)).thenReturn(period);
        when(dataQualityService.assess(period)).thenReturn(DataQualityReport.of(period, List.of(
                new DataAnomaly(AnomalyType.MISSING_DAY, null, DAY, "No daily rows for " + DAY))));

        mockMvc.perform(get("/api/sync/quality").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(95))
                .andExpect(jsonPath("$.qualityLevel").value("excellent"))
                .andExpect(jsonPath("$.anomalies[0].type").value("MISSING_DAY"))
                .andExpect(jsonPath("$.anomalies[0].date").value("2024-01-15"));
    }

    @Test
    void qualityWindowMustBePositive() throws Exception {
        mockMvc.perform(get("/api/sync/quality").param("days", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dataQualityService);
    }
}
