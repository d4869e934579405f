package com.premiergroup.insights_sync_engine.controller;

import com.premiergroup.insights_sync_engine.dto.ConversionFigure;
import com.premiergroup.insights_sync_engine.dto.MetricTotals;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.DateFilter;
import com.premiergroup.insights_sync_engine.service.MetricsNormalizer;
import com.premiergroup.insights_sync_engine.service.MetricsQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MetricsController.class)
class MetricsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetricsQueryService metricsQueryService;

    @Test
    void unknownDayIsNotFound() throws Exception {
        when(metricsQueryService.getDailyMetrics("c-1", LocalDate.of(2024, 1, 15))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/metrics/daily/c-1").param("date", "2024-01-15"))
                .andExpect(status().isNotFound());
    }

    @Test
    void aggregateExposesEveryWindow() throws Exception {
        MetricsNormalizer normalizer = new MetricsNormalizer(null, null);
        var metrics = normalizer.derive(new MetricTotals(new BigDecimal("700"), 7000, 5000, 350, 280,
                Map.of(AttributionWindow.DEFAULT, new ConversionFigure(14, new BigDecimal("350")))));
        when(metricsQueryService.getAggregate("c-1", DateFilter.LAST_WEEK, null, null)).thenReturn(metrics);

        mockMvc.perform(get("/api/metrics/aggregate/c-1").param("dateRange", "LAST_WEEK"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spend").value(700.0))
                .andExpect(jsonPath("$.roas.DEFAULT").value(0.5))
                .andExpect(jsonPath("$.conversions.DEFAULT.count").value(14))
                .andExpect(jsonPath("$.conversions.SEVEN_DAY_CLICK.count").value(0));
    }

    @Test
    void customRangeWithoutDatesIsBadRequest() throws Exception {
        when(metricsQueryService.getAggregate("c-1", DateFilter.CUSTOM, null, null))
                .thenThrow(new IllegalArgumentException("CUSTOM date range requires startDate and endDate"));

        mockMvc.perform(get("/api/metrics/aggregate/c-1").param("dateRange", "CUSTOM"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("CUSTOM date range requires startDate and endDate"));
    }

    @Test
    void unknownDateRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/metrics/aggregate/c-1").param("dateRange", "LAST_DECADE"))
                .andExpect(status().isBadRequest());
    }
}
