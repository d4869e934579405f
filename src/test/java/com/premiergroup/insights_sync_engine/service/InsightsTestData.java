package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.config.MetaAdsSettings;
import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.ConversionFigure;
import com.premiergroup.insights_sync_engine.dto.MetricTotals;
import com.premiergroup.insights_sync_engine.dto.meta.ActionStat;
import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Builders shared by the service tests.
 */
final class InsightsTestData {

    static final MetaAdsSettings SETTINGS = new MetaAdsSettings(
            "test-token", "v18.0", "https://graph.example.test", "act_123", "purchase", 2, 3);

    private InsightsTestData() {
    }

    static MetricsNormalizer normalizer() {
        return new MetricsNormalizer(new AttributionExtractor(), SETTINGS);
    }

    static RawInsightsRecord campaignRecord(String campaignId, LocalDate day, String spend, String purchases, String purchaseValue) {
        return RawInsightsRecord.builder()
                .accountId("123")
                .accountName("Acme")
                .campaignId(campaignId)
                .campaignName("Campaign " + campaignId)
                .dateStart(day.toString())
                .dateStop(day.toString())
                .spend(spend)
                .impressions("1000")
                .reach("800")
                .clicks("50")
                .inlineLinkClicks("40")
                .actions(List.of(
                        new ActionStat("link_click", "40"),
                        new ActionStat("purchase", purchases)
                                .withWindow("default", purchases)
                                .withWindow("7d_click", purchases)))
                .actionValues(List.of(
                        new ActionStat("purchase", purchaseValue)
                                .withWindow("default", purchaseValue)
                                .withWindow("7d_click", purchaseValue)))
                .build();
    }

    /**
     * Canonical metrics as the normalizer would produce them for the given additive figures.
     */
    static CanonicalMetrics metrics(String spend, long conversions, String conversionValue) {
        MetricTotals totals = new MetricTotals(
                new BigDecimal(spend), 1000, 800, 50, 40,
                Map.of(AttributionWindow.DEFAULT, new ConversionFigure(conversions, new BigDecimal(conversionValue))));
        return normalizer().derive(totals);
    }
}
