package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.config.MetaAdsSettings;
import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.ConversionFigure;
import com.premiergroup.insights_sync_engine.dto.MetricTotals;
import com.premiergroup.insights_sync_engine.dto.meta.ActionStat;
import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw insights rows into {@link CanonicalMetrics}. All ratio definitions live in
 * {@link #derive(MetricTotals)}; daily sync, rollups and on-demand queries go through it.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class MetricsNormalizer {

    public static final int MONEY_SCALE = 2;
    public static final int RATIO_SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final String LINK_CLICK_ACTION = "link_click";

    private final AttributionExtractor attributionExtractor;
    private final MetaAdsSettings settings;

    public CanonicalMetrics normalize(RawInsightsRecord record) {
        BigDecimal spend = parseDecimal("spend", record.getSpend());
        long impressions = parseCount("impressions", record.getImpressions());
        long reach = parseCount("reach", record.getReach());
        long clicks = parseCount("clicks", record.getClicks());
        long linkClicks = record.getInlineLinkClicks() != null
                ? parseCount("inline_link_clicks", record.getInlineLinkClicks())
                : linkClicksFromActions(record.getActions());

        Map<AttributionWindow, ConversionFigure> conversions = attributionExtractor.extract(
                record.getActions(), record.getActionValues(), settings.conversionActionType());

        CanonicalMetrics metrics = derive(new MetricTotals(spend, impressions, reach, clicks, linkClicks, conversions));
        if (hasAttributionAnomaly(metrics)) {
            log.warn("Click-only attribution exceeds default for campaign={} ad={} on {}: {}",
                    record.getCampaignId(), record.getAdId(), record.getDateStart(), metrics.conversions());
        }
        return metrics;
    }

    public CanonicalMetrics derive(MetricTotals totals) {
        BigDecimal spend = totals.spend().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        ConversionFigure primary = totals.conversion(AttributionWindow.DEFAULT);

        Map<AttributionWindow, BigDecimal> roas = new EnumMap<>(AttributionWindow.class);
        for (AttributionWindow window : AttributionWindow.values()) {
            roas.put(window, ratio(totals.conversion(window).value(), spend));
        }

        return CanonicalMetrics.builder()
                .spend(spend)
                .impressions(totals.impressions())
                .reach(totals.reach())
                .frequency(ratio(BigDecimal.valueOf(totals.impressions()), BigDecimal.valueOf(totals.reach())))
                .clicks(totals.clicks())
                .linkClicks(totals.linkClicks())
                .ctr(ratio(BigDecimal.valueOf(totals.clicks()).multiply(HUNDRED), BigDecimal.valueOf(totals.impressions())))
                .cpc(ratio(spend, BigDecimal.valueOf(totals.clicks())))
                .cpm(ratio(spend.multiply(THOUSAND), BigDecimal.valueOf(totals.impressions())))
                .costPerLinkClick(ratio(spend, BigDecimal.valueOf(totals.linkClicks())))
                .costPerConversion(ratio(spend, BigDecimal.valueOf(primary.count())))
                .conversionRate(ratio(BigDecimal.valueOf(primary.count()), BigDecimal.valueOf(totals.clicks())))
                .conversions(totals.conversions())
                .roas(roas)
                .build();
    }

    /**
     * True when a click-only window reports more conversions or value than the default
     * window, which Meta's attribution model should make impossible. Reported, never fixed.
     */
    public boolean hasAttributionAnomaly(CanonicalMetrics metrics) {
        ConversionFigure primary = metrics.conversion(AttributionWindow.DEFAULT);
        for (AttributionWindow window : AttributionWindow.values()) {
            if (!window.isClickOnly()) {
                continue;
            }
            ConversionFigure figure = metrics.conversion(window);
            if (figure.count() > primary.count() || figure.value().compareTo(primary.value()) > 0) {
                return true;
            }
        }
        return false;
    }

    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0 || numerator == null) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return numerator.divide(denominator, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    private long linkClicksFromActions(List<ActionStat> actions) {
        if (actions == null) {
            return 0;
        }
        return actions.stream()
                .filter(Objects::nonNull)
                .filter(a -> LINK_CLICK_ACTION.equals(a.getActionType()))
                .findFirst()
                .map(a -> parseCount(LINK_CLICK_ACTION, a.getValue()))
                .orElse(0L);
    }

    private BigDecimal parseDecimal(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            if (value.signum() < 0) {
                log.warn("Negative value '{}' for field {}, using 0", raw, field);
                return BigDecimal.ZERO;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Malformed value '{}' for field {}, using 0", raw, field);
            return BigDecimal.ZERO;
        }
    }

    private long parseCount(String field, String raw) {
        return toCount(field, parseDecimal(field, raw));
    }

    /**
     * Whole part of a non-negative count. Values beyond the range of a long read as zero.
     */
    static long toCount(String field, BigDecimal value) {
        try {
            return value.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            log.warn("Count '{}' for {} is out of range, using 0", value.toPlainString(), field);
            return 0L;
        }
    }
}
