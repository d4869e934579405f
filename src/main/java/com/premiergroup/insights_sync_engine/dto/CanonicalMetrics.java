package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Normalized metrics of one entity over one date range. Built only by
 * {@code MetricsNormalizer}; every window is always present in both maps.
 */
@Builder(toBuilder = true)
public record CanonicalMetrics(
        BigDecimal spend,
        long impressions,
        long reach,
        BigDecimal frequency,
        long clicks,
        long linkClicks,
        BigDecimal ctr,
        BigDecimal cpc,
        BigDecimal cpm,
        BigDecimal costPerLinkClick,
        BigDecimal costPerConversion,
        BigDecimal conversionRate,
        Map<AttributionWindow, ConversionFigure> conversions,
        Map<AttributionWindow, BigDecimal> roas
) {

    public CanonicalMetrics {
        Map<AttributionWindow, ConversionFigure> conversionCopy = new EnumMap<>(AttributionWindow.class);
        conversionCopy.putAll(conversions);
        Map<AttributionWindow, BigDecimal> roasCopy = new EnumMap<>(AttributionWindow.class);
        roasCopy.putAll(roas);
        conversions = Collections.unmodifiableMap(conversionCopy);
        roas = Collections.unmodifiableMap(roasCopy);
    }

    public ConversionFigure conversion(AttributionWindow window) {
        return conversions.getOrDefault(window, ConversionFigure.ZERO);
    }

    public BigDecimal roas(AttributionWindow window) {
        return roas.getOrDefault(window, BigDecimal.ZERO);
    }

    public MetricTotals totals() {
        return new MetricTotals(spend, impressions, reach, clicks, linkClicks, conversions);
    }
}
