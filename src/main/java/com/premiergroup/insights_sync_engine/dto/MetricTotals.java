package com.premiergroup.insights_sync_engine.dto;

import com.premiergroup.insights_sync_engine.enums.AttributionWindow;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The additive part of a metrics snapshot. Everything else in {@link CanonicalMetrics}
 * is derived from these figures, which is what makes rollups re-derivable from daily rows.
 */
public record MetricTotals(
        BigDecimal spend,
        long impressions,
        long reach,
        long clicks,
        long linkClicks,
        Map<AttributionWindow, ConversionFigure> conversions
) {

    public static final MetricTotals ZERO =
            new MetricTotals(BigDecimal.ZERO, 0, 0, 0, 0, Map.of());

    public MetricTotals {
        spend = spend == null ? BigDecimal.ZERO : spend;
        Map<AttributionWindow, ConversionFigure> complete = new EnumMap<>(AttributionWindow.class);
        for (AttributionWindow window : AttributionWindow.values()) {
            ConversionFigure figure = conversions == null ? null : conversions.get(window);
            complete.put(window, figure == null ? ConversionFigure.ZERO : figure);
        }
        conversions = Collections.unmodifiableMap(complete);
    }

    public ConversionFigure conversion(AttributionWindow window) {
        return conversions.get(window);
    }

    public MetricTotals plus(MetricTotals other) {
        Map<AttributionWindow, ConversionFigure> summed = new EnumMap<>(AttributionWindow.class);
        for (AttributionWindow window : AttributionWindow.values()) {
            summed.put(window, conversion(window).plus(other.conversion(window)));
        }
        return new MetricTotals(
                spend.add(other.spend),
                impressions + other.impressions,
                reach + other.reach,
                clicks + other.clicks,
                linkClicks + other.linkClicks,
                summed);
    }
}
