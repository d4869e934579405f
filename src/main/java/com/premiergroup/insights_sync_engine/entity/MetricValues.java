package com.premiergroup.insights_sync_engine.entity;

import com.premiergroup.insights_sync_engine.dto.CanonicalMetrics;
import com.premiergroup.insights_sync_engine.dto.ConversionFigure;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Column layout of a {@link CanonicalMetrics} snapshot, shared by the daily, weekly and
 * monthly tables. One count/value/ROAS column triple per attribution window.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricValues {

    @Column(precision = 14, scale = 2)
    private BigDecimal spend;

    private long impressions;
    private long reach;

    @Column(precision = 12, scale = 4)
    private BigDecimal frequency;

    private long clicks;

    @Column(name = "link_clicks")
    private long linkClicks;

    @Column(precision = 12, scale = 4)
    private BigDecimal ctr;

    @Column(precision = 14, scale = 4)
    private BigDecimal cpc;

    @Column(precision = 14, scale = 4)
    private BigDecimal cpm;

    @Column(name = "cost_per_link_click", precision = 14, scale = 4)
    private BigDecimal costPerLinkClick;

    @Column(name = "cost_per_conversion", precision = 14, scale = 4)
    private BigDecimal costPerConversion;

    @Column(name = "conversion_rate", precision = 12, scale = 4)
    private BigDecimal conversionRate;

    @Column(name = "default_conversions")
    private long defaultConversions;

    @Column(name = "default_conversion_value", precision = 14, scale = 2)
    private BigDecimal defaultConversionValue;

    @Column(name = "default_roas", precision = 12, scale = 4)
    private BigDecimal defaultRoas;

    @Column(name = "click_1d_conversions")
    private long click1dConversions;

    @Column(name = "click_1d_conversion_value", precision = 14, scale = 2)
    private BigDecimal click1dConversionValue;

    @Column(name = "click_1d_roas", precision = 12, scale = 4)
    private BigDecimal click1dRoas;

    @Column(name = "click_7d_conversions")
    private long click7dConversions;

    @Column(name = "click_7d_conversion_value", precision = 14, scale = 2)
    private BigDecimal click7dConversionValue;

    @Column(name = "click_7d_roas", precision = 12, scale = 4)
    private BigDecimal click7dRoas;

    @Column(name = "view_1d_conversions")
    private long view1dConversions;

    @Column(name = "view_1d_conversion_value", precision = 14, scale = 2)
    private BigDecimal view1dConversionValue;

    @Column(name = "view_1d_roas", precision = 12, scale = 4)
    private BigDecimal view1dRoas;

    public static MetricValues from(CanonicalMetrics m) {
        MetricValues values = MetricValues.builder()
                .spend(m.spend())
                .impressions(m.impressions())
                .reach(m.reach())
                .frequency(m.frequency())
                .clicks(m.clicks())
                .linkClicks(m.linkClicks())
                .ctr(m.ctr())
                .cpc(m.cpc())
                .cpm(m.cpm())
                .costPerLinkClick(m.costPerLinkClick())
                .costPerConversion(m.costPerConversion())
                .conversionRate(m.conversionRate())
                .build();
        for (AttributionWindow window : AttributionWindow.values()) {
            values.setWindow(window, m.conversion(window), m.roas(window));
        }
        return values;
    }

    public CanonicalMetrics toCanonical() {
        Map<AttributionWindow, ConversionFigure> conversions = new EnumMap<>(AttributionWindow.class);
        Map<AttributionWindow, BigDecimal> roas = new EnumMap<>(AttributionWindow.class);
        conversions.put(AttributionWindow.DEFAULT, new ConversionFigure(defaultConversions, defaultConversionValue));
        conversions.put(AttributionWindow.ONE_DAY_CLICK, new ConversionFigure(click1dConversions, click1dConversionValue));
        conversions.put(AttributionWindow.SEVEN_DAY_CLICK, new ConversionFigure(click7dConversions, click7dConversionValue));
        conversions.put(AttributionWindow.ONE_DAY_VIEW, new ConversionFigure(view1dConversions, view1dConversionValue));
        roas.put(AttributionWindow.DEFAULT, zeroIfNull(defaultRoas));
        roas.put(AttributionWindow.ONE_DAY_CLICK, zeroIfNull(click1dRoas));
        roas.put(AttributionWindow.SEVEN_DAY_CLICK, zeroIfNull(click7dRoas));
        roas.put(AttributionWindow.ONE_DAY_VIEW, zeroIfNull(view1dRoas));

        return CanonicalMetrics.builder()
                .spend(zeroIfNull(spend))
                .impressions(impressions)
                .reach(reach)
                .frequency(zeroIfNull(frequency))
                .clicks(clicks)
                .linkClicks(linkClicks)
                .ctr(zeroIfNull(ctr))
                .cpc(zeroIfNull(cpc))
                .cpm(zeroIfNull(cpm))
                .costPerLinkClick(zeroIfNull(costPerLinkClick))
                .costPerConversion(zeroIfNull(costPerConversion))
                .conversionRate(zeroIfNull(conversionRate))
                .conversions(conversions)
                .roas(roas)
                .build();
    }

    private void setWindow(AttributionWindow window, ConversionFigure figure, BigDecimal windowRoas) {
        switch (window) {
            case DEFAULT -> {
                defaultConversions = figure.count();
                defaultConversionValue = figure.value();
                defaultRoas = windowRoas;
            }
            case ONE_DAY_CLICK -> {
                click1dConversions = figure.count();
                click1dConversionValue = figure.value();
                click1dRoas = windowRoas;
            }
            case SEVEN_DAY_CLICK -> {
                click7dConversions = figure.count();
                click7dConversionValue = figure.value();
                click7dRoas = windowRoas;
            }
            case ONE_DAY_VIEW -> {
                view1dConversions = figure.count();
                view1dConversionValue = figure.value();
                view1dRoas = windowRoas;
            }
        }
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
