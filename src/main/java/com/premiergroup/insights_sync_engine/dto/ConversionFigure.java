package com.premiergroup.insights_sync_engine.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions attributed under one window: how many and what they were worth.
 */
public record ConversionFigure(long count, BigDecimal value) {

    public static final int VALUE_SCALE = 2;

    public static final ConversionFigure ZERO = new ConversionFigure(0, BigDecimal.ZERO);

    public ConversionFigure {
        if (count < 0) {
            throw new IllegalArgumentException("Conversion count must not be negative: " + count);
        }
        value = value == null ? BigDecimal.ZERO : value;
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Conversion value must not be negative: " + value);
        }
        value = value.setScale(VALUE_SCALE, RoundingMode.HALF_UP);
    }

    public ConversionFigure plus(ConversionFigure other) {
        return new ConversionFigure(count + other.count, value.add(other.value));
    }
}
