package com.premiergroup.insights_sync_engine.service;

import com.premiergroup.insights_sync_engine.dto.ConversionFigure;
import com.premiergroup.insights_sync_engine.dto.meta.ActionStat;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the conversion count and value of one action type under every attribution window.
 * Never throws: absent lists, entries or keys and unparsable numbers all read as zero.
 */
@Component
@Log4j2
public class AttributionExtractor {

    public Map<AttributionWindow, ConversionFigure> extract(
            List<ActionStat> actions,
            List<ActionStat> actionValues,
            String actionType
    ) {
        ActionStat countEntry = find(actions, actionType);
        ActionStat valueEntry = find(actionValues, actionType);

        Map<AttributionWindow, ConversionFigure> figures = new EnumMap<>(AttributionWindow.class);
        for (AttributionWindow window : AttributionWindow.values()) {
            BigDecimal count = read(countEntry, window);
            BigDecimal value = read(valueEntry, window);
            figures.put(window, new ConversionFigure(MetricsNormalizer.toCount(actionType + " " + window, count), value));
        }
        return Collections.unmodifiableMap(figures);
    }

    private ActionStat find(List<ActionStat> stats, String actionType) {
        if (stats == null || actionType == null) {
            return null;
        }
        return stats.stream()
                .filter(Objects::nonNull)
                .filter(s -> actionType.equals(s.getActionType()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Window key first. Only {@code DEFAULT} falls back to the entry's {@code value}, which the
     * Graph API reports under the account's default attribution; a click-only window that is
     * missing is zero, not the total.
     */
    private BigDecimal read(ActionStat entry, AttributionWindow window) {
        if (entry == null) {
            return BigDecimal.ZERO;
        }
        String raw = entry.getWindowValues() == null ? null : entry.getWindowValues().get(window.getApiKey());
        if (raw == null && window == AttributionWindow.DEFAULT) {
            raw = entry.getValue();
        }
        return parseNonNegative(raw, entry.getActionType(), window);
    }

    private BigDecimal parseNonNegative(String raw, String actionType, AttributionWindow window) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            BigDecimal parsed = new BigDecimal(raw.trim());
            if (parsed.signum() < 0) {
                log.warn("Negative {} figure '{}' for window {}, using 0", actionType, raw, window);
                return BigDecimal.ZERO;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warn("Malformed {} figure '{}' for window {}, using 0", actionType, raw, window);
            return BigDecimal.ZERO;
        }
    }
}
