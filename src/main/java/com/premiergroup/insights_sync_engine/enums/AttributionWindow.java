package com.premiergroup.insights_sync_engine.enums;

import java.util.Arrays;
import java.util.List;

/**
 * Attribution windows requested from the insights endpoint. {@code DEFAULT} is Meta's
 * account-level setting (7-day click plus 1-day view), so it should always be at least as
 * large as any click-only window of the same record.
 */
public enum AttributionWindow {
    DEFAULT("default"),
    ONE_DAY_CLICK("1d_click"),
    SEVEN_DAY_CLICK("7d_click"),
    ONE_DAY_VIEW("1d_view");

    private final String apiKey;

    AttributionWindow(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isClickOnly() {
        return this == ONE_DAY_CLICK || this == SEVEN_DAY_CLICK;
    }

    public static List<String> apiKeys() {
        return Arrays.stream(values()).map(AttributionWindow::getApiKey).toList();
    }
}
