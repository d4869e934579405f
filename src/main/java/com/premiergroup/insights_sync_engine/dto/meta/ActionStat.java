package com.premiergroup.insights_sync_engine.dto.meta;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry of {@code actions} / {@code action_values}. The per-window figures come back as
 * sibling keys named after the window ({@code "7d_click": "3"}), so they are collected
 * into {@link #windowValues}.
 */
@Data
@NoArgsConstructor
public class ActionStat {

    @JsonProperty("action_type")
    private String actionType;

    private String value;

    private Map<String, String> windowValues = new LinkedHashMap<>();

    public ActionStat(String actionType, String value) {
        this.actionType = actionType;
        this.value = value;
    }

    public ActionStat withWindow(String windowKey, String windowValue) {
        windowValues.put(windowKey, windowValue);
        return this;
    }

    @JsonAnySetter
    public void putWindowValue(String key, Object raw) {
        windowValues.put(key, raw == null ? null : String.valueOf(raw));
    }

    @JsonAnyGetter
    public Map<String, String> getWindowValues() {
        return windowValues;
    }
}
