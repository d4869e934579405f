package com.premiergroup.insights_sync_engine.dto.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightsPage(List<RawInsightsRecord> data, Paging paging) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Paging(Cursors cursors, String next) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cursors(String before, String after) {
    }

    public String nextPageUrl() {
        return paging == null || paging.next() == null || paging.next().isBlank() ? null : paging.next();
    }
}
