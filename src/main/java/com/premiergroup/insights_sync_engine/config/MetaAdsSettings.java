package com.premiergroup.insights_sync_engine.config;

/**
 * Connection and contract settings for the Meta Marketing API, passed explicitly to every
 * component that talks to it.
 */
public record MetaAdsSettings(
        String accessToken,
        String apiVersion,
        String baseUrl,
        String adAccountId,
        String conversionActionType,
        int pageLimit,
        int maxPages
) {

    public MetaAdsSettings {
        if (adAccountId == null || adAccountId.isBlank()) {
            throw new IllegalArgumentException("meta.ads.ad-account-id must be set");
        }
        if (pageLimit <= 0 || maxPages <= 0) {
            throw new IllegalArgumentException("meta.ads.page-limit and meta.ads.max-pages must be positive");
        }
        adAccountId = adAccountId.startsWith("act_") ? adAccountId.substring(4) : adAccountId;
    }

    public String insightsPath() {
        return "/" + apiVersion + "/act_" + adAccountId + "/insights";
    }
}
