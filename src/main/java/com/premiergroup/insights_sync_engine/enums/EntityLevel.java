package com.premiergroup.insights_sync_engine.enums;

import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;

public enum EntityLevel {
    ACCOUNT,
    CAMPAIGN,
    ADSET,
    AD;

    public String getApiValue() {
        return name().toLowerCase();
    }

    /**
     * Identifier of the row's own entity at this level.
     */
    public String entityIdOf(RawInsightsRecord record) {
        return switch (this) {
            case ACCOUNT -> record.getAccountId();
            case CAMPAIGN -> record.getCampaignId();
            case ADSET -> record.getAdsetId();
            case AD -> record.getAdId();
        };
    }

    public String entityNameOf(RawInsightsRecord record) {
        return switch (this) {
            case ACCOUNT -> record.getAccountName();
            case CAMPAIGN -> record.getCampaignName();
            case ADSET -> record.getAdsetName();
            case AD -> record.getAdName();
        };
    }

    /**
     * Identifier of the enclosing entity, or null for the account itself.
     */
    public String parentIdOf(RawInsightsRecord record) {
        return switch (this) {
            case ACCOUNT -> null;
            case CAMPAIGN -> record.getAccountId();
            case ADSET -> record.getCampaignId();
            case AD -> record.getAdsetId() != null ? record.getAdsetId() : record.getCampaignId();
        };
    }
}
