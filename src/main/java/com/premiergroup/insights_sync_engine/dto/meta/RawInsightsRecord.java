package com.premiergroup.insights_sync_engine.dto.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One row of the Graph API insights response. Numbers arrive as strings and any field
 * may be missing; nothing here is validated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawInsightsRecord {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("account_name")
    private String accountName;

    @JsonProperty("campaign_id")
    private String campaignId;

    @JsonProperty("campaign_name")
    private String campaignName;

    @JsonProperty("adset_id")
    private String adsetId;

    @JsonProperty("adset_name")
    private String adsetName;

    @JsonProperty("ad_id")
    private String adId;

    @JsonProperty("ad_name")
    private String adName;

    @JsonProperty("date_start")
    private String dateStart;

    @JsonProperty("date_stop")
    private String dateStop;

    private String spend;
    private String impressions;
    private String reach;
    private String frequency;
    private String clicks;

    @JsonProperty("inline_link_clicks")
    private String inlineLinkClicks;

    private String ctr;
    private String cpc;
    private String cpm;

    private List<ActionStat> actions;

    @JsonProperty("action_values")
    private List<ActionStat> actionValues;
}
