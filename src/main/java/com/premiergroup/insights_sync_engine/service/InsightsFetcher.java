package com.premiergroup.insights_sync_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.insights_sync_engine.config.MetaAdsSettings;
import com.premiergroup.insights_sync_engine.dto.meta.InsightsPage;
import com.premiergroup.insights_sync_engine.dto.meta.InsightsQuery;
import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.exception.InsightsApiException;
import com.premiergroup.insights_sync_engine.exception.InsightsResponseException;
import com.premiergroup.insights_sync_engine.exception.InsightsTransportException;
import com.premiergroup.insights_sync_engine.exception.PaginationLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads the {@code /act_{id}/insights} edge of the Graph API, following pagination to the
 * end. Every request asks for all known attribution windows and filters out zero-spend rows
 * on the server.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class InsightsFetcher {

    static final List<String> FIELDS = List.of(
            "account_id", "account_name",
            "campaign_id", "campaign_name",
            "adset_id", "adset_name",
            "ad_id", "ad_name",
            "date_start", "date_stop",
            "spend", "impressions", "reach", "frequency",
            "clicks", "inline_link_clicks", "ctr", "cpc", "cpm",
            "actions", "action_values"
    );

    private final RestClient metaGraphRestClient;
    private final MetaAdsSettings settings;
    private final ObjectMapper objectMapper;

    public List<RawInsightsRecord> fetch(InsightsQuery query) {
        Map<String, Object> params = queryParameters(query);
        log.debug("Fetching {} insights {}..{}", query.level(), query.since(), query.until());

        InsightsPage page = call(() -> metaGraphRestClient.get()
                .uri(builder -> {
                    builder.path(settings.insightsPath());
                    params.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
                    return builder.build(params);
                })
                .retrieve()
                .body(InsightsPage.class));

        List<RawInsightsRecord> records = new ArrayList<>();
        int pages = 1;
        while (true) {
            if (page != null && page.data() != null) {
                records.addAll(page.data());
            }
            String next = page == null ? null : page.nextPageUrl();
            if (next == null) {
                break;
            }
            if (pages >= settings.maxPages()) {
                log.error("Insights pagination for {} {}..{} exceeded {} pages",
                        query.level(), query.since(), query.until(), settings.maxPages());
                throw new PaginationLimitExceededException(settings.maxPages(), records.size());
            }
            page = call(() -> metaGraphRestClient.get()
                    .uri(URI.create(next))
                    .retrieve()
                    .body(InsightsPage.class));
            pages++;
        }

        log.info("Fetched {} {} insight rows for {}..{} in {} page(s)",
                records.size(), query.level(), query.since(), query.until(), pages);
        return records;
    }

    Map<String, Object> queryParameters(InsightsQuery query) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("access_token", settings.accessToken());
        params.put("level", query.level().getApiValue());
        Map<String, String> timeRange = new LinkedHashMap<>();
        timeRange.put("since", query.since().format(DateTimeFormatter.ISO_LOCAL_DATE));
        timeRange.put("until", query.until().format(DateTimeFormatter.ISO_LOCAL_DATE));
        params.put("time_range", toJson(timeRange));
        params.put("time_increment", 1);
        params.put("fields", String.join(",", FIELDS));
        // omitting a window here silently degrades the response to default-only figures
        params.put("action_attribution_windows", toJson(AttributionWindow.apiKeys()));
        params.put("filtering", toJson(filtering(query)));
        if (!query.breakdowns().isEmpty()) {
            params.put("breakdowns", String.join(",", query.breakdowns()));
        }
        params.put("limit", settings.pageLimit());
        return params;
    }

    private List<Map<String, Object>> filtering(InsightsQuery query) {
        List<Map<String, Object>> filters = new ArrayList<>();
        filters.add(filter("spend", "GREATER_THAN", 0));
        if (!query.entityIds().isEmpty()) {
            filters.add(filter(query.level().getApiValue() + ".id", "IN", query.entityIds()));
        }
        return filters;
    }

    private Map<String, Object> filter(String field, String operator, Object value) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("field", field);
        filter.put("operator", operator);
        filter.put("value", value);
        return filter;
    }

    private InsightsPage call(Supplier<InsightsPage> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            String body = e.getResponseBodyAsString();
            InsightsApiException apiException = new InsightsApiException(e.getStatusCode().value(), body, graphErrorCode(body));
            log.error("Meta API rejected insights request: status={}, retryable={}, body={}",
                    apiException.getStatusCode(), apiException.isRetryable(), body);
            throw apiException;
        } catch (ResourceAccessException e) {
            log.error("Transport failure calling Meta API: {}", e.getMessage());
            throw new InsightsTransportException("Meta API unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Unreadable insights response from Meta API: {}", e.getMessage());
            throw new InsightsResponseException("Unreadable Meta API response: " + e.getMessage(), e);
        }
    }

    private Integer graphErrorCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).path("error").path("code");
            return code.isNumber() ? code.intValue() : null;
        } catch (JsonProcessingException e) {
            log.debug("Meta API error body is not JSON: {}", body);
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode insights parameter " + value, e);
        }
    }
}
