package com.premiergroup.insights_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.insights_sync_engine.dto.meta.InsightsQuery;
import com.premiergroup.insights_sync_engine.dto.meta.RawInsightsRecord;
import com.premiergroup.insights_sync_engine.enums.AttributionWindow;
import com.premiergroup.insights_sync_engine.enums.EntityLevel;
import com.premiergroup.insights_sync_engine.exception.InsightsApiException;
import com.premiergroup.insights_sync_engine.exception.InsightsFetchException;
import com.premiergroup.insights_sync_engine.exception.InsightsResponseException;
import com.premiergroup.insights_sync_engine.exception.InsightsTransportException;
import com.premiergroup.insights_sync_engine.exception.PaginationLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class InsightsFetcherTest {

    private static final String INSIGHTS_URL = "https://graph.example.test/v18.0/act_123/insights";
    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockRestServiceServer server;
    private InsightsFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://graph.example.test");
        server = MockRestServiceServer.bindTo(builder).build();
        fetcher = new InsightsFetcher(builder.build(), InsightsTestData.SETTINGS, objectMapper);
    }

    @Test
    void requestsEveryAttributionWindowAndFiltersZeroSpend() throws Exception {
        InsightsQuery query = new InsightsQuery(DAY, DAY, EntityLevel.AD, List.of("age"), List.of("a-1", "a-2"));

        Map<String, Object> params = fetcher.queryParameters(query);

        assertEquals("test-token", params.get("access_token"));
        assertEquals("ad", params.get("level"));
        assertEquals("{\"since\":\"2024-01-15\",\"until\":\"2024-01-15\"}", params.get("time_range"));
        assertEquals(1, params.get("time_increment"));
        assertEquals(2, params.get("limit"));
        assertEquals("age", params.get("breakdowns"));

        JsonNode windows = objectMapper.readTree((String) params.get("action_attribution_windows"));
        assertEquals(AttributionWindow.values().length, windows.size());
        for (AttributionWindow window : AttributionWindow.values()) {
            assertTrue(windows.toString().contains("\"" + window.getApiKey() + "\""), window.getApiKey());
        }

        JsonNode filtering = objectMapper.readTree((String) params.get("filtering"));
        assertEquals("spend", filtering.get(0).get("field").asText());
        assertEquals("GREATER_THAN", filtering.get(0).get("operator").asText());
        assertEquals(0, filtering.get(0).get("value").asInt());
        assertEquals("ad.id", filtering.get(1).get("field").asText());
        assertEquals("IN", filtering.get(1).get("operator").asText());
        assertEquals(2, filtering.get(1).get("value").size());

        String fields = (String) params.get("fields");
        assertTrue(fields.contains("actions"));
        assertTrue(fields.contains("action_values"));
        assertTrue(fields.contains("inline_link_clicks"));
    }

    @Test
    void singleDayQueryHasNoBreakdownsOrIdFilter() throws Exception {
        Map<String, Object> params = fetcher.queryParameters(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN));

        assertFalse(params.containsKey("breakdowns"));
        assertEquals(1, objectMapper.readTree((String) params.get("filtering")).size());
    }

    @Test
    void followsPagingUntilNoNextLink() {
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("level", "campaign"))
                .andExpect(queryParam("access_token", "test-token"))
                .andRespond(withSuccess("""
                        {"data":[{"campaign_id":"c-1","spend":"10.00","date_start":"2024-01-15"},
                                 {"campaign_id":"c-2","spend":"20.00","date_start":"2024-01-15"}],
                         "paging":{"cursors":{"before":"a","after":"b"},"next":"%s?after=b"}}
                        """.formatted(INSIGHTS_URL), MediaType.APPLICATION_JSON));
        server.expect(requestTo(INSIGHTS_URL + "?after=b"))
                .andRespond(withSuccess("""
                        {"data":[{"campaign_id":"c-3","spend":"30.00","date_start":"2024-01-15",
                                  "actions":[{"action_type":"purchase","value":"2","7d_click":"1"}]}],
                         "paging":{"cursors":{"before":"b","after":"c"}}}
                        """, MediaType.APPLICATION_JSON));

        List<RawInsightsRecord> records = fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN));

        assertEquals(3, records.size());
        assertEquals("c-3", records.get(2).getCampaignId());
        assertEquals("1", records.get(2).getActions().get(0).getWindowValues().get("7d_click"));
        server.verify();
    }

    @Test
    void emptyDayReturnsNoRecords() {
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertTrue(fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)).isEmpty());
    }

    @Test
    void tooManyPagesFailsInsteadOfLooping() {
        String endlessPage = """
                {"data":[{"campaign_id":"c-1","spend":"1"}],"paging":{"next":"%s?after=x"}}
                """.formatted(INSIGHTS_URL);
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withSuccess(endlessPage, MediaType.APPLICATION_JSON));
        server.expect(requestTo(INSIGHTS_URL + "?after=x"))
                .andRespond(withSuccess(endlessPage, MediaType.APPLICATION_JSON));
        server.expect(requestTo(INSIGHTS_URL + "?after=x"))
                .andRespond(withSuccess(endlessPage, MediaType.APPLICATION_JSON));

        PaginationLimitExceededException ex = assertThrows(PaginationLimitExceededException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));

        assertEquals(3, ex.getMaxPages());
        assertFalse(ex.isRetryable());
    }

    @Test
    void invalidParameterIsPermanentFailure() {
        String body = "{\"error\":{\"message\":\"Invalid parameter\",\"type\":\"OAuthException\",\"code\":100}}";
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withBadRequest().body(body).contentType(MediaType.APPLICATION_JSON));

        InsightsApiException ex = assertThrows(InsightsApiException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));

        assertEquals(400, ex.getStatusCode());
        assertEquals(100, ex.getErrorCode());
        assertEquals(body, ex.getResponseBody());
        assertFalse(ex.isRetryable());
    }

    @Test
    void throttlingIsRetryable() {
        String body = "{\"error\":{\"message\":\"User request limit reached\",\"code\":17}}";
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body(body).contentType(MediaType.APPLICATION_JSON));

        InsightsApiException ex = assertThrows(InsightsApiException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));

        assertTrue(ex.isRateLimited());
        assertTrue(ex.isRetryable());
    }

    @Test
    void tooManyRequestsAndServerErrorsAreRetryable() {
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withTooManyRequests());

        InsightsFetchException throttled = assertThrows(InsightsFetchException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));
        assertTrue(throttled.isRetryable());

        server.reset();
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withServerError().body("not json"));

        InsightsApiException serverError = assertThrows(InsightsApiException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));
        assertEquals(500, serverError.getStatusCode());
        assertNull(serverError.getErrorCode());
        assertTrue(serverError.isRetryable());
    }

    @Test
    void timeoutIsRetryableTransportFailure() {
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        InsightsTransportException ex = assertThrows(InsightsTransportException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));

        assertTrue(ex.isRetryable());
    }

    @Test
    void unreadableSuccessBodyIsPermanentResponseFailure() {
        server.expect(requestTo(startsWith(INSIGHTS_URL)))
                .andRespond(withSuccess("<html>gateway hiccup</html>", MediaType.APPLICATION_JSON));

        InsightsFetchException ex = assertThrows(InsightsResponseException.class,
                () -> fetcher.fetch(InsightsQuery.singleDay(DAY, EntityLevel.CAMPAIGN)));

        assertFalse(ex.isRetryable());
        assertTrue(ex.getMessage().startsWith("Unreadable Meta API response"));
    }
}
