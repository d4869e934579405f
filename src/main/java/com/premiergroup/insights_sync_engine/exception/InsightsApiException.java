package com.premiergroup.insights_sync_engine.exception;

import lombok.Getter;

import java.util.Set;

/**
 * The Graph API answered with an error status. Status and body are kept verbatim.
 */
@Getter
public class InsightsApiException extends InsightsFetchException {

    // Graph API throttling codes: app, user, ads-management and business-use-case limits
    private static final Set<Integer> THROTTLING_CODES = Set.of(4, 17, 32, 613);

    private final int statusCode;
    private final String responseBody;
    private final Integer errorCode;

    public InsightsApiException(int statusCode, String responseBody, Integer errorCode) {
        super("Meta API error " + statusCode + (errorCode != null ? " (code " + errorCode + ")" : "") + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.errorCode = errorCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429
                || (errorCode != null && (THROTTLING_CODES.contains(errorCode) || (errorCode >= 80000 && errorCode <= 80014)));
    }

    @Override
    public boolean isRetryable() {
        return isRateLimited() || statusCode >= 500;
    }
}
