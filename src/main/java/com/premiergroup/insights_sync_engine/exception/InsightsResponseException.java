package com.premiergroup.insights_sync_engine.exception;

/**
 * The endpoint answered with a success status but a body that could not be read as an insights page.
 */
public class InsightsResponseException extends InsightsFetchException {

    public InsightsResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
