package com.premiergroup.insights_sync_engine.exception;

/**
 * Network failure or timeout before a response was received.
 */
public class InsightsTransportException extends InsightsFetchException {

    public InsightsTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
