package com.premiergroup.insights_sync_engine.exception;

/**
 * Base of every failure raised while reading the insights endpoint.
 */
public abstract class InsightsFetchException extends RuntimeException {

    protected InsightsFetchException(String message) {
        super(message);
    }

    protected InsightsFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same request later may succeed.
     */
    public abstract boolean isRetryable();
}
