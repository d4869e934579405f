package com.premiergroup.insights_sync_engine.exception;

import lombok.Getter;

@Getter
public class PaginationLimitExceededException extends InsightsFetchException {

    private final int maxPages;

    public PaginationLimitExceededException(int maxPages, int recordsSoFar) {
        super("Insights pagination exceeded " + maxPages + " pages (" + recordsSoFar + " records read)");
        this.maxPages = maxPages;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
