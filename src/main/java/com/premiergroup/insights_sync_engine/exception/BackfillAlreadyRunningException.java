package com.premiergroup.insights_sync_engine.exception;

public class BackfillAlreadyRunningException extends RuntimeException {

    public BackfillAlreadyRunningException(String message) {
        super(message);
    }
}
