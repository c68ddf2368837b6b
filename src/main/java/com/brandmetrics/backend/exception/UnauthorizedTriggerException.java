package com.brandmetrics.backend.exception;

/**
 * Trigger request did not carry the configured bearer token.
 * Raised before any tenant is processed.
 */
public class UnauthorizedTriggerException extends RuntimeException {

    public UnauthorizedTriggerException(String message) {
        super(message);
    }
}
