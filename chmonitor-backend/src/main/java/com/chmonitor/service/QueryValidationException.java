package com.chmonitor.service;

/**
 * Thrown when a request is malformed before anything is sent to a host.
 */
public class QueryValidationException extends RuntimeException {
    public QueryValidationException(String message) {
        super(message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
