package com.chmonitor.service;

/**
 * Thrown when a named query or menu count key is not registered.
 */
public class QueryDefinitionNotFoundException extends RuntimeException {
    public QueryDefinitionNotFoundException(String message) {
        super(message);
    }
}
