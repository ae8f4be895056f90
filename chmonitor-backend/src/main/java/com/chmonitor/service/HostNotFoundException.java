package com.chmonitor.service;

/**
 * Thrown when a host id is malformed or does not match a configured host.
 */
public class HostNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public HostNotFoundException(String message) {
        super(message);
    }
}
