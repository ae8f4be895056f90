package com.chmonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure kinds returned by the query executor.
 */
public enum FetchErrorType {
    TABLE_NOT_FOUND("table_not_found"),
    PERMISSION_ERROR("permission_error"),
    NETWORK_ERROR("network_error"),
    VALIDATION_ERROR("validation_error"),
    QUERY_ERROR("query_error");

    private final String wireName;

    FetchErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
