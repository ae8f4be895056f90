package com.chmonitor.web;

import com.chmonitor.model.FetchErrorType;
import org.springframework.http.HttpStatus;

/**
 * HTTP presentation of {@link FetchErrorType}.
 */
public final class FetchErrorStatusMapper {

    private FetchErrorStatusMapper() {
    }

    public static HttpStatus status(FetchErrorType type) {
        if (type == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (type) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case PERMISSION_ERROR -> HttpStatus.FORBIDDEN;
            case TABLE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NETWORK_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case QUERY_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static boolean isClientError(FetchErrorType type) {
        return status(type).is4xxClientError();
    }

    public static boolean isServerError(FetchErrorType type) {
        return status(type).is5xxServerError();
    }

    /**
     * Short operator-facing explanation of an error kind.
     *
     * @param type error kind
     * @return description
     */
    public static String describe(FetchErrorType type) {
        if (type == null) {
            return "An unexpected error occurred.";
        }
        return switch (type) {
            case TABLE_NOT_FOUND -> "A required table is not available on this ClickHouse host.";
            case PERMISSION_ERROR -> "The configured ClickHouse user is not allowed to run this query.";
            case NETWORK_ERROR -> "The ClickHouse host could not be reached.";
            case VALIDATION_ERROR -> "The request is invalid.";
            case QUERY_ERROR -> "ClickHouse rejected or failed to run the query.";
        };
    }
}
