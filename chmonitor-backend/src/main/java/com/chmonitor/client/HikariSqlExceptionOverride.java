package com.chmonitor.client;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * Keeps pooled ClickHouse connections alive when the server rejects a single statement.
 *
 * <p>Unknown tables, missing privileges, syntax errors and server-side timeouts are statement
 * failures; the HTTP connection underneath is still usable.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    private static final Set<Integer> STATEMENT_LEVEL_CODES = Set.of(
            47,  // UNKNOWN_IDENTIFIER
            60,  // UNKNOWN_TABLE
            62,  // SYNTAX_ERROR
            81,  // UNKNOWN_DATABASE
            159, // TIMEOUT_EXCEEDED
            164, // READONLY
            241, // MEMORY_LIMIT_EXCEEDED
            394, // QUERY_WAS_CANCELLED
            497  // ACCESS_DENIED
    );

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        if (STATEMENT_LEVEL_CODES.contains(sqlException.getErrorCode())) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42"))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
