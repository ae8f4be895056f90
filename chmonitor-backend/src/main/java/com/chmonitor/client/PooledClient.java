package com.chmonitor.client;

import java.sql.SQLException;
import java.util.Map;

/**
 * Long-lived handle to one ClickHouse host, shared by every caller targeting that host.
 */
public interface PooledClient extends AutoCloseable {

    /**
     * Runs a statement and returns all rows.
     *
     * @param sql statement with {@code {name: Type}} placeholders
     * @param params named parameter bindings
     * @param settings ClickHouse settings applied to this statement only
     * @return rows and execution metadata
     * @throws SQLException when the driver or the server reports a failure
     */
    ClientQueryResult query(String sql, Map<String, ?> params, Map<String, ?> settings) throws SQLException;

    /**
     * @return address of the host this client is bound to
     */
    String getHost();

    @Override
    void close();
}
