package com.chmonitor.client;

import com.chmonitor.model.HostConfig;

import java.sql.SQLException;

@FunctionalInterface
public interface PooledClientFactory {

    /**
     * Creates a ready-to-use client, failing when the host cannot be reached.
     *
     * @param config host configuration
     * @return client bound to the host
     * @throws SQLException when the connection cannot be established
     */
    PooledClient create(HostConfig config) throws SQLException;
}
