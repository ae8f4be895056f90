package com.chmonitor.client;

import com.chmonitor.model.HostConfig;
import com.chmonitor.util.ClickHouseDsnParser;
import com.chmonitor.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Builds one HikariCP pool per ClickHouse host and checks that it can hand out a valid connection.
 */
@Slf4j
@Component
public class HikariClientFactory implements PooledClientFactory {
    private static final String DRIVER_CLASS = "com.clickhouse.jdbc.ClickHouseDriver";

    private final int maximumPoolSize;
    private final int minimumIdle;
    private final long connectionTimeoutMs;

    public HikariClientFactory(
            @Value("${chmonitor.pool.maximum-pool-size:5}") int maximumPoolSize,
            @Value("${chmonitor.pool.minimum-idle:1}") int minimumIdle,
            @Value("${chmonitor.pool.connection-timeout-ms:5000}") long connectionTimeoutMs
    ) {
        this.maximumPoolSize = maximumPoolSize;
        this.minimumIdle = minimumIdle;
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    @Override
    public PooledClient create(HostConfig config) throws SQLException {
        HikariConfig hikariConfig = buildHikariConfig(config);
        HikariDataSource ds;
        try {
            ds = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            // Hikari wraps fail-fast initialization errors in PoolInitializationException
            throw new SQLException("Failed to initialize pool for host " + config.getHost() + ": " + e.getMessage(), "08001", e);
        }

        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(5)) {
                throw new SQLException("Connection is not valid", "08006");
            }
        } catch (SQLException e) {
            ds.close();
            throw e;
        }

        log.info("Created connection pool {} for host {}", hikariConfig.getPoolName(), config.getHost());
        return new JdbcPooledClient(config.getHost(), ds);
    }

    HikariConfig buildHikariConfig(HostConfig config) {
        JdbcConnectionInfo info = ClickHouseDsnParser.resolve(config);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("ch-host-" + config.getId());
        hikariConfig.setDriverClassName(DRIVER_CLASS);
        hikariConfig.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hikariConfig.setJdbcUrl(info.getUrl());
        hikariConfig.setUsername(info.getUsername() != null ? info.getUsername() : "default");
        hikariConfig.setPassword(info.getPassword() != null ? info.getPassword() : "");
        hikariConfig.setConnectionTimeout(connectionTimeoutMs);
        hikariConfig.setMaximumPoolSize(maximumPoolSize);
        hikariConfig.setMinimumIdle(minimumIdle);
        return hikariConfig;
    }
}
