package com.chmonitor.client;

import com.chmonitor.util.JdbcJsonSafe;
import com.chmonitor.util.NamedParameters;
import com.chmonitor.util.SqlFragments;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link PooledClient} backed by a JDBC {@link DataSource}, normally a HikariCP pool.
 */
@Slf4j
public class JdbcPooledClient implements PooledClient {
    private final String host;
    private final DataSource dataSource;
    private final AutoCloseable closeable;

    public JdbcPooledClient(String host, DataSource dataSource) {
        this.host = host;
        this.dataSource = dataSource;
        this.closeable = dataSource instanceof AutoCloseable c ? c : null;
    }

    @Override
    public ClientQueryResult query(String sql, Map<String, ?> params, Map<String, ?> settings) throws SQLException {
        NamedParameters.ParsedSql parsed = NamedParameters.parse(sql);
        List<Object> values = parsed.bind(params);

        // Correlation id, searchable in system.query_log through the statement comment
        String queryId = UUID.randomUUID().toString();
        String statement = SqlFragments.QUERY_COMMENT
                + "/* query_id=" + queryId + " */ "
                + SqlFragments.appendSettings(parsed.getJdbcSql(), settings);

        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(statement)) {
            for (int i = 0; i < values.size(); i++) {
                ps.setObject(i + 1, values.get(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            boolean hasResultSet = ps.execute();
            if (hasResultSet) {
                try (ResultSet rs = ps.getResultSet()) {
                    readRows(rs, rows);
                }
            }
            long duration = System.currentTimeMillis() - startTime;
            long rowCount = hasResultSet ? rows.size() : Math.max(ps.getUpdateCount(), 0);

            log.debug("Query {} on {} returned {} rows in {} ms", queryId, host, rowCount, duration);
            return ClientQueryResult.builder()
                    .rows(rows)
                    .rowCount(rowCount)
                    .durationMs(duration)
                    .queryId(queryId)
                    .build();
        }
    }

    private void readRows(ResultSet rs, List<Map<String, Object>> rows) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(rsmd.getColumnLabel(i), JdbcJsonSafe.readJsonSafeValue(rs, i));
            }
            rows.add(row);
        }
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public void close() {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Failed to close client for host {}", host, e);
        }
    }
}
