package com.chmonitor.client;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcPooledClientTest {

    @Test
    void bindsParametersAndReadsRowsByLabel() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.execute()).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("count");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(7L);

        JdbcPooledClient client = new JdbcPooledClient("http://ch:8123", dataSource);
        ClientQueryResult result = client.query(
                "SELECT count() AS count FROM system.tables WHERE database = {database: String}",
                Map.of("database", "system"),
                Map.of("max_execution_time", 60));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .startsWith("/* { \"client\": \"chmonitor\" } */ /* query_id=" + result.getQueryId() + " */ ")
                .endsWith("WHERE database = ?\nSETTINGS max_execution_time = 60");
        verify(statement).setObject(1, "system");
        assertThat(result.getRows()).containsExactly(Map.of("count", 7L));
        assertThat(result.getRowCount()).isEqualTo(1);
        verify(connection).close();
    }

    @Test
    void unboundPlaceholderFailsBeforeConnecting() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        JdbcPooledClient client = new JdbcPooledClient("http://ch:8123", dataSource);

        assertThatThrownBy(() -> client.query("SELECT {x: String}", Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(dataSource, never()).getConnection();
    }

    @Test
    void propagatesDriverErrors() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        JdbcPooledClient client = new JdbcPooledClient("http://ch:8123", dataSource);

        assertThatThrownBy(() -> client.query("SELECT 1", Map.of(), Map.of()))
                .isInstanceOf(SQLException.class)
                .hasMessage("Connection refused");
    }
}
