package com.chmonitor.client;

import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.assertj.core.api.Assertions.assertThat;

class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void statementErrorsKeepConnection() {
        assertThat(override.adjudicate(new SQLException("Table system.backup_log does not exist", "HY000", 60)))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("Access denied", "HY000", 497)))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("Syntax error", "42000", 0)))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLFeatureNotSupportedException("no")))
                .isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
    }

    @Test
    void connectionErrorsEvict() {
        assertThat(override.adjudicate(new SQLException("Connection refused", "08001", 210)))
                .isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
        assertThat(override.adjudicate(null))
                .isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
    }
}
