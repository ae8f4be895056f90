package com.chmonitor.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlFragmentsTest {

    @Test
    void appendsSettingsClause() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("max_execution_time", 60);
        settings.put("readonly", "1");

        assertThat(SqlFragments.appendSettings("SELECT 1;", settings))
                .isEqualTo("SELECT 1\nSETTINGS max_execution_time = 60, readonly = '1'");
    }

    @Test
    void extendsExistingTrailingSettings() {
        assertThat(SqlFragments.appendSettings("SELECT 1 SETTINGS max_threads = 2", Map.of("max_execution_time", 10)))
                .isEqualTo("SELECT 1 SETTINGS max_threads = 2, max_execution_time = 10");
    }

    @Test
    void noSettingsLeavesStatementUntouched() {
        assertThat(SqlFragments.appendSettings("SELECT 1;", Map.of())).isEqualTo("SELECT 1;");
    }

    @Test
    void rejectsUnsafeSettingNames() {
        assertThatThrownBy(() -> SqlFragments.appendSettings("SELECT 1", Map.of("x = 1, readonly", 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersQueryParamsAsSetStatements() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("database", "o'brien");
        params.put("limit", 10);

        assertThat(SqlFragments.withQueryParams("SELECT {limit: UInt32}", params))
                .isEqualTo("SET param_database='o''brien';\nSET param_limit=10;\nSELECT {limit: UInt32}");
    }

    @Test
    void literalsEscapeQuotesAndBackslashes() {
        assertThat(SqlFragments.literal(null)).isEqualTo("NULL");
        assertThat(SqlFragments.literal(true)).isEqualTo("true");
        assertThat(SqlFragments.literal("a\\b'c")).isEqualTo("'a\\\\b''c'");
    }
}
