package com.chmonitor.query;

import com.chmonitor.model.QueryDefinition;
import com.chmonitor.model.QueryDefinitionFile;
import com.chmonitor.service.QueryDefinitionNotFoundException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryDefinitionRegistryTest {

    @Test
    void loadsDefinitionsPerCategory() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:test-queries/*.yaml");
        registry.reload();

        QueryDefinition def = registry.get(QueryDefinitionFile.CATEGORY_QUERY, "versioned");
        assertThat(def.isOptional()).isTrue();
        assertThat(def.getTableCheck()).containsExactly("system.metric_log");
        assertThat(def.getDefaultParams()).containsEntry("limit", 10);
        assertThat(def.getSettings()).containsEntry("max_threads", 2);
        assertThat(def.getSql()).extracting("since").containsExactly("21.8", "19.1");

        assertThat(registry.find(QueryDefinitionFile.CATEGORY_MENU_COUNT, "versioned")).isPresent();
    }

    @Test
    void skipsInvalidAndDuplicateDefinitions() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:test-queries/*.yaml");
        registry.reload();

        assertThat(registry.names(QueryDefinitionFile.CATEGORY_QUERY)).containsExactly("versioned");
        assertThat(registry.get(QueryDefinitionFile.CATEGORY_QUERY, "versioned").getDescription())
                .isEqualTo("Two variants");
    }

    @Test
    void unknownNameListsAvailableOnes() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:test-queries/*.yaml");
        registry.reload();

        assertThatThrownBy(() -> registry.get(QueryDefinitionFile.CATEGORY_QUERY, "nope"))
                .isInstanceOf(QueryDefinitionNotFoundException.class)
                .hasMessageContaining("Available: [versioned]");
    }

    @Test
    void bundledDefinitionsAreValid() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:queries/*.yaml");
        registry.reload();

        assertThat(registry.names(QueryDefinitionFile.CATEGORY_QUERY))
                .contains("running-queries", "part-info", "memory-usage", "backup-size", "query-count");
        assertThat(registry.names(QueryDefinitionFile.CATEGORY_MENU_COUNT))
                .contains("running-queries", "backups", "errors");
        assertThat(registry.get(QueryDefinitionFile.CATEGORY_MENU_COUNT, "backups").isOptional()).isTrue();
        assertThat(registry.get(QueryDefinitionFile.CATEGORY_QUERY, "part-info").getSql()).hasSize(2);
    }

    @Test
    void missingLocationYieldsEmptyRegistry() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:does-not-exist/*.yaml");
        registry.reload();

        assertThat(registry.names(QueryDefinitionFile.CATEGORY_QUERY)).isEmpty();
    }

    @Test
    void recognisesRegisteredStatementText() {
        QueryDefinitionRegistry registry = new QueryDefinitionRegistry("classpath*:test-queries/*.yaml");
        registry.reload();

        assertThat(registry.isRegisteredSql("SELECT 1 FROM system.metric_log LIMIT {limit: UInt32}")).isTrue();
        assertThat(registry.isRegisteredSql("  SELECT 2 FROM system.metric_log LIMIT {limit: UInt32}\n")).isTrue();
        assertThat(registry.isRegisteredSql("SELECT 'duplicate'")).isFalse();
        assertThat(registry.isRegisteredSql("DROP TABLE db.important")).isFalse();
        assertThat(registry.isRegisteredSql(null)).isFalse();
    }
}
