package com.chmonitor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void successCarriesDataOnly() {
        QueryResult<List<Map<String, Object>>> result =
                QueryResult.success(List.of(Map.of("count", 3)), QueryMetadata.empty("http://ch:8123"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getError()).isNull();
        assertThat(result.<Integer>fold(List::size, e -> -1)).isEqualTo(1);
    }

    @Test
    void successRequiresData() {
        assertThatThrownBy(() -> QueryResult.success(null, QueryMetadata.empty(null)))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void mapKeepsFailuresUntouched() {
        FetchError error = FetchError.builder().type(FetchErrorType.NETWORK_ERROR).message("down").build();
        QueryResult<String> failed = QueryResult.failure(error, QueryMetadata.empty(null));

        QueryResult<Integer> mapped = failed.map(String::length);

        assertThat(mapped.isSuccess()).isFalse();
        assertThat(mapped.getError()).isSameAs(error);
    }

    @Test
    void serializesErrorTypeInSnakeCase() throws Exception {
        FetchError error = FetchError.builder()
                .type(FetchErrorType.TABLE_NOT_FOUND)
                .message("Missing required tables: system.backup_log")
                .details(FetchError.Details.builder().missingTables(List.of("system.backup_log")).build())
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                QueryResult.failure(error, QueryMetadata.empty("http://ch:8123"))));

        assertThat(json.get("data").isNull()).isTrue();
        assertThat(json.get("error").get("type").asText()).isEqualTo("table_not_found");
        assertThat(json.get("error").get("details").get("missingTables").get(0).asText()).isEqualTo("system.backup_log");
        assertThat(json.get("metadata").get("host").asText()).isEqualTo("http://ch:8123");
        assertThat(json.has("success")).isFalse();
    }
}
