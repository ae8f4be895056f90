package com.chmonitor.model;

import com.chmonitor.util.ClickHouseInterval;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * One logical query addressed to one host.
 *
 * <p>{@code query} may be empty when {@code definition} carries versioned SQL; the executor then
 * resolves the SQL text for the target host.
 */
@Data
@Builder(toBuilder = true)
public class QueryRequest {
    private String query;
    @Singular("queryParam")
    private Map<String, Object> queryParams;
    private int hostId;
    private String format;
    @Singular("setting")
    private Map<String, Object> settings;
    private QueryDefinition definition;
    /**
     * Bucketing used to expand time macros in definition SQL.
     */
    private ClickHouseInterval interval;
}
