package com.chmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryMetadata {
    private String queryId;
    /**
     * Wall-clock duration in seconds.
     */
    private double duration;
    private long rows;
    private String host;
    private String engineVersion;
    private String sql;

    public static QueryMetadata empty(String host) {
        return QueryMetadata.builder()
                .queryId("")
                .duration(0)
                .rows(0)
                .host(host != null ? host : "unknown")
                .build();
    }
}
