package com.chmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class FetchError {
    private FetchErrorType type;
    private String message;
    private Details details;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Details {
        private List<String> missingTables;
        private String host;
        private String originalError;
        /**
         * Documentation link explaining how to enable a missing system table.
         */
        private String docs;
    }

    /**
     * Missing tables carried by a {@code table_not_found} error.
     *
     * @return missing qualified table names, empty when none are known
     */
    public List<String> missingTables() {
        if (details == null || details.getMissingTables() == null) {
            return List.of();
        }
        return details.getMissingTables();
    }
}
