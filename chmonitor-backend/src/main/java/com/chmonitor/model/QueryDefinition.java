package com.chmonitor.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named query loaded from a YAML definition file.
 */
@Data
public class QueryDefinition {
    private String name;
    private String description;
    /**
     * Optional queries are skipped with {@code table_not_found} when a referenced table is absent.
     */
    private boolean optional;
    /**
     * Tables to check before running an optional query. Parsed from the SQL when empty.
     */
    private List<String> tableCheck = new ArrayList<>();
    private List<VersionedSql> sql = new ArrayList<>();
    private Map<String, Object> defaultParams = new LinkedHashMap<>();
    private Map<String, Object> settings = new LinkedHashMap<>();
    private String docs;
}
