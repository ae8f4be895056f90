package com.chmonitor.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QueryDefinitionFile {
    public static final String CATEGORY_QUERY = "query";
    public static final String CATEGORY_MENU_COUNT = "menu-count";

    private String description;
    /**
     * Namespace of the queries in this file: {@code query} or {@code menu-count}.
     */
    private String category = CATEGORY_QUERY;
    private String sourceFile;
    private List<QueryDefinition> queries = new ArrayList<>();
}
