package com.chmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One SQL body of a query, usable from engine version {@code since} onwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionedSql {
    private String since;
    private String description;
    private String sql;
}
