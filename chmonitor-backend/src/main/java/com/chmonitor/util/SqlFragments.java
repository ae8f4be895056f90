package com.chmonitor.util;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Small SQL text helpers shared by the executor and the query definitions.
 */
public final class SqlFragments {
    /**
     * Prepended to every statement so the dashboard can filter out its own queries.
     */
    public static final String QUERY_COMMENT = "/* { \"client\": \"chmonitor\" } */ ";

    private static final Pattern TRAILING_SETTINGS = Pattern.compile("(?is).*\\bSETTINGS\\s+[A-Za-z_][A-Za-z0-9_]*\\s*=\\s*[^()]*$");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private SqlFragments() {
    }

    /**
     * Appends a ClickHouse {@code SETTINGS} clause, extending an existing trailing clause.
     *
     * @param sql statement
     * @param settings setting name to value
     * @return statement with settings
     */
    public static String appendSettings(String sql, Map<String, ?> settings) {
        if (settings == null || settings.isEmpty()) {
            return sql;
        }
        String rendered = settings.entrySet().stream()
                .map(e -> SqlIdentifiers.validate(e.getKey()) + " = " + literal(e.getValue()))
                .collect(Collectors.joining(", "));
        String base = TRAILING_SEMICOLON.matcher(sql.stripTrailing()).replaceFirst("");
        if (TRAILING_SETTINGS.matcher(base).matches()) {
            return base + ", " + rendered;
        }
        return base + "\nSETTINGS " + rendered;
    }

    /**
     * Renders {@code SET param_x=...;} lines ahead of the query, as typed into clickhouse-client.
     * Used for display only; execution binds values instead.
     *
     * @param sql statement
     * @param params bindings
     * @return statement preceded by parameter assignments
     */
    public static String withQueryParams(String sql, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return sql;
        }
        StringBuilder sb = new StringBuilder();
        params.forEach((name, value) -> sb.append("SET param_")
                .append(SqlIdentifiers.validate(name))
                .append('=')
                .append(literal(value))
                .append(";\n"));
        return sb.append(sql).toString();
    }

    /**
     * Formats a value as a SQL literal. Strings are single quoted with quotes doubled.
     *
     * @param value value
     * @return literal text
     */
    public static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return "'" + String.valueOf(value).replace("\\", "\\\\").replace("'", "''") + "'";
    }
}
