package com.chmonitor.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites ClickHouse style {@code {name: Type}} placeholders into JDBC {@code ?} markers.
 *
 * <p>Placeholders inside single-quoted literals are left alone. A name used twice produces two
 * markers bound to the same value.
 */
public final class NamedParameters {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*([^{}]+?)\\s*}");

    private NamedParameters() {
    }

    /**
     * SQL text with positional markers plus the parameter name behind each marker.
     */
    public static final class ParsedSql {
        private final String jdbcSql;
        private final List<String> parameterNames;

        ParsedSql(String jdbcSql, List<String> parameterNames) {
            this.jdbcSql = jdbcSql;
            this.parameterNames = Collections.unmodifiableList(parameterNames);
        }

        public String getJdbcSql() {
            return jdbcSql;
        }

        public List<String> getParameterNames() {
            return parameterNames;
        }

        /**
         * Orders values by marker position.
         *
         * @param params named bindings
         * @return values in marker order
         * @throws IllegalArgumentException when a placeholder has no binding
         */
        public List<Object> bind(Map<String, ?> params) {
            List<String> missing = new ArrayList<>();
            List<Object> values = new ArrayList<>(parameterNames.size());
            for (String name : parameterNames) {
                if (params == null || !params.containsKey(name)) {
                    if (!missing.contains(name)) {
                        missing.add(name);
                    }
                    continue;
                }
                values.add(params.get(name));
            }
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("Missing required parameter(s): " + String.join(", ", missing));
            }
            return values;
        }
    }

    public static ParsedSql parse(String sql) {
        if (sql == null || sql.isEmpty()) {
            return new ParsedSql(sql == null ? "" : sql, List.of());
        }

        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        boolean inLiteral = false;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'') {
                // '' inside a literal is an escaped quote
                if (inLiteral && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    out.append("''");
                    i += 2;
                    continue;
                }
                inLiteral = !inLiteral;
                out.append(c);
                i++;
                continue;
            }
            if (!inLiteral && c == '{') {
                Matcher m = PLACEHOLDER.matcher(sql);
                m.region(i, sql.length());
                if (m.lookingAt()) {
                    names.add(m.group(1));
                    out.append('?');
                    i = m.end();
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return new ParsedSql(out.toString(), names);
    }

    /**
     * Distinct placeholder names in order of first appearance.
     *
     * @param sql SQL text
     * @return names
     */
    public static Set<String> names(String sql) {
        return new LinkedHashSet<>(parse(sql).getParameterNames());
    }
}
