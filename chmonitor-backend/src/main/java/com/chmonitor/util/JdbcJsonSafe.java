package com.chmonitor.util;

import java.lang.reflect.Array;
import java.net.InetAddress;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts values read from the ClickHouse JDBC driver into JSON-safe primitives.
 *
 * <p>ClickHouse composite types come back as {@link java.sql.Array}, Java arrays, lists and maps;
 * these are converted recursively up to a fixed depth.
 */
public final class JdbcJsonSafe {
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Reads a column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException on JDBC errors reading the cell
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        return toJsonSafe(v);
    }

    public static Object toJsonSafe(Object v) {
        try {
            return sanitize(v, 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object sanitize(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }

        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof TemporalAccessor || v instanceof java.util.Date) {
            return v.toString();
        }
        if (v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof InetAddress address) {
            return address.getHostAddress();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            return sanitize(arr.getArray(), depth);
        }
        if (v instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), sanitize(e.getValue(), depth + 1));
            }
            return out;
        }
        if (v instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object elem : collection) {
                out.add(sanitize(elem, depth + 1));
            }
            return out;
        }
        if (v.getClass().isArray()) {
            int length = Array.getLength(v);
            List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(sanitize(Array.get(v, i), depth + 1));
            }
            return out;
        }

        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
