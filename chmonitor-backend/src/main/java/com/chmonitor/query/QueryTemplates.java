package com.chmonitor.query;

import com.chmonitor.util.ClickHouseInterval;
import com.chmonitor.util.SqlIdentifiers;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands time bucketing macros in chart query definitions.
 *
 * <ul>
 *   <li>{@code $interval(column)} or {@code $interval(column, alias)}: bucketing expression</li>
 *   <li>{@code $fillStep}: step for {@code WITH FILL}</li>
 *   <li>{@code $nowOrToday}: {@code now()} or {@code today()} matching the bucket granularity</li>
 * </ul>
 */
public final class QueryTemplates {
    public static final ClickHouseInterval DEFAULT_INTERVAL = ClickHouseInterval.TO_START_OF_HOUR;

    private static final Pattern INTERVAL_MACRO =
            Pattern.compile("\\$interval\\(\\s*([\\w.]+)\\s*(?:,\\s*(\\w+)\\s*)?\\)");
    private static final String FILL_STEP_MACRO = "$fillStep";
    private static final String NOW_MACRO = "$nowOrToday";

    private QueryTemplates() {
    }

    public static boolean hasMacros(String sql) {
        return sql != null && (sql.contains("$interval(") || sql.contains(FILL_STEP_MACRO) || sql.contains(NOW_MACRO));
    }

    /**
     * Expands all macros.
     *
     * @param sql statement text
     * @param interval bucketing, {@link #DEFAULT_INTERVAL} when {@code null}
     * @return expanded statement
     */
    public static String expand(String sql, ClickHouseInterval interval) {
        if (!hasMacros(sql)) {
            return sql;
        }
        ClickHouseInterval effective = interval != null ? interval : DEFAULT_INTERVAL;

        Matcher m = INTERVAL_MACRO.matcher(sql);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String column = SqlIdentifiers.validate(m.group(1));
            String alias = m.group(2);
            m.appendReplacement(sb, Matcher.quoteReplacement(effective.apply(column, alias)));
        }
        m.appendTail(sb);

        return sb.toString()
                .replace(FILL_STEP_MACRO, effective.fillStep())
                .replace(NOW_MACRO, effective.nowOrToday());
    }
}
