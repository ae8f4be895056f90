package com.chmonitor.query;

import com.chmonitor.model.QueryDefinition;
import com.chmonitor.service.TableExistenceCache;
import com.chmonitor.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that the tables an optional query reads are present before the query runs.
 */
@Slf4j
@Component
public class TableValidator {
    private static final String QUALIFIED = "(\\w+\\.\\w+)";
    private static final List<Pattern> TABLE_PATTERNS = List.of(
            Pattern.compile("(?:FROM|JOIN)\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE),
            Pattern.compile("EXISTS\\s*\\(\\s*SELECT\\s+[^)]*?FROM\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE),
            Pattern.compile("IN\\s*\\(\\s*SELECT\\s+[^)]*?FROM\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE),
            Pattern.compile("INSERT\\s+INTO\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE),
            Pattern.compile("UPDATE\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE),
            Pattern.compile("WITH\\s+\\w+\\s+AS\\s*\\(\\s*SELECT\\s+[^)]*?FROM\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern SUBQUERY_START = Pattern.compile("\\s*(?:SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private final TableExistenceCache tableExistenceCache;

    public TableValidator(TableExistenceCache tableExistenceCache) {
        this.tableExistenceCache = tableExistenceCache;
    }

    /**
     * Extracts {@code database.table} references from a statement, in order of first appearance.
     *
     * @param sql statement text
     * <p>A {@code FROM} inside a function call, as in {@code extract(hour FROM q.event_time)}, names a
     * column and is skipped.
     *
     * @return distinct qualified names; unqualified tables are not reported
     */
    public static List<String> parseTables(String sql) {
        if (sql == null || sql.isBlank()) {
            return List.of();
        }
        Set<String> tables = new LinkedHashSet<>();
        for (Pattern pattern : TABLE_PATTERNS) {
            Matcher m = pattern.matcher(sql);
            while (m.find()) {
                if (!insideFunctionCall(sql, m.start(1))) {
                    tables.add(m.group(1));
                }
            }
        }
        return new ArrayList<>(tables);
    }

    /**
     * Whether {@code position} sits in parentheses that open something other than a subquery.
     */
    static boolean insideFunctionCall(String sql, int position) {
        int depth = 0;
        for (int i = position - 1; i >= 0; i--) {
            char c = sql.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    return !SUBQUERY_START.matcher(sql.substring(i + 1, position)).lookingAt();
                }
                depth--;
            }
        }
        return false;
    }

    /**
     * Tables that must exist for a definition to run: its {@code tableCheck} list, or the tables
     * parsed from {@code sql} when that list is empty.
     */
    public static List<String> tablesToCheck(QueryDefinition definition, String sql) {
        if (definition != null && definition.getTableCheck() != null && !definition.getTableCheck().isEmpty()) {
            return definition.getTableCheck();
        }
        return parseTables(sql);
    }

    /**
     * Checks every table of an optional definition in parallel.
     *
     * @param definition query definition
     * @param sql resolved statement text
     * @param hostId host id
     * @return missing qualified names; malformed names are reported as missing
     */
    public CompletableFuture<List<String>> validate(QueryDefinition definition, String sql, int hostId) {
        List<String> tables = tablesToCheck(definition, sql);
        if (tables.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<CompletableFuture<String>> checks = new ArrayList<>(tables.size());
        for (String table : tables) {
            String[] parts;
            try {
                parts = SqlIdentifiers.splitQualified(table);
            } catch (IllegalArgumentException e) {
                log.warn("Treating malformed table name as missing: {}", table);
                checks.add(CompletableFuture.completedFuture(table));
                continue;
            }
            checks.add(tableExistenceCache.exists(hostId, parts[0], parts[1])
                    .thenApply(exists -> exists ? null : table));
        }

        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<String> missing = new ArrayList<>();
                    for (CompletableFuture<String> check : checks) {
                        String table = check.join();
                        if (table != null) {
                            missing.add(table);
                        }
                    }
                    if (!missing.isEmpty()) {
                        log.debug("Missing tables on host {}: {}", hostId, missing);
                    }
                    return missing;
                });
    }
}
