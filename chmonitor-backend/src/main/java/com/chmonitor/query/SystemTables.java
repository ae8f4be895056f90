package com.chmonitor.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Optional ClickHouse system tables that only exist when enabled in the server configuration.
 */
public final class SystemTables {
    private static final String DOCS = "https://clickhouse.com/docs/en/operations/system-tables/";

    private static final Map<String, TableGuidance> GUIDANCE = new LinkedHashMap<>();

    static {
        add("system.query_thread_log", "Per-thread query execution statistics",
                "Enable by setting `log_query_threads = 1` in the server config or per query.",
                DOCS + "query_thread_log");
        add("system.session_log", "Login attempts and session tracking",
                "Enable by adding the `<session_log>` section to the server config.",
                DOCS + "session_log");
        add("system.processors_profile_log", "Query processor profiling data",
                "Enable by setting `log_processors_profiles = 1` in the server config.",
                DOCS + "processors_profile_log");
        add("system.error_log", "System error history",
                "Enable by adding the `<error_log>` section to the server config.",
                DOCS + "error_log");
        add("system.zookeeper", "ZooKeeper/Keeper coordination data",
                "Only available when ZooKeeper or ClickHouse Keeper is configured for the cluster.",
                DOCS + "zookeeper");
        add("system.backup_log", "Backup operation history",
                "Created after the first BACKUP command runs.",
                "https://clickhouse.com/docs/en/operations/backup");
        add("system.text_log", "Server log messages",
                "Add a `<text_log>` section to config.xml or config.d/ and restart the server.",
                DOCS + "text_log");
        add("system.crash_log", "Server crash history",
                "Created automatically when the first crash is recorded. Absence is normal for healthy clusters.",
                DOCS + "crash_log");
        add("system.opentelemetry_span_log", "OpenTelemetry tracing data",
                "Enable with `opentelemetry_span_log_enabled = 1` and an OpenTelemetry server config.",
                "https://clickhouse.com/docs/en/operations/opentelemetry");
        add("system.query_views_log", "Query views execution log",
                "Enable by setting `log_query_views = 1` in the server config.",
                DOCS + "query_views_log");
        add("system.metric_log", "System metrics history",
                "Add a `<metric_log>` section to config.xml or config.d/ and restart the server.",
                DOCS + "metric_log");
        add("system.asynchronous_metric_log", "Asynchronous metrics history",
                "Enable by adding the `<asynchronous_metric_log>` section to the server config.",
                DOCS + "asynchronous_metric_log");
        add("system.trace_log", "Stack traces for the sampling query profiler",
                "Enable with `trace_log_enabled = 1` and a query profiler period such as "
                        + "`query_profiler_real_time_period_ns`.",
                DOCS + "trace_log");
        add("system.part_log", "Data part operations log",
                "Add a `<part_log>` section to config.xml or config.d/ and restart the server.",
                DOCS + "part_log");
    }

    private SystemTables() {
    }

    private static void add(String table, String description, String enableInstructions, String docsUrl) {
        GUIDANCE.put(table, new TableGuidance(table, description, enableInstructions, docsUrl));
    }

    public static Optional<TableGuidance> guidance(String qualifiedName) {
        return Optional.ofNullable(GUIDANCE.get(qualifiedName));
    }

    /**
     * @return guidance for the first table in {@code tables} that has any
     */
    public static Optional<TableGuidance> guidanceFor(Collection<String> tables) {
        for (String table : tables) {
            Optional<TableGuidance> g = guidance(table);
            if (g.isPresent()) {
                return g;
            }
        }
        return Optional.empty();
    }

    public static boolean isOptional(String qualifiedName) {
        return GUIDANCE.containsKey(qualifiedName);
    }

    @Getter
    @AllArgsConstructor
    public static class TableGuidance {
        private final String table;
        private final String description;
        private final String enableInstructions;
        private final String docsUrl;
    }
}
