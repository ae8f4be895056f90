package com.chmonitor.service;

import com.chmonitor.model.FetchError;
import com.chmonitor.model.FetchErrorType;
import com.chmonitor.model.QueryRequest;
import com.chmonitor.query.QueryDefinitionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether caller-supplied SQL may run.
 *
 * <p>A statement is accepted when it is the text of a registered query definition or a row of the
 * custom dashboard table on the target host. The dashboard rows are cached per host for a fixed
 * time. Any failure to read them rejects the statement.
 */
@Slf4j
@Service
public class DashboardQueryGuard {
    public static final String DASHBOARD_TABLE = "system.clickhouse_monitoring_custom_dashboard";
    static final String DASHBOARD_SQL = "SELECT query FROM " + DASHBOARD_TABLE;

    static final String NOT_ALLOWED = "Query not found in dashboard tables. "
            + "Use /v1/queries/{name} for registered queries.";
    static final String UNREADABLE = "Query validation failed: dashboard table not accessible. "
            + "Use /v1/queries/{name} for registered queries.";

    private final QueryDefinitionRegistry registry;
    private final QueryExecutor queryExecutor;
    private final Clock clock;
    private final Duration ttl;

    private final Map<Integer, CachedQueries> dashboardQueries = new ConcurrentHashMap<>();

    public DashboardQueryGuard(
            QueryDefinitionRegistry registry,
            QueryExecutor queryExecutor,
            Clock clock,
            @Value("${chmonitor.dashboard.cache-ttl:PT5M}") Duration ttl
    ) {
        this.registry = registry;
        this.queryExecutor = queryExecutor;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Checks a statement before it is dispatched.
     *
     * @param query statement text
     * @param hostId target host
     * @return empty when the statement may run, otherwise a {@code permission_error}
     */
    public CompletableFuture<Optional<FetchError>> check(String query, int hostId) {
        if (registry.isRegisteredSql(query)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String wanted = query == null ? "" : query.trim();

        CachedQueries cached = dashboardQueries.get(hostId);
        if (cached != null && !cached.isExpired(clock.instant())) {
            return CompletableFuture.completedFuture(decide(cached.queries.contains(wanted), NOT_ALLOWED));
        }

        QueryRequest request = QueryRequest.builder()
                .query(DASHBOARD_SQL)
                .hostId(hostId)
                .format("JSONEachRow")
                .build();
        return queryExecutor.execute(request).thenApply(result -> {
            if (!result.isSuccess()) {
                log.error("Dashboard table unreadable on host {}: {}", hostId, result.getError().getMessage());
                return decide(false, UNREADABLE);
            }
            Set<String> queries = collect(result.getData());
            dashboardQueries.put(hostId, new CachedQueries(queries, clock.instant().plus(ttl)));
            return decide(queries.contains(wanted), NOT_ALLOWED);
        });
    }

    private static Set<String> collect(List<Map<String, Object>> rows) {
        Set<String> queries = new HashSet<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get("query");
            if (value != null) {
                queries.add(value.toString().trim());
            }
        }
        return queries;
    }

    private static Optional<FetchError> decide(boolean allowed, String message) {
        if (allowed) {
            return Optional.empty();
        }
        return Optional.of(FetchError.builder()
                .type(FetchErrorType.PERMISSION_ERROR)
                .message(message)
                .build());
    }

    private static final class CachedQueries {
        private final Set<String> queries;
        private final Instant expiresAt;

        private CachedQueries(Set<String> queries, Instant expiresAt) {
            this.queries = queries;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
