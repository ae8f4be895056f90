package com.chmonitor.service;

import com.chmonitor.client.ClientQueryResult;
import com.chmonitor.config.DispatchConfiguration;
import com.chmonitor.model.FetchError;
import com.chmonitor.model.FetchErrorType;
import com.chmonitor.model.HostConfig;
import com.chmonitor.model.QueryDefinition;
import com.chmonitor.model.QueryMetadata;
import com.chmonitor.model.QueryRequest;
import com.chmonitor.model.QueryResult;
import com.chmonitor.model.TableAvailability;
import com.chmonitor.query.QueryTemplates;
import com.chmonitor.query.SystemTables;
import com.chmonitor.query.TableValidator;
import com.chmonitor.util.DedupKeys;
import com.chmonitor.util.NamedParameters;
import com.chmonitor.util.SqlFragments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one logical query against one host and wraps the outcome in a {@link QueryResult}.
 *
 * <p>The returned future always completes normally; every failure is classified into a
 * {@link FetchError}.
 */
@Slf4j
@Service
public class QueryExecutor {
    public static final String MAX_EXECUTION_TIME = "max_execution_time";

    private final HostRegistry hostRegistry;
    private final ConnectionPool connectionPool;
    private final TableExistenceCache tableExistenceCache;
    private final TableValidator tableValidator;
    private final VersionResolver versionResolver;
    private final RequestDeduplicator deduplicator;
    private final Executor ioExecutor;

    public QueryExecutor(
            HostRegistry hostRegistry,
            ConnectionPool connectionPool,
            TableExistenceCache tableExistenceCache,
            TableValidator tableValidator,
            VersionResolver versionResolver,
            RequestDeduplicator deduplicator,
            @Qualifier(DispatchConfiguration.IO_EXECUTOR) Executor ioExecutor
    ) {
        this.hostRegistry = hostRegistry;
        this.connectionPool = connectionPool;
        this.tableExistenceCache = tableExistenceCache;
        this.tableValidator = tableValidator;
        this.versionResolver = versionResolver;
        this.deduplicator = deduplicator;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Executes a query.
     *
     * @param request query, bindings, target host and optional definition
     * @return future with rows or a classified error
     */
    public CompletableFuture<QueryResult<List<Map<String, Object>>>> execute(QueryRequest request) {
        HostConfig host;
        try {
            host = hostRegistry.get(request.getHostId());
        } catch (HostNotFoundException e) {
            log.warn("Rejected query for host {}: {}", request.getHostId(), e.getMessage());
            return CompletableFuture.completedFuture(failure(e, null, request.getQuery()));
        }

        QueryDefinition definition = request.getDefinition();
        return resolveSql(request, definition)
                .thenApply(sql -> QueryTemplates.expand(sql, request.getInterval()))
                .thenCompose(sql -> {
                    if (definition != null && definition.isOptional()) {
                        return tableValidator.validate(definition, sql, request.getHostId())
                                .thenCompose(missing -> missing.isEmpty()
                                        ? run(request, host, sql)
                                        : CompletableFuture.completedFuture(skipped(definition, host, missing)));
                    }
                    return run(request, host, sql);
                })
                .exceptionally(e -> {
                    QueryResult<List<Map<String, Object>>> result = failure(e, host, request.getQuery());
                    if (result.getError().getType() == FetchErrorType.VALIDATION_ERROR) {
                        log.warn("Rejected query for host {}: {}", request.getHostId(), result.getError().getMessage());
                    } else {
                        log.error("Query failed on host {} ({})", request.getHostId(), host.getHost(), e);
                    }
                    return result;
                });
    }

    /**
     * Reports whether a table exists and holds data.
     *
     * @param hostId host id
     * @param database database name
     * @param table table name
     * @return availability, or a classified error when the check itself failed
     */
    public CompletableFuture<QueryResult<TableAvailability>> checkTableAvailability(
            int hostId, String database, String table) {
        HostConfig host;
        try {
            host = hostRegistry.get(hostId);
        } catch (HostNotFoundException e) {
            return CompletableFuture.completedFuture(QueryResult.failure(
                    FetchErrorClassifier.classify(e, null, null), QueryMetadata.empty(null)));
        }
        CompletableFuture<TableAvailability> check;
        try {
            check = tableExistenceCache.checkAvailability(hostId, database, table);
        } catch (IllegalArgumentException e) {
            check = CompletableFuture.failedFuture(e);
        }
        return check
                .thenApply(availability -> QueryResult.success(availability, QueryMetadata.empty(host.getHost())))
                .exceptionally(e -> {
                    log.warn("Table availability check failed for {}.{} on host {}: {}",
                            database, table, hostId, FetchErrorClassifier.unwrap(e).getMessage());
                    return QueryResult.failure(FetchErrorClassifier.classify(e, host.getHost(), null),
                            QueryMetadata.empty(host.getHost()));
                });
    }

    private CompletableFuture<String> resolveSql(QueryRequest request, QueryDefinition definition) {
        if (request.getQuery() != null && !request.getQuery().isBlank()) {
            return CompletableFuture.completedFuture(request.getQuery());
        }
        if (definition != null && definition.getSql() != null && !definition.getSql().isEmpty()) {
            return versionResolver.resolve(definition.getSql(), request.getHostId());
        }
        return CompletableFuture.failedFuture(new QueryValidationException("Query must not be empty"));
    }

    private CompletableFuture<QueryResult<List<Map<String, Object>>>> run(QueryRequest request, HostConfig host, String sql) {
        Map<String, Object> params = mergeParams(request);
        Map<String, Object> settings = mergeSettings(request, host);

        // unbound placeholders are rejected before anything reaches the server
        NamedParameters.parse(sql).bind(params);

        Map<String, Object> keyParts = new LinkedHashMap<>();
        keyParts.put("query", sql);
        keyParts.put("params", params);
        keyParts.put("hostId", request.getHostId());
        keyParts.put("format", request.getFormat());
        keyParts.put("settings", settings);
        String key = DedupKeys.of(keyParts);

        return deduplicator.dedupe(key, () -> connectionPool.get(request.getHostId())
                .thenApplyAsync(client -> {
                    try {
                        return client.query(sql, params, settings);
                    } catch (SQLException e) {
                        throw new CompletionException(e);
                    }
                }, ioExecutor)
                .handle((result, error) -> error == null
                        ? succeeded(request.getHostId(), host, sql, params, result)
                        : failed(request.getHostId(), host, sql, error)));
    }

    private QueryResult<List<Map<String, Object>>> succeeded(
            int hostId, HostConfig host, String sql, Map<String, Object> params, ClientQueryResult result) {
        for (String table : TableValidator.parseTables(sql)) {
            tableExistenceCache.recordExists(hostId, table);
        }
        QueryMetadata metadata = QueryMetadata.builder()
                .queryId(result.getQueryId())
                .duration(result.getDurationMs() / 1000.0)
                .rows(result.getRowCount())
                .host(host.getHost())
                .engineVersion(versionResolver.cachedVersion(hostId).map(Object::toString).orElse(null))
                .sql(SqlFragments.withQueryParams(sql, boundOnly(sql, params)))
                .build();
        return QueryResult.success(result.getRows() != null ? result.getRows() : List.of(), metadata);
    }

    private QueryResult<List<Map<String, Object>>> failed(int hostId, HostConfig host, String sql, Throwable error) {
        QueryResult<List<Map<String, Object>>> result = failure(error, host, sql);
        FetchError fetchError = result.getError();
        if (fetchError.getType() == FetchErrorType.TABLE_NOT_FOUND) {
            for (String table : fetchError.missingTables()) {
                tableExistenceCache.invalidate(hostId, table);
            }
            log.warn("Query on host {} referenced missing tables {}", hostId, fetchError.missingTables());
        } else {
            log.error("Query failed on host {} ({}): {}", hostId, host.getHost(), fetchError.getMessage());
        }
        return result;
    }

    private QueryResult<List<Map<String, Object>>> skipped(QueryDefinition definition, HostConfig host, List<String> missing) {
        log.warn("Skipping query '{}' due to missing tables: {}", definition.getName(), missing);
        FetchError error = FetchError.builder()
                .type(FetchErrorType.TABLE_NOT_FOUND)
                .message("Missing required tables: " + String.join(", ", missing))
                .details(FetchError.Details.builder()
                        .missingTables(missing)
                        .host(host.getHost())
                        .docs(docsFor(definition, missing))
                        .build())
                .build();
        return QueryResult.failure(error, QueryMetadata.empty(host.getHost()));
    }

    private static QueryResult<List<Map<String, Object>>> failure(Throwable error, HostConfig host, String sql) {
        String address = host != null ? host.getHost() : null;
        return QueryResult.failure(FetchErrorClassifier.classify(error, address, sql), QueryMetadata.empty(address));
    }

    private static String docsFor(QueryDefinition definition, List<String> missing) {
        if (definition != null && definition.getDocs() != null) {
            return definition.getDocs();
        }
        return SystemTables.guidanceFor(missing).map(SystemTables.TableGuidance::getDocsUrl).orElse(null);
    }

    private static Map<String, Object> boundOnly(String sql, Map<String, Object> params) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (String name : NamedParameters.names(sql)) {
            bound.put(name, params.get(name));
        }
        return bound;
    }

    private static Map<String, Object> mergeParams(QueryRequest request) {
        Map<String, Object> params = new LinkedHashMap<>();
        QueryDefinition definition = request.getDefinition();
        if (definition != null && definition.getDefaultParams() != null) {
            params.putAll(definition.getDefaultParams());
        }
        if (request.getQueryParams() != null) {
            params.putAll(request.getQueryParams());
        }
        return params;
    }

    private static Map<String, Object> mergeSettings(QueryRequest request, HostConfig host) {
        Map<String, Object> settings = new LinkedHashMap<>();
        if (host.getMaxExecutionTime() != null) {
            settings.put(MAX_EXECUTION_TIME, host.getMaxExecutionTime());
        }
        QueryDefinition definition = request.getDefinition();
        if (definition != null && definition.getSettings() != null) {
            settings.putAll(definition.getSettings());
        }
        if (request.getSettings() != null) {
            settings.putAll(request.getSettings());
        }
        return settings;
    }
}
