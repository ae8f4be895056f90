package com.chmonitor.controller;

import com.chmonitor.api.DataRequest;
import com.chmonitor.api.HostSummary;
import com.chmonitor.api.MenuCountResponse;
import com.chmonitor.model.DedupStats;
import com.chmonitor.model.FetchError;
import com.chmonitor.model.FetchErrorType;
import com.chmonitor.model.QueryDefinition;
import com.chmonitor.model.QueryDefinitionFile;
import com.chmonitor.model.QueryMetadata;
import com.chmonitor.model.QueryRequest;
import com.chmonitor.model.QueryResult;
import com.chmonitor.model.TableAvailability;
import com.chmonitor.model.TableCacheMetrics;
import com.chmonitor.query.QueryDefinitionRegistry;
import com.chmonitor.service.DashboardQueryGuard;
import com.chmonitor.service.HostRegistry;
import com.chmonitor.service.MenuCountService;
import com.chmonitor.service.QueryExecutor;
import com.chmonitor.service.QueryValidationException;
import com.chmonitor.service.RequestDeduplicator;
import com.chmonitor.service.TableExistenceCache;
import com.chmonitor.service.VersionResolver;
import com.chmonitor.util.ClickHouseInterval;
import com.chmonitor.web.FetchErrorStatusMapper;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1")
public class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final HostRegistry hostRegistry;
    private final QueryExecutor queryExecutor;
    private final DashboardQueryGuard dashboardQueryGuard;
    private final QueryDefinitionRegistry definitionRegistry;
    private final MenuCountService menuCountService;
    private final TableExistenceCache tableExistenceCache;
    private final VersionResolver versionResolver;
    private final RequestDeduplicator deduplicator;

    public DispatchController(
            HostRegistry hostRegistry,
            QueryExecutor queryExecutor,
            DashboardQueryGuard dashboardQueryGuard,
            QueryDefinitionRegistry definitionRegistry,
            MenuCountService menuCountService,
            TableExistenceCache tableExistenceCache,
            VersionResolver versionResolver,
            RequestDeduplicator deduplicator
    ) {
        this.hostRegistry = hostRegistry;
        this.queryExecutor = queryExecutor;
        this.dashboardQueryGuard = dashboardQueryGuard;
        this.definitionRegistry = definitionRegistry;
        this.menuCountService = menuCountService;
        this.tableExistenceCache = tableExistenceCache;
        this.versionResolver = versionResolver;
        this.deduplicator = deduplicator;
    }

    /**
     * Execute a query supplied by the caller.
     *
     * POST /v1/data
     *
     * <p>The text must match a registered query or a row of the custom dashboard table on the
     * target host; anything else is rejected with {@code permission_error}.
     *
     * @param request query, bindings, host and settings
     * @return result envelope; the status follows the error type on failure
     */
    @PostMapping("/data")
    public ResponseEntity<QueryResult<List<Map<String, Object>>>> data(@Valid @RequestBody DataRequest request) {
        QueryRequest query = QueryRequest.builder()
                .query(request.getQuery())
                .queryParams(request.getQueryParams() != null ? request.getQueryParams() : Map.of())
                .hostId(request.getHostId())
                .format(request.getFormat())
                .settings(request.getSettings() != null ? request.getSettings() : Map.of())
                .build();

        Optional<String> address = hostRegistry.find(request.getHostId()).map(h -> h.getHost());
        if (address.isEmpty()) {
            // the executor reports the unknown host as a validation error
            return respond(queryExecutor.execute(query).join());
        }
        return respond(dashboardQueryGuard.check(request.getQuery(), request.getHostId())
                .thenCompose(rejection -> rejection.isPresent()
                        ? CompletableFuture.completedFuture(rejected(rejection.get(), request, address.get()))
                        : queryExecutor.execute(query))
                .join());
    }

    private static QueryResult<List<Map<String, Object>>> rejected(FetchError error, DataRequest request, String host) {
        String preview = request.getQuery().length() > 100 ? request.getQuery().substring(0, 100) : request.getQuery();
        log.warn("Refused unregistered query on host {}: {}", request.getHostId(), preview);
        return QueryResult.failure(error, QueryMetadata.empty(host));
    }

    /**
     * Execute a registered query by name.
     *
     * GET /v1/queries/{name}?hostId=&interval=
     *
     * <p>Request parameters other than {@code hostId} and {@code interval} are passed as query
     * parameter bindings.
     */
    @GetMapping("/queries/{name}")
    public ResponseEntity<QueryResult<List<Map<String, Object>>>> runDefinition(
            @PathVariable("name") String name,
            @RequestParam(value = "hostId", required = false) String hostId,
            @RequestParam(value = "interval", required = false) String interval,
            @RequestParam Map<String, String> allParams
    ) {
        QueryDefinition definition = definitionRegistry.get(QueryDefinitionFile.CATEGORY_QUERY, name);
        Map<String, Object> bindings = allParams.entrySet().stream()
                .filter(e -> !"hostId".equals(e.getKey()) && !"interval".equals(e.getKey()))
                .collect(Collectors.toMap(e -> e.getKey(), e -> (Object) e.getValue()));

        QueryRequest query = QueryRequest.builder()
                .hostId(HostRegistry.parseHostId(hostId))
                .definition(definition)
                .queryParams(bindings)
                .interval(parseInterval(interval))
                .format("JSONEachRow")
                .build();
        log.debug("Running query '{}' on host {}", name, query.getHostId());
        return respond(queryExecutor.execute(query).join());
    }

    @GetMapping("/hosts")
    public List<HostSummary> hosts() {
        return hostRegistry.list().stream()
                .map(h -> new HostSummary(h.getId(), h.getHost(), h.getDisplayName()))
                .collect(Collectors.toList());
    }

    @GetMapping("/menu-counts")
    public List<String> menuCountKeys() {
        return menuCountService.keys();
    }

    /**
     * Count for a navigation entry.
     *
     * GET /v1/menu-counts/{key}?hostId=
     */
    @GetMapping("/menu-counts/{key}")
    public ResponseEntity<QueryResult<MenuCountResponse>> menuCount(
            @PathVariable("key") String key,
            @RequestParam(value = "hostId", required = false) String hostId
    ) {
        return respond(menuCountService.count(key, HostRegistry.parseHostId(hostId)).join());
    }

    /**
     * Whether a table exists and holds data.
     *
     * GET /v1/tables/exists?hostId=&database=&table=
     */
    @GetMapping("/tables/exists")
    public ResponseEntity<QueryResult<TableAvailability>> tableExists(
            @RequestParam(value = "hostId", required = false) String hostId,
            @RequestParam("database") String database,
            @RequestParam("table") String table
    ) {
        return respond(queryExecutor.checkTableAvailability(HostRegistry.parseHostId(hostId), database, table).join());
    }

    @GetMapping("/cache/tables")
    public TableCacheMetrics tableCacheMetrics() {
        return tableExistenceCache.metrics();
    }

    @DeleteMapping("/cache/tables")
    public ResponseEntity<Void> clearTableCache() {
        tableExistenceCache.clear();
        log.info("Table existence cache cleared");
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/tables/{hostId}/{database}/{table}")
    public ResponseEntity<Void> invalidateTable(
            @PathVariable("hostId") String hostId,
            @PathVariable("database") String database,
            @PathVariable("table") String table
    ) {
        tableExistenceCache.invalidate(HostRegistry.parseHostId(hostId), database, table);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/versions")
    public ResponseEntity<Void> clearVersionCache() {
        versionResolver.clearVersionCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/dedup/stats")
    public DedupStats dedupStats() {
        return deduplicator.stats();
    }

    private static ClickHouseInterval parseInterval(String interval) {
        if (interval == null || interval.isBlank()) {
            return null;
        }
        return ClickHouseInterval.fromFunction(interval.trim())
                .orElseThrow(() -> new QueryValidationException("Unknown interval: " + interval));
    }

    private static <T> ResponseEntity<QueryResult<T>> respond(QueryResult<T> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        FetchErrorType type = result.getError().getType();
        if (FetchErrorStatusMapper.isServerError(type)) {
            log.warn("{} {}", FetchErrorStatusMapper.describe(type), result.getError().getMessage());
        }
        return ResponseEntity.status(FetchErrorStatusMapper.status(type)).body(result);
    }
}
