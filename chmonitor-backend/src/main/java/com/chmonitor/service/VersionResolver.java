package com.chmonitor.service;

import com.chmonitor.client.ClientQueryResult;
import com.chmonitor.config.DispatchConfiguration;
import com.chmonitor.model.EngineVersion;
import com.chmonitor.model.VersionedSql;
import com.chmonitor.query.VersionedSqlSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Detects and remembers the ClickHouse version of each host.
 *
 * <p>A detected version is kept for the lifetime of the process. A failed detection is not
 * remembered, so the next call tries again.
 */
@Slf4j
@Service
public class VersionResolver {
    static final String VERSION_SQL = "SELECT version() AS version";

    private final Map<Integer, EngineVersion> versions = new ConcurrentHashMap<>();
    private final Map<Integer, CompletableFuture<Optional<EngineVersion>>> detecting = new ConcurrentHashMap<>();

    private final ConnectionPool connectionPool;
    private final Executor ioExecutor;

    public VersionResolver(
            ConnectionPool connectionPool,
            @Qualifier(DispatchConfiguration.IO_EXECUTOR) Executor ioExecutor
    ) {
        this.connectionPool = connectionPool;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Returns the server version of a host, detecting it on first use.
     *
     * @param hostId host id
     * @return future with the version, empty when detection failed; never completes exceptionally
     */
    public CompletableFuture<Optional<EngineVersion>> getVersion(int hostId) {
        EngineVersion known = versions.get(hostId);
        if (known != null) {
            return CompletableFuture.completedFuture(Optional.of(known));
        }

        CompletableFuture<Optional<EngineVersion>> created = new CompletableFuture<>();
        CompletableFuture<Optional<EngineVersion>> inFlight = detecting.putIfAbsent(hostId, created);
        if (inFlight != null) {
            return inFlight.copy();
        }

        connectionPool.get(hostId)
                .thenApplyAsync(client -> {
                    try {
                        return client.query(VERSION_SQL, Map.of(), Map.of());
                    } catch (SQLException e) {
                        throw new CompletionException(e);
                    }
                }, ioExecutor)
                .whenComplete((result, error) -> {
                    Optional<EngineVersion> detected = Optional.empty();
                    if (error != null) {
                        log.warn("Failed to detect ClickHouse version for host {}: {}", hostId, rootMessage(error));
                    } else {
                        detected = parseVersion(hostId, result);
                        detected.ifPresent(v -> {
                            versions.put(hostId, v);
                            log.info("Detected ClickHouse version {} for host {}", v, hostId);
                        });
                    }
                    detecting.remove(hostId, created);
                    created.complete(detected);
                });
        return created.copy();
    }

    /**
     * Resolves the SQL text of a versioned query for a host.
     *
     * @param variants SQL variants
     * @param hostId host id
     * @return chosen SQL text
     */
    public CompletableFuture<String> resolve(List<VersionedSql> variants, int hostId) {
        if (variants == null || variants.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("No SQL variants defined"));
        }
        if (variants.size() == 1) {
            return CompletableFuture.completedFuture(variants.get(0).getSql());
        }
        return getVersion(hostId)
                .thenApply(version -> VersionedSqlSelector.selectSql(variants, version.orElse(null)));
    }

    public Optional<EngineVersion> cachedVersion(int hostId) {
        return Optional.ofNullable(versions.get(hostId));
    }

    public void clearVersionCache() {
        versions.clear();
        log.info("Cleared ClickHouse version cache");
    }

    private static Optional<EngineVersion> parseVersion(int hostId, ClientQueryResult result) {
        if (result == null || result.getRows() == null || result.getRows().isEmpty()) {
            return Optional.empty();
        }
        Object raw = result.getRows().get(0).get("version");
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(EngineVersion.parse(raw.toString()));
        } catch (IllegalArgumentException e) {
            log.warn("Unparseable ClickHouse version '{}' for host {}", raw, hostId);
            return Optional.empty();
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage();
    }
}
