package com.chmonitor.service;

import com.chmonitor.client.ClientQueryResult;
import com.chmonitor.client.PooledClient;
import com.chmonitor.config.DispatchConfiguration;
import com.chmonitor.model.TableAvailability;
import com.chmonitor.model.TableCacheMetrics;
import com.chmonitor.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Remembers whether {@code database.table} exists on a host.
 *
 * <p>Entries are bounded by count and by an aggregate weight of one unit per entry; whichever
 * bound is reached first evicts the least recently used entry. Each entry also expires a fixed
 * time after it was written. Failed checks are never stored.
 */
@Slf4j
@Service
public class TableExistenceCache {
    static final String EXISTS_SQL = "SELECT count() AS count FROM system.tables "
            + "WHERE database = {database: String} AND name = {table: String}";
    private static final String HAS_DATA_SQL = "SELECT count() > 0 AS has_data FROM %s LIMIT 1";
    private static final long ENTRY_WEIGHT = 1;

    private final ConnectionPool connectionPool;
    private final Executor ioExecutor;
    private final Clock clock;
    private final int maxEntries;
    private final long maxBytes;
    private final Duration ttl;
    private final Duration checkTimeout;

    // access-ordered; guarded by "this"
    private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long totalWeight;

    public TableExistenceCache(
            ConnectionPool connectionPool,
            @Qualifier(DispatchConfiguration.IO_EXECUTOR) Executor ioExecutor,
            Clock clock,
            @Value("${chmonitor.table-cache.max-entries:500}") int maxEntries,
            @Value("${chmonitor.table-cache.max-bytes:1048576}") long maxBytes,
            @Value("${chmonitor.table-cache.ttl:PT5M}") Duration ttl,
            @Value("${chmonitor.table-cache.check-timeout:PT5S}") Duration checkTimeout
    ) {
        if (maxEntries <= 0 || maxBytes <= 0) {
            throw new IllegalArgumentException("Table cache bounds must be positive");
        }
        this.connectionPool = connectionPool;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        this.ttl = ttl;
        this.checkTimeout = checkTimeout;
    }

    /**
     * Checks whether a table exists, answering from the cache while the entry is fresh.
     *
     * @param hostId host id
     * @param database database name
     * @param table table name
     * @return future with the existence flag; fails when the check itself fails or times out
     */
    public CompletableFuture<Boolean> exists(int hostId, String database, String table) {
        CacheKey key = new CacheKey(hostId, database + "." + table);
        Optional<Boolean> cached = lookup(key);
        if (cached.isPresent()) {
            log.debug("Table cache hit: host={}, table={}, exists={}", hostId, key.qualifiedName, cached.get());
            return CompletableFuture.completedFuture(cached.get());
        }

        log.debug("Table cache miss: host={}, table={}", hostId, key.qualifiedName);
        return connectionPool.get(hostId)
                .thenApplyAsync(client -> countMatchingTables(client, database, table), ioExecutor)
                .thenApply(count -> {
                    boolean exists = count > 0;
                    store(key, exists);
                    return exists;
                })
                .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Reports whether a table exists and holds at least one row.
     *
     * @param hostId host id
     * @param database database name
     * @param table table name
     * @return availability with an explanatory message when the table is missing or empty
     */
    public CompletableFuture<TableAvailability> checkAvailability(int hostId, String database, String table) {
        String qualified = SqlIdentifiers.validate(database) + "." + SqlIdentifiers.validate(table);
        return exists(hostId, database, table).thenCompose(exists -> {
            if (!exists) {
                return CompletableFuture.completedFuture(new TableAvailability(false, false,
                        "Table " + qualified + " does not exist. It may require configuration in ClickHouse."));
            }
            return connectionPool.get(hostId)
                    .thenApplyAsync(client -> hasData(client,
                            SqlIdentifiers.quote(database) + "." + SqlIdentifiers.quote(table)), ioExecutor)
                    .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .thenApply(hasData -> hasData
                            ? new TableAvailability(true, true, null)
                            : new TableAvailability(true, false, "Table " + qualified + " exists but contains no data."));
        });
    }

    /**
     * Marks a table as existing, typically after a statement reading it succeeded.
     *
     * @param hostId host id
     * @param qualifiedName {@code database.table}
     */
    public void recordExists(int hostId, String qualifiedName) {
        store(new CacheKey(hostId, qualifiedName), true);
    }

    public synchronized void invalidate(int hostId, String database, String table) {
        remove(new CacheKey(hostId, database + "." + table));
    }

    public synchronized void invalidate(int hostId, String qualifiedName) {
        remove(new CacheKey(hostId, qualifiedName));
    }

    public synchronized void clear() {
        entries.clear();
        totalWeight = 0;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized TableCacheMetrics metrics() {
        return TableCacheMetrics.builder()
                .size(entries.size())
                .maxSize(maxEntries)
                .memoryLimit(formatBytes(maxBytes))
                .ttl(formatDuration(ttl))
                .hitRate(entries.isEmpty() ? "empty" : "available")
                .build();
    }

    private synchronized Optional<Boolean> lookup(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.exists);
    }

    private synchronized void store(CacheKey key, boolean exists) {
        CacheEntry previous = entries.put(key, new CacheEntry(exists, clock.instant().plus(ttl)));
        if (previous == null) {
            totalWeight += ENTRY_WEIGHT;
        }
        evictOverflow();
    }

    private void remove(CacheKey key) {
        if (entries.remove(key) != null) {
            totalWeight -= ENTRY_WEIGHT;
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<CacheKey, CacheEntry>> it = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || totalWeight > maxBytes) && it.hasNext()) {
            Map.Entry<CacheKey, CacheEntry> eldest = it.next();
            it.remove();
            totalWeight -= ENTRY_WEIGHT;
            log.debug("Evicted table cache entry: host={}, table={}", eldest.getKey().hostId, eldest.getKey().qualifiedName);
        }
    }

    private long countMatchingTables(PooledClient client, String database, String table) {
        try {
            ClientQueryResult result = client.query(EXISTS_SQL, Map.of("database", database, "table", table), Map.of());
            return firstNumber(result.getRows(), "count");
        } catch (SQLException e) {
            throw new CompletionException(e);
        }
    }

    private boolean hasData(PooledClient client, String quotedName) {
        try {
            ClientQueryResult result = client.query(String.format(HAS_DATA_SQL, quotedName), Map.of(), Map.of());
            return firstNumber(result.getRows(), "has_data") > 0;
        } catch (SQLException e) {
            throw new CompletionException(e);
        }
    }

    private static long firstNumber(List<Map<String, Object>> rows, String column) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        Object value = rows.get(0).get(column);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Unexpected {} value from ClickHouse: {}", column, value);
            }
        }
        return 0;
    }

    private static String formatBytes(long bytes) {
        if (bytes % (1024 * 1024) == 0) {
            return (bytes / (1024 * 1024)) + "MB";
        }
        if (bytes % 1024 == 0) {
            return (bytes / 1024) + "KB";
        }
        return bytes + "B";
    }

    private static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        return seconds + (seconds == 1 ? " second" : " seconds");
    }

    private static final class CacheKey {
        private final int hostId;
        private final String qualifiedName;

        CacheKey(int hostId, String qualifiedName) {
            this.hostId = hostId;
            this.qualifiedName = qualifiedName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CacheKey that)) {
                return false;
            }
            return hostId == that.hostId && qualifiedName.equals(that.qualifiedName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(hostId, qualifiedName);
        }
    }

    private static final class CacheEntry {
        private final boolean exists;
        private final Instant expiresAt;

        CacheEntry(boolean exists, Instant expiresAt) {
            this.exists = exists;
            this.expiresAt = expiresAt;
        }
    }
}
