package com.chmonitor.service;

import com.chmonitor.model.DedupStats;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Coalesces identical in-flight requests.
 *
 * <p>While a request for a key is running, later callers with the same key receive the same
 * outcome instead of starting new work. The entry is removed before the shared outcome is
 * delivered, so a caller arriving after completion always starts fresh work.
 */
@Slf4j
@Service
public class RequestDeduplicator {
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    private final Clock clock;
    private final Duration staleThreshold;
    private final int maxPending;

    @Autowired
    public RequestDeduplicator(
            Clock clock,
            @Value("${chmonitor.dedup.stale-threshold:PT2M}") Duration staleThreshold,
            @Value("${chmonitor.dedup.sweep-interval:PT30S}") Duration sweepInterval,
            @Value("${chmonitor.dedup.max-pending:10000}") int maxPending
    ) {
        this(clock, staleThreshold, maxPending);
        long periodMs = sweepInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepStale, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Creates a deduplicator without the background sweep; {@link #sweepStale()} must be called
     * explicitly.
     */
    public RequestDeduplicator(Clock clock, Duration staleThreshold, int maxPending) {
        if (maxPending <= 0) {
            throw new IllegalArgumentException("maxPending must be positive");
        }
        this.clock = clock;
        this.staleThreshold = staleThreshold;
        this.maxPending = maxPending;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dedup-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code producer} unless an identical request is already in flight.
     *
     * @param key deduplication key
     * @param producer starts the work; invoked at most once per in-flight key
     * @param <T> outcome type
     * @return future with the shared outcome
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> dedupe(String key, Supplier<CompletableFuture<T>> producer) {
        PendingRequest existing = pending.get(key);
        if (existing != null) {
            log.debug("Reusing in-flight request: {}", key);
            return (CompletableFuture<T>) existing.future.copy();
        }

        if (pending.size() >= maxPending) {
            log.warn("Pending request limit {} reached, executing without deduplication", maxPending);
            return start(producer);
        }

        CompletableFuture<T> shared = new CompletableFuture<>();
        PendingRequest entry = new PendingRequest(shared, clock.instant());
        existing = pending.putIfAbsent(key, entry);
        if (existing != null) {
            log.debug("Reusing in-flight request: {}", key);
            return (CompletableFuture<T>) existing.future.copy();
        }

        start(producer).whenComplete((value, error) -> {
            pending.remove(key, entry);
            if (error != null) {
                shared.completeExceptionally(error);
            } else {
                shared.complete(value);
            }
        });
        return shared.copy();
    }

    /**
     * Drops entries older than the stale threshold. Callers already waiting keep their futures.
     *
     * @return number of removed entries
     */
    public int sweepStale() {
        Instant cutoff = clock.instant().minus(staleThreshold);
        int[] removed = {0};
        pending.entrySet().removeIf(e -> {
            if (e.getValue().startedAt.isBefore(cutoff)) {
                log.warn("Dropping stale pending request started at {}: {}", e.getValue().startedAt, e.getKey());
                removed[0]++;
                return true;
            }
            return false;
        });
        return removed[0];
    }

    public DedupStats stats() {
        Instant oldest = pending.values().stream()
                .map(p -> p.startedAt)
                .min(Instant::compareTo)
                .orElse(null);
        return new DedupStats(pending.size(), oldest);
    }

    public void clear() {
        pending.clear();
    }

    @PreDestroy
    public void dispose() {
        scheduler.shutdownNow();
        pending.clear();
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> producer) {
        try {
            CompletableFuture<T> started = producer.get();
            return started != null ? started : CompletableFuture.failedFuture(
                    new IllegalStateException("Producer returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static final class PendingRequest {
        private final CompletableFuture<?> future;
        private final Instant startedAt;

        PendingRequest(CompletableFuture<?> future, Instant startedAt) {
            this.future = future;
            this.startedAt = startedAt;
        }
    }
}
