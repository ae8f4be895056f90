package com.chmonitor.service;

import com.chmonitor.client.PooledClient;
import com.chmonitor.client.PooledClientFactory;
import com.chmonitor.config.DispatchConfiguration;
import com.chmonitor.model.HostConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Lazily creates and reuses one {@link PooledClient} per host.
 *
 * <p>The future for a host is published before construction starts, so concurrent callers for a
 * fresh host wait on the same attempt. A failed attempt is evicted and the next call retries.
 */
@Slf4j
@Service
public class ConnectionPool {
    private final Map<Integer, CompletableFuture<PooledClient>> clients = new ConcurrentHashMap<>();

    private final HostRegistry hostRegistry;
    private final PooledClientFactory clientFactory;
    private final Executor ioExecutor;

    public ConnectionPool(
            HostRegistry hostRegistry,
            PooledClientFactory clientFactory,
            @Qualifier(DispatchConfiguration.IO_EXECUTOR) Executor ioExecutor
    ) {
        this.hostRegistry = hostRegistry;
        this.clientFactory = clientFactory;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Returns the client for a host, creating it on first use.
     *
     * @param hostId host id
     * @return future completing with the shared client, or failing with the construction error
     */
    public CompletableFuture<PooledClient> get(int hostId) {
        CompletableFuture<PooledClient> existing = clients.get(hostId);
        if (existing != null) {
            return existing.copy();
        }

        HostConfig config;
        try {
            config = hostRegistry.get(hostId);
        } catch (HostNotFoundException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<PooledClient> created = new CompletableFuture<>();
        existing = clients.putIfAbsent(hostId, created);
        if (existing != null) {
            return existing.copy();
        }

        log.info("Creating client for host {} ({})", hostId, config.getHost());
        try {
            ioExecutor.execute(() -> construct(hostId, config, created));
        } catch (RejectedExecutionException e) {
            clients.remove(hostId, created);
            created.completeExceptionally(e);
        }
        return created.copy();
    }

    private void construct(int hostId, HostConfig config, CompletableFuture<PooledClient> target) {
        try {
            PooledClient client = clientFactory.create(config);
            target.complete(client);
        } catch (Exception e) {
            log.error("Failed to create client for host {} ({})", hostId, config.getHost(), e);
            // evict first so a caller reacting to the failure starts a fresh attempt
            clients.remove(hostId, target);
            target.completeExceptionally(e);
        }
    }

    /**
     * @return number of hosts with a client created or being created
     */
    public int size() {
        return clients.size();
    }

    /**
     * Closes every client. A client still under construction is closed as soon as it is built.
     */
    @PreDestroy
    public void closeAll() {
        clients.forEach((hostId, future) -> {
            if (!future.isDone()) {
                future.thenAccept(client -> {
                    log.info("Closing client for host {} built during shutdown", hostId);
                    client.close();
                });
            } else if (!future.isCompletedExceptionally()) {
                future.join().close();
            }
        });
        clients.clear();
    }
}
