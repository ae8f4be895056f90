package com.chmonitor.service;

import com.chmonitor.client.ClientQueryResult;
import com.chmonitor.client.PooledClient;
import com.chmonitor.model.EngineVersion;
import com.chmonitor.model.VersionedSql;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VersionResolverTest {

    private ConnectionPool pool;
    private PooledClient client;
    private VersionResolver resolver;

    private final List<VersionedSql> variants = List.of(
            new VersionedSql("19.1", null, "SELECT v19"),
            new VersionedSql("21.8", null, "SELECT v21")
    );

    @BeforeEach
    void setUp() {
        pool = mock(ConnectionPool.class);
        client = mock(PooledClient.class);
        when(pool.get(0)).thenAnswer(inv -> CompletableFuture.completedFuture(client));
        resolver = new VersionResolver(pool, Runnable::run);
    }

    private static ClientQueryResult version(String v) {
        return ClientQueryResult.builder().rows(List.of(Map.of("version", v))).rowCount(1).build();
    }

    @Test
    void detectsOnceAndCaches() throws Exception {
        when(client.query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap())).thenReturn(version("24.3.2.23"));

        assertThat(resolver.getVersion(0).join()).contains(EngineVersion.parse("24.3.2"));
        assertThat(resolver.getVersion(0).join()).contains(EngineVersion.parse("24.3.2"));

        verify(client, times(1)).query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap());
        assertThat(resolver.cachedVersion(0)).isPresent();
    }

    @Test
    void concurrentDetectionsShareOneQuery() throws Exception {
        CompletableFuture<PooledClient> pending = new CompletableFuture<>();
        when(pool.get(0)).thenReturn(pending);
        when(client.query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap())).thenReturn(version("23.8.1"));

        CompletableFuture<Optional<EngineVersion>> first = resolver.getVersion(0);
        CompletableFuture<Optional<EngineVersion>> second = resolver.getVersion(0);
        pending.complete(client);

        assertThat(first.join()).contains(EngineVersion.parse("23.8.1"));
        assertThat(second.join()).contains(EngineVersion.parse("23.8.1"));
        verify(pool, times(1)).get(0);
    }

    @Test
    void failedDetectionIsEmptyAndRetried() throws Exception {
        when(client.query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap()))
                .thenThrow(new SQLException("Connection refused", "08001"))
                .thenReturn(version("22.3"));

        assertThat(resolver.getVersion(0).join()).isEmpty();
        assertThat(resolver.cachedVersion(0)).isEmpty();

        assertThat(resolver.getVersion(0).join()).contains(EngineVersion.parse("22.3"));
    }

    @Test
    void unreachableHostResolvesToOldestVariant() {
        when(pool.get(0)).thenReturn(CompletableFuture.failedFuture(new ConnectException("Connection refused")));

        assertThat(resolver.resolve(variants, 0).join()).isEqualTo("SELECT v19");
    }

    @Test
    void resolvesAgainstDetectedVersion() throws Exception {
        when(client.query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap())).thenReturn(version("22.0.1"));

        assertThat(resolver.resolve(variants, 0).join()).isEqualTo("SELECT v21");
    }

    @Test
    void singleVariantNeedsNoDetection() {
        assertThat(resolver.resolve(List.of(new VersionedSql("19.1", null, "SELECT 1")), 0).join())
                .isEqualTo("SELECT 1");
        verify(pool, never()).get(0);
    }

    @Test
    void clearForcesRedetection() throws Exception {
        when(client.query(eq(VersionResolver.VERSION_SQL), anyMap(), anyMap()))
                .thenReturn(version("23.3"), version("24.1"));
        resolver.getVersion(0).join();

        resolver.clearVersionCache();

        assertThat(resolver.getVersion(0).join()).contains(EngineVersion.parse("24.1"));
    }
}
