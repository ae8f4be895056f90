package com.chmonitor.service;

import com.chmonitor.model.DedupStats;
import com.chmonitor.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestDeduplicatorTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final RequestDeduplicator dedup = new RequestDeduplicator(clock, Duration.ofMinutes(2), 10_000);

    @AfterEach
    void tearDown() {
        dedup.dispose();
    }

    @Test
    void identicalInFlightRequestsShareOneExecution() {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> work = new CompletableFuture<>();

        CompletableFuture<String> first = dedup.dedupe("k", () -> {
            calls.incrementAndGet();
            return work;
        });
        CompletableFuture<String> second = dedup.dedupe("k", () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertThat(dedup.stats().getPending()).isEqualTo(1);
        work.complete("rows");

        assertThat(first.join()).isEqualTo("rows");
        assertThat(second.join()).isEqualTo("rows");
        assertThat(calls).hasValue(1);
    }

    @Test
    void requestAfterCompletionStartsFreshWork() {
        AtomicInteger calls = new AtomicInteger();

        dedup.dedupe("k", () -> CompletableFuture.completedFuture(calls.incrementAndGet())).join();
        int second = dedup.dedupe("k", () -> CompletableFuture.completedFuture(calls.incrementAndGet())).join();

        assertThat(second).isEqualTo(2);
        assertThat(dedup.stats().getPending()).isZero();
    }

    @Test
    void entryIsGoneWhenWaitersObserveCompletion() {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> first = dedup.dedupe("k", () -> work);
        AtomicInteger pendingSeenByWaiter = new AtomicInteger(-1);
        first.thenRun(() -> pendingSeenByWaiter.set(dedup.stats().getPending()));

        work.complete("done");

        assertThat(pendingSeenByWaiter).hasValue(0);
    }

    @Test
    void failuresAreSharedAndNotRemembered() {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> first = dedup.dedupe("k", () -> work);
        CompletableFuture<String> second = dedup.dedupe("k", () -> CompletableFuture.completedFuture("unused"));

        work.completeExceptionally(new IllegalStateException("boom"));

        assertThatThrownBy(first::join).isInstanceOf(CompletionException.class).hasRootCauseMessage("boom");
        assertThatThrownBy(second::join).isInstanceOf(CompletionException.class).hasRootCauseMessage("boom");
        assertThat(dedup.dedupe("k", () -> CompletableFuture.completedFuture("retry")).join()).isEqualTo("retry");
    }

    @Test
    void producerThrowingIsReportedThroughFuture() {
        CompletableFuture<String> result = dedup.dedupe("k", () -> {
            throw new IllegalArgumentException("bad");
        });

        assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(dedup.stats().getPending()).isZero();
    }

    @Test
    void differentKeysRunIndependently() {
        AtomicInteger calls = new AtomicInteger();
        dedup.dedupe("a", () -> {
            calls.incrementAndGet();
            return new CompletableFuture<String>();
        });
        dedup.dedupe("b", () -> {
            calls.incrementAndGet();
            return new CompletableFuture<String>();
        });

        assertThat(calls).hasValue(2);
        assertThat(dedup.stats().getPending()).isEqualTo(2);
    }

    @Test
    void callerCannotCompleteSharedOutcome() {
        CompletableFuture<String> work = new CompletableFuture<>();
        CompletableFuture<String> first = dedup.dedupe("k", () -> work);
        CompletableFuture<String> second = dedup.dedupe("k", () -> work);

        first.complete("forged");
        work.complete("real");

        assertThat(second.join()).isEqualTo("real");
    }

    @Test
    void sweepDropsStaleEntries() {
        dedup.dedupe("old", CompletableFuture<String>::new);
        clock.advance(Duration.ofMinutes(1));
        dedup.dedupe("young", CompletableFuture<String>::new);

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        int removed = dedup.sweepStale();

        assertThat(removed).isEqualTo(1);
        DedupStats stats = dedup.stats();
        assertThat(stats.getPending()).isEqualTo(1);
        assertThat(stats.getOldestTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:01:00Z"));
    }

    @Test
    void pendingCeilingBypassesTracking() {
        RequestDeduplicator bounded = new RequestDeduplicator(clock, Duration.ofMinutes(2), 1);
        try {
            AtomicInteger calls = new AtomicInteger();
            bounded.dedupe("a", CompletableFuture<String>::new);
            bounded.dedupe("b", () -> CompletableFuture.completedFuture("x" + calls.incrementAndGet()));
            bounded.dedupe("b", () -> CompletableFuture.completedFuture("x" + calls.incrementAndGet()));

            assertThat(calls).hasValue(2);
            assertThat(bounded.stats().getPending()).isEqualTo(1);
        } finally {
            bounded.dispose();
        }
    }

    @Test
    void clearDropsEverything() {
        dedup.dedupe("a", CompletableFuture<String>::new);

        dedup.clear();

        assertThat(dedup.stats().getPending()).isZero();
        assertThat(dedup.stats().getOldestTimestamp()).isNull();
    }
}
