package com.chmonitor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DispatchConfiguration {

    public static final String IO_EXECUTOR = "queryIoExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs blocking JDBC calls: pool construction, statements, metadata and version probes.
     */
    @Bean(name = IO_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService queryIoExecutor(@Value("${chmonitor.executor.io-threads:16}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "ch-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
