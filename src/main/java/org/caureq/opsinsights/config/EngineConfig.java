package org.caureq.opsinsights.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {
    static final int QUEUE_PER_THREAD = 8;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for context lookups that may block. The queue is bounded and full submissions
     * are rejected, so a stalled collaborator costs its own sections and never queues the rest.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService contextExecutor() {
        int threads = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "context-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(threads * QUEUE_PER_THREAD), factory, new ThreadPoolExecutor.AbortPolicy());
    }
}
