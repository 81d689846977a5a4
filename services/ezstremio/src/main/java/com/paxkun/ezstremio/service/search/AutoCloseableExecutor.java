package com.paxkun.ezstremio.service.search;

import com.paxkun.ezstremio.service.LoggerService;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool owned by one pipeline stage for the length of one run. Closing it drains
 * the queued work, so it belongs in a try-with-resources block around the fan-out.
 * Worker threads are named {@code <stage>-worker-<n>}.
 */
public record AutoCloseableExecutor(String stage, ExecutorService executor, LoggerService logger) implements AutoCloseable {

    private static final long DRAIN_SECONDS = 30;

    public static AutoCloseableExecutor fixed(String stage, int threads, LoggerService logger) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, task -> {
            Thread worker = new Thread(task, stage.toLowerCase(Locale.ROOT) + "-worker-" + counter.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        });
        return new AutoCloseableExecutor(stage, pool, logger);
    }

    public Future<?> submit(Runnable task) {
        return executor.submit(task);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (executor.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                return;
            }
            executor.shutdownNow();
            logger.warn(stage, "⚠️ Workers still busy after " + DRAIN_SECONDS + "s, pool cancelled.");
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            logger.warn(stage, "⚠️ Interrupted while draining the pool, workers cancelled.");
        }
    }
}
