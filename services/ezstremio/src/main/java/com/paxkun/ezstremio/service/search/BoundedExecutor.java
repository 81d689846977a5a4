package com.paxkun.ezstremio.service.search;

import com.paxkun.ezstremio.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * BoundedExecutor fans a list of work items out to at most {@code concurrency} worker
 * threads and joins on all of them before returning.
 * <p>
 * Every item is attempted. An item whose operation throws contributes nothing and does
 * not disturb its siblings. Results are appended to one buffer under a lock, so their
 * order follows completion order rather than input order.
 */
@Component
@RequiredArgsConstructor
public class BoundedExecutor {

    private final LoggerService logger;

    /**
     * Per-item unit of work. Any exception it throws is logged and counted as no results.
     */
    @FunctionalInterface
    public interface Operation<T, R> {
        List<R> apply(T item) throws Exception;
    }

    /**
     * Runs {@code operation} over every item with at most {@code concurrency} in flight.
     *
     * @param stage       tag used in log lines, e.g. "SEARCH"
     * @param items       work items, each handed to exactly one operation call
     * @param concurrency maximum number of operations running at once, at least 1
     * @param operation   the per-item work
     * @return everything the successful operations produced
     */
    public <T, R> List<R> runAll(String stage, List<T> items, int concurrency, Operation<T, R> operation) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        if (items.isEmpty()) {
            return new ArrayList<>();
        }

        List<R> buffer = new ArrayList<>();
        Object bufferLock = new Object();
        int poolSize = Math.min(concurrency, items.size());
        logger.debug(stage, "Dispatching " + items.size() + " items | concurrency=" + poolSize);

        try (AutoCloseableExecutor pool = AutoCloseableExecutor.fixed(stage, poolSize, logger)) {
            List<Future<?>> futures = new ArrayList<>();
            for (T item : items) {
                futures.add(pool.submit(() -> {
                    List<R> results = runOne(stage, item, operation);
                    if (!results.isEmpty()) {
                        synchronized (bufferLock) {
                            buffer.addAll(results);
                        }
                    }
                }));
            }

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    logger.error(stage, "❌ Worker crashed: " + e.getCause(), e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn(stage, "⚠️ Interrupted while waiting for workers, returning partial results.");
                    break;
                }
            }
        }

        synchronized (bufferLock) {
            logger.debug(stage, "All items finished | results=" + buffer.size());
            return new ArrayList<>(buffer);
        }
    }

    private <T, R> List<R> runOne(String stage, T item, Operation<T, R> operation) {
        try {
            List<R> results = operation.apply(item);
            return results == null ? List.of() : results;
        } catch (Exception e) {
            logger.warn(stage, "⚠️ No results for [" + item + "]: " + e.getMessage());
            return List.of();
        }
    }
}
