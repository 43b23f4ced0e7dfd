package com.curvematch.core.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Runs an index-addressed task over {@code [0, count)}, optionally on a fixed
 * worker pool.
 *
 * <p>
 * The range is cut into contiguous chunks, one per worker. Tasks must write
 * only to the slot of the index they are given; callers reduce the slots in
 * index order afterwards, so results never depend on completion order.
 * </p>
 *
 * @since 1.0.0
 */
public final class IndexedWorkers {

    private final int parallelism;
    private final String threadPrefix;

    /**
     * @param parallelism  worker count; {@code 1} runs on the calling thread
     * @param threadPrefix name prefix for worker threads
     */
    public IndexedWorkers(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.threadPrefix = (threadPrefix == null || threadPrefix.isBlank()) ? "curve-worker" : threadPrefix;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Invoke {@code task} once for every index in {@code [0, count)}.
     *
     * @param count number of indices; {@code 0} is a no-op
     * @param task  per-index task; must not be {@code null}
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting for workers
     */
    public void forEachIndex(int count, IntConsumer task) {
        Objects.requireNonNull(task, "Task must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        int workers = Math.min(parallelism, count);
        if (workers <= 1) {
            for (int i = 0; i < count; i++) {
                task.accept(i);
            }
            return;
        }

        List<Callable<Void>> chunks = new ArrayList<>(workers);
        int chunkSize = (count + workers - 1) / workers;
        for (int start = 0; start < count; start += chunkSize) {
            int from = start;
            int to = Math.min(count, start + chunkSize);
            chunks.add(() -> {
                for (int i = from; i < to; i++) {
                    task.accept(i);
                }
                return null;
            });
        }

        ExecutorService executor = Executors.newFixedThreadPool(chunks.size(), threadFactory());
        try {
            rethrowFromFutures(executor.invokeAll(chunks));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("Interrupted while waiting for " + threadPrefix + " workers", e);
        } finally {
            executor.shutdown();
        }
    }

    private static void rethrowFromFutures(List<Future<Void>> futures) throws InterruptedException {
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Worker failed", cause);
            }
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger index = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadPrefix + "-" + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
