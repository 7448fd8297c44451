package com.di.phenostore.load;

import com.di.phenostore.exception.BackendExecutionException;
import com.di.phenostore.exception.ConnectivityException;
import com.di.phenostore.exception.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs one task per shard, either on a bounded pool or one after the other, and joins
 * the results. Tasks share no mutable state; each failure is recorded with its
 * diagnostic text and all of them are surfaced together once every task has finished.
 */
@Slf4j
public class ShardWorkerPool {

    private static final long TIMEOUT_HOURS = 12;

    @FunctionalInterface
    public interface ShardAction<T> {
        void run(T item) throws Exception;
    }

    private final int workers;

    public ShardWorkerPool(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got " + workers);
        }
        this.workers = workers;
    }

    /**
     * Runs {@code action} for every item, at most {@code workers} at a time.
     *
     * @throws BackendExecutionException  if any task failed, with every failure in its output
     * @throws ConnectivityException      if any task failed because the backend was unreachable
     */
    public <T> void runParallel(String stage, List<T> items, Function<T, String> label, ShardAction<T> action) {
        if (items.isEmpty()) {
            return;
        }
        int maxConcurrent = Math.min(workers, items.size());
        AtomicInteger threadNo = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, stage + "-shard-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(maxConcurrent, tf);

        ConcurrentLinkedQueue<String> errors = new ConcurrentLinkedQueue<>();
        AtomicReference<Throwable> worst = new AtomicReference<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        log.info("[{}] {} task(s) on {} worker(s)", stage.toUpperCase(), items.size(), maxConcurrent);
        for (T item : items) {
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(() -> runWithMdc(mdc, item, action), executor)
                    // absorb the failure so allOf() waits for every shard
                    .exceptionally(ex -> {
                        Throwable cause = ex instanceof java.util.concurrent.CompletionException && ex.getCause() != null
                                ? ex.getCause() : ex;
                        record(stage, label.apply(item), cause, errors, worst);
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(TIMEOUT_HOURS, TimeUnit.HOURS);
        } catch (TimeoutException e) {
            throw new BackendExecutionException(stage + " timed out after " + TIMEOUT_HOURS + " hours", null, e);
        } catch (ExecutionException e) {
            throw new BackendExecutionException(stage + " execution error", null, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendExecutionException(stage + " interrupted", null, e);
        } finally {
            executor.shutdownNow();
        }

        raiseIfFailed(stage, items.size(), errors, worst.get());
    }

    /**
     * Runs {@code action} for every item on the calling thread, stopping at the first
     * failure. Used for single-writer backends.
     */
    public <T> void runSequential(String stage, List<T> items, Function<T, String> label, ShardAction<T> action) {
        ConcurrentLinkedQueue<String> errors = new ConcurrentLinkedQueue<>();
        AtomicReference<Throwable> worst = new AtomicReference<>();
        log.info("[{}] {} task(s), sequential", stage.toUpperCase(), items.size());
        for (T item : items) {
            try {
                action.run(item);
            } catch (Exception e) {
                record(stage, label.apply(item), e, errors, worst);
                break;
            }
        }
        raiseIfFailed(stage, items.size(), errors, worst.get());
    }

    private static <T> void runWithMdc(Map<String, String> mdc, T item, ShardAction<T> action) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            action.run(item);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new java.util.concurrent.CompletionException(e);
        } finally {
            MDC.clear();
        }
    }

    private static void record(String stage, String label, Throwable cause,
                               ConcurrentLinkedQueue<String> errors, AtomicReference<Throwable> worst) {
        String msg = String.format("%s: %s", label, cause.getMessage());
        errors.add(msg);
        log.error("[{}] {} FAILED: {}", stage.toUpperCase(), label, cause.getMessage());
        worst.accumulateAndGet(cause, (prev, next) ->
                prev == null || ErrorCategory.categorize(next) == ErrorCategory.CONNECTION_ERROR ? next : prev);
    }

    private static void raiseIfFailed(String stage, int total, ConcurrentLinkedQueue<String> errors, Throwable worst) {
        if (errors.isEmpty()) {
            return;
        }
        String message = String.format("%s failed: %d/%d shard(s)", stage, errors.size(), total);
        String output = String.join("\n", errors);
        if (ErrorCategory.categorize(worst) == ErrorCategory.CONNECTION_ERROR) {
            throw new ConnectivityException(message, output, worst);
        }
        throw new BackendExecutionException(message, output, worst);
    }
}
