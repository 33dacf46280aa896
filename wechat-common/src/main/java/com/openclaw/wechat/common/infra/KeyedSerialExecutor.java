package com.openclaw.wechat.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks so that tasks sharing a key execute strictly one at
 * a time in submission order, while different keys proceed in parallel.
 * <p>
 * A task holds its key until the future it returns completes. A failed task
 * is logged and does not block its successors.
 */
@Slf4j
public class KeyedSerialExecutor implements AutoCloseable {

    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    /**
     * Create an executor backed by its own pool of daemon threads.
     */
    public KeyedSerialExecutor(String threadPrefix, int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.ownedExecutor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, threadPrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor = ownedExecutor;
    }

    /**
     * Create an executor on a caller-managed executor.
     */
    public KeyedSerialExecutor(Executor executor) {
        this.executor = executor;
        this.ownedExecutor = null;
    }

    /**
     * Queue a task behind every earlier task with the same key.
     *
     * @return a future completing after the task's own future settles;
     *         it never completes exceptionally
     */
    public CompletableFuture<Void> submit(String key, Supplier<? extends CompletableFuture<?>> task) {
        CompletableFuture<Void> tail = tails.compute(key, (k, prev) -> {
            CompletableFuture<Void> base = prev != null ? prev : CompletableFuture.completedFuture(null);
            return base.thenComposeAsync(ignored -> run(key, task), executor);
        });
        tail.whenComplete((r, e) -> tails.remove(key, tail));
        return tail;
    }

    /**
     * Keys with queued or running work.
     */
    public Set<String> activeKeys() {
        return Set.copyOf(tails.keySet());
    }

    private CompletableFuture<Void> run(String key, Supplier<? extends CompletableFuture<?>> task) {
        CompletableFuture<?> future;
        try {
            future = task.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(null);
        }
        return future.handle((result, err) -> {
            if (err != null) {
                log.error("Task for {} failed: {}", key, ErrorUtils.formatErrorMessage(err),
                        ErrorUtils.unwrap(err));
            }
            return null;
        });
    }

    @Override
    public void close() {
        if (ownedExecutor == null)
            return;
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ownedExecutor.shutdownNow();
        }
    }
}
