package com.openclaw.wechat.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recurring background task: runs an action once after an initial delay and
 * then again {@code interval} after each run finishes. Runs never overlap.
 * <p>
 * Failures of the action are logged and do not stop the schedule.
 */
@Slf4j
public class RecurringTask implements AutoCloseable {

    private final String name;
    private final Duration initialDelay;
    private final Duration interval;
    private final Runnable action;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    /**
     * Create a task with its own single daemon thread.
     */
    public RecurringTask(String name, Duration initialDelay, Duration interval, Runnable action) {
        this(name, initialDelay, interval, action, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }), true);
    }

    /**
     * Create a task on a shared scheduler; {@link #close()} leaves the scheduler running.
     */
    public RecurringTask(String name, Duration initialDelay, Duration interval, Runnable action,
            ScheduledExecutorService scheduler) {
        this(name, initialDelay, interval, action, scheduler, false);
    }

    private RecurringTask(String name, Duration initialDelay, Duration interval, Runnable action,
            ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.name = name;
        this.initialDelay = initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        this.interval = interval;
        this.action = action;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Start the schedule. Calling start on a running task is a no-op.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("{} already running", name);
            return;
        }
        schedule(initialDelay);
        log.debug("{} started (initial delay: {}ms, interval: {}ms)",
                name, initialDelay.toMillis(), interval.toMillis());
    }

    /**
     * Stop the schedule, including a pending first run. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
                scheduledTask = null;
            }
        }
        log.debug("{} stopped", name);
    }

    /**
     * Run the action immediately on the scheduler thread, outside the schedule.
     */
    public void triggerNow() {
        scheduler.execute(this::runOnce);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getInterval() {
        return interval;
    }

    private synchronized void schedule(Duration delay) {
        if (!running.get())
            return;
        scheduledTask = scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        runOnce();
        schedule(interval);
    }

    private void runOnce() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("{} failed: {}", name, ErrorUtils.formatErrorMessage(e), e);
        }
    }

    @Override
    public void close() {
        stop();
        if (!ownsScheduler)
            return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
