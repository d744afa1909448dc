package com.example.trackscheduler.infrastructure.persistence;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces bursts of save requests into one write after a quiet period.
 * {@link #flushNow()} bypasses the timer for shutdown and bulk-clear paths.
 */
public class DebouncedFlusher {

    private static final Logger log = LoggerFactory.getLogger(DebouncedFlusher.class);

    private final String name;
    private final ScheduledExecutorService executor;
    private final long delayMs;
    private final Runnable task;
    private final Object runLock = new Object();
    private ScheduledFuture<?> pending;

    public DebouncedFlusher(String name, ScheduledExecutorService executor, long delayMs, Runnable task) {
        this.name = name;
        this.executor = executor;
        this.delayMs = Math.max(0L, delayMs);
        this.task = task;
    }

    public synchronized void schedule() {
        if (pending != null) {
            pending.cancel(false);
        }
        ScheduledFlush flush = new ScheduledFlush();
        try {
            pending = executor.schedule(flush, delayMs, TimeUnit.MILLISECONDS);
            flush.future = pending;
        } catch (RejectedExecutionException e) {
            log.warn("PERSISTENCE_EVENT event=flush_rejected name={} fallback=inline", name);
            pending = null;
            runTask();
        }
    }

    public void flushNow() {
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        runTask();
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    // Writes are serialized so an older snapshot never lands after a newer one.
    private void runTask() {
        synchronized (runLock) {
            task.run();
        }
    }

    /**
     * A timer run. It clears {@code pending} only while that still refers to
     * this run, so a reschedule made during the write stays visible.
     */
    private final class ScheduledFlush implements Runnable {

        // Assigned under the flusher's monitor before the run can enter it.
        private ScheduledFuture<?> future;

        @Override
        public void run() {
            synchronized (DebouncedFlusher.this) {
                if (pending == future) {
                    pending = null;
                }
            }
            runTask();
        }
    }
}
