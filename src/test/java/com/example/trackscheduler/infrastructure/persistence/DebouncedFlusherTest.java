package com.example.trackscheduler.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebouncedFlusherTest {

    private ScheduledExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCoalesceBurstIntoSingleRun() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);
        DebouncedFlusher flusher = new DebouncedFlusher("test", executor, 100L, () -> {
            runs.incrementAndGet();
            done.countDown();
        });

        for (int i = 0; i < 10; i++) {
            flusher.schedule();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        Thread.sleep(300L);
        assertEquals(1, runs.get());
        assertFalse(flusher.isPending());
    }

    @Test
    void shouldRunImmediatelyOnFlushNowAndDropPendingRun() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        DebouncedFlusher flusher = new DebouncedFlusher("test", executor, 200L, runs::incrementAndGet);

        flusher.schedule();
        assertTrue(flusher.isPending());
        flusher.flushNow();

        assertEquals(1, runs.get());
        assertFalse(flusher.isPending());
        Thread.sleep(400L);
        assertEquals(1, runs.get());
    }

    @Test
    void shouldRunInlineWhenExecutorIsShutDown() {
        AtomicInteger runs = new AtomicInteger();
        DebouncedFlusher flusher = new DebouncedFlusher("test", executor, 1000L, runs::incrementAndGet);
        executor.shutdownNow();

        flusher.schedule();

        assertEquals(1, runs.get());
    }

    @Test
    void shouldStayPendingWhenRescheduledWhileRunIsStarting() throws InterruptedException {
        AtomicReference<Thread> worker = new AtomicReference<>();
        ScheduledExecutorService ownExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "flush-test");
            worker.set(thread);
            return thread;
        });
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        DebouncedFlusher flusher = new DebouncedFlusher("test", ownExecutor, 0L, () -> {
            if (runs.incrementAndGet() == 1) {
                firstStarted.countDown();
                awaitQuietly(release);
            }
        });
        try {
            synchronized (flusher) {
                flusher.schedule();
                awaitBlocked(worker);
                // The first run has started and waits for the monitor; it can no longer be cancelled.
                flusher.schedule();
            }

            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
            assertTrue(flusher.isPending());

            release.countDown();
            long deadline = System.currentTimeMillis() + 5000L;
            while (runs.get() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            assertEquals(2, runs.get());
        } finally {
            release.countDown();
            ownExecutor.shutdownNow();
        }
    }

    private static void awaitBlocked(AtomicReference<Thread> worker) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (System.currentTimeMillis() < deadline) {
            Thread thread = worker.get();
            if (thread != null && thread.getState() == Thread.State.BLOCKED) {
                return;
            }
            Thread.sleep(5L);
        }
        throw new AssertionError("flush thread never blocked on the flusher");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
