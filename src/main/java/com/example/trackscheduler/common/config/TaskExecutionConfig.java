package com.example.trackscheduler.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ScheduledExecutorService persistenceExecutor;
    private ExecutorService hydrationExecutor;

    /**
     * Single thread so debounced flushes never overlap.
     */
    @Bean
    public ScheduledExecutorService persistenceExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("persist-"));
        executor.setRemoveOnCancelPolicy(true);
        this.persistenceExecutor = executor;
        return executor;
    }

    @Bean
    public ExecutorService hydrationExecutor(AppSchedulerProperties properties) {
        int core = Math.max(1, Math.min(4, properties.getHydrationThreadCount()));
        this.hydrationExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("scope-hydrate-"));
        return this.hydrationExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (hydrationExecutor != null) {
            hydrationExecutor.shutdownNow();
        }
        if (persistenceExecutor != null) {
            persistenceExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
