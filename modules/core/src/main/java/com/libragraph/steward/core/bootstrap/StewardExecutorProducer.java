package com.libragraph.steward.core.bootstrap;

import com.libragraph.steward.core.state.LifecycleRegistry;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class StewardExecutorProducer {

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;

    @Produces
    @ApplicationScoped
    @Named("stewardExecutor")
    public ExecutorService stewardExecutor() {
        executor = Executors.newCachedThreadPool(daemonThreads("steward-worker-"));
        return executor;
    }

    @Produces
    @ApplicationScoped
    @Named("stewardScheduler")
    public ScheduledExecutorService stewardScheduler() {
        scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("steward-timer-"));
        return scheduler;
    }

    @Produces
    @Singleton
    public LifecycleRegistry lifecycleRegistry(@Named("stewardExecutor") ExecutorService executor) {
        return new LifecycleRegistry(executor);
    }

    @PreDestroy
    void shutdown() {
        if (scheduler != null) scheduler.shutdownNow();
        if (executor != null) executor.shutdown();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
