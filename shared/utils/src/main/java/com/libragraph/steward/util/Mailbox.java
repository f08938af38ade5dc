package com.libragraph.steward.util;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Serial executor over a shared {@link Executor}: tasks submitted to one mailbox run
 * one at a time, in submission order, never concurrently with each other.
 * <p>
 * Every coordinating entity (registry, tracker, component cell, observer delivery)
 * owns exactly one mailbox and mutates its state only from tasks running on it, so
 * concurrent callers queue instead of racing.
 * <p>
 * A task that throws is handed to the error handler and the mailbox keeps draining.
 * Once {@link #close() closed}, pending tasks are discarded and new ones are dropped.
 */
public final class Mailbox implements Executor {

    private final String name;
    private final Executor executor;
    private final BiConsumer<String, Throwable> errorHandler;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean closed;

    public Mailbox(String name, Executor executor, BiConsumer<String, Throwable> errorHandler) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    public String name() {
        return name;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (closed) {
            return;
        }
        queue.offer(task);
        if (wip.getAndIncrement() == 0) {
            executor.execute(this::drain);
        }
    }

    /** Discards pending tasks; the task currently running (if any) completes normally. */
    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    /** Number of tasks waiting to run. Diagnostic only. */
    public int pending() {
        return queue.size();
    }

    private void drain() {
        int missed = 1;
        for (;;) {
            Runnable task;
            while ((task = queue.poll()) != null) {
                if (closed) {
                    queue.clear();
                    break;
                }
                try {
                    task.run();
                } catch (Throwable t) {
                    errorHandler.accept(name, t);
                }
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) {
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "Mailbox[" + name + (closed ? ", closed" : "") + "]";
    }
}
