package com.libragraph.steward.core.runtime;

import com.libragraph.steward.core.component.ComponentContext;
import com.libragraph.steward.core.component.ManagedComponent;
import com.libragraph.steward.core.init.InitOutcome;
import com.libragraph.steward.core.shutdown.LeafStopStrategy;
import com.libragraph.steward.core.shutdown.ShutdownPhase;
import com.libragraph.steward.core.shutdown.StopContext;
import com.libragraph.steward.core.shutdown.StopStrategy;
import com.libragraph.steward.core.shutdown.Stoppable;
import com.libragraph.steward.util.Mailbox;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Runs one {@link ManagedComponent} on its own mailbox and publishes its death.
 * <p>
 * Start and polite stop are queued on the mailbox. {@link #kill()} bypasses it: the mailbox
 * is closed, a running handler is interrupted, still-running dependents are killed too,
 * and termination is announced at once.
 */
public class ComponentCell implements Stoppable {

    private static final Logger log = Logger.getLogger(ComponentCell.class);

    private final ManagedComponent component;
    private final String componentId;
    private final Duration stopTimeout;
    private final Mailbox mailbox;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final StopContext stopContext = new CellStopContext();

    private volatile List<ComponentCell> dependents = List.of();
    private volatile StopStrategy stopStrategy = new LeafStopStrategy();
    // guarded by runLock
    private final Object runLock = new Object();
    private Thread activeThread;

    ComponentCell(ManagedComponent component, Duration stopTimeout, Executor executor) {
        this.component = component;
        this.componentId = component.componentId();
        this.stopTimeout = stopTimeout;
        this.mailbox = new Mailbox("component-" + componentId, executor,
                (name, t) -> log.errorf(t, "Component '%s' task failed", componentId));
    }

    @Override
    public String componentId() {
        return componentId;
    }

    public ManagedComponent component() {
        return component;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public boolean initRequired() {
        return component.initRequired();
    }

    public List<ComponentCell> dependents() {
        return dependents;
    }

    public ShutdownPhase shutdownPhase() {
        return stopStrategy.phase();
    }

    void wire(List<ComponentCell> dependents, StopStrategy stopStrategy) {
        this.dependents = List.copyOf(dependents);
        this.stopStrategy = stopStrategy;
    }

    void start(BiConsumer<String, InitOutcome> reporter) {
        AtomicBoolean reported = new AtomicBoolean();
        ComponentContext context = new ComponentContext() {
            @Override
            public String componentId() {
                return componentId;
            }

            @Override
            public void reportInit(InitOutcome outcome) {
                reported.set(true);
                reporter.accept(componentId, outcome);
            }
        };
        run(() -> {
            log.debugf("Starting component '%s'", componentId);
            try {
                component.start(context);
            } catch (Exception e) {
                log.errorf("Component '%s' threw during start: %s", componentId, e.getMessage());
                // a component that already reported keeps its own verdict
                if (!reported.get()) {
                    context.reportInit(InitOutcome.failed(e));
                }
            }
        });
    }

    @Override
    public void requestStop() {
        run(() -> stopStrategy.onStopRequested(stopContext));
    }

    @Override
    public void kill() {
        if (terminated.isDone()) {
            return;
        }
        log.warnf("Forcefully terminating component '%s'", componentId);
        mailbox.close();
        synchronized (runLock) {
            // only while the handler still owns the thread; otherwise the pool may have reused it
            if (activeThread != null) {
                activeThread.interrupt();
            }
        }
        for (ComponentCell dependent : dependents) {
            dependent.kill();
        }
        announceTerminated();
    }

    @Override
    public CompletionStage<Void> whenTerminated() {
        return terminated.minimalCompletionStage();
    }

    @Override
    public boolean isTerminated() {
        return terminated.isDone();
    }

    private void run(Runnable task) {
        mailbox.execute(() -> {
            synchronized (runLock) {
                activeThread = Thread.currentThread();
            }
            try {
                task.run();
            } finally {
                synchronized (runLock) {
                    activeThread = null;
                    if (mailbox.isClosed()) {
                        // clear an interrupt left by kill() before the pool thread is reused
                        Thread.interrupted();
                    }
                }
            }
        });
    }

    private void announceTerminated() {
        if (terminated.complete(null)) {
            log.infof("Component '%s' terminated", componentId);
        }
    }

    @Override
    public String toString() {
        return "ComponentCell[" + componentId + ", " + stopStrategy.phase() + "]";
    }

    private final class CellStopContext implements StopContext {

        @Override
        public String componentId() {
            return componentId;
        }

        @Override
        public void execute(Runnable task) {
            run(task);
        }

        @Override
        public void terminateSelf() {
            try {
                component.stop();
            } catch (Exception e) {
                log.warnf("Component '%s' failed while stopping (%s); awaiting forceful removal",
                        componentId, e.getMessage());
                return;
            }
            mailbox.close();
            announceTerminated();
        }
    }
}
