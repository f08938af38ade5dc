package com.libragraph.steward.core.shutdown;

import com.libragraph.steward.core.init.InitializationTracker;
import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.types.LifecycleState;
import com.libragraph.steward.util.Mailbox;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Root of the shutdown tree: stops the whole process on request.
 *
 * <h2>Shutdown Flow</h2>
 *
 * <pre>
 * initiateGracefulStop()
 *   └─▶ initialization outcome frozen
 *   └─▶ lifecycle ACTIVE | FAILED → STOPPING
 *       └─▶ polite stop to every top-level component, bounded by processStopTimeout / 2
 *           └─▶ kill whatever is left, wait for confirmation
 *               └─▶ lifecycle STOPPING → STOPPED
 * </pre>
 *
 * Shutdown cannot be cancelled. Repeated requests return the same completion stage.
 */
public class GracefulShutdownCoordinator {

    private static final Logger log = Logger.getLogger(GracefulShutdownCoordinator.class);

    private static final String ROOT_ID = "process";

    private final LifecycleRegistry registry;
    private final InitializationTracker tracker;
    private final StopStrategy root;
    private final Mailbox mailbox;
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();
    private final AtomicBoolean initiated = new AtomicBoolean();
    private final StopContext rootContext = new RootStopContext();

    private volatile long startedNanos;

    public GracefulShutdownCoordinator(LifecycleRegistry registry, InitializationTracker tracker,
                                       List<? extends Stoppable> topLevel, Duration processStopTimeout,
                                       Executor executor, ScheduledExecutorService scheduler) {
        this.registry = registry;
        this.tracker = tracker;
        this.root = StopStrategy.forDependents(topLevel, processStopTimeout, scheduler);
        this.mailbox = new Mailbox("shutdown-root", executor,
                (name, t) -> log.errorf(t, "Shutdown coordinator task failed"));
    }

    /** Starts the shutdown sequence once; completes when the process is STOPPED. */
    public CompletionStage<Void> initiateGracefulStop() {
        if (!initiated.compareAndSet(false, true)) {
            log.debug("Graceful stop already in progress");
            return stopped.minimalCompletionStage();
        }
        startedNanos = System.nanoTime();
        log.infof("Graceful stop requested (process is %s)", registry.query());

        // a success reported during the stop must not reopen the process as ACTIVE
        tracker.shutdownStarted()
                .thenCompose(frozen -> registry.transitionTo(LifecycleState.STOPPING))
                .whenComplete((applied, failure) -> {
                    if (!Boolean.TRUE.equals(applied)) {
                        log.warnf("Stopping components while lifecycle remains %s", registry.query());
                    }
                    mailbox.execute(() -> root.onStopRequested(rootContext));
                });
        return stopped.minimalCompletionStage();
    }

    public boolean isInitiated() {
        return initiated.get();
    }

    public ShutdownPhase phase() {
        return root.phase();
    }

    private final class RootStopContext implements StopContext {

        @Override
        public String componentId() {
            return ROOT_ID;
        }

        @Override
        public void execute(Runnable task) {
            mailbox.execute(task);
        }

        @Override
        public void terminateSelf() {
            registry.transitionTo(LifecycleState.STOPPED).whenComplete((applied, failure) -> {
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
                log.infof("All components stopped in %d ms", durationMs);
                stopped.complete(null);
            });
        }
    }
}
