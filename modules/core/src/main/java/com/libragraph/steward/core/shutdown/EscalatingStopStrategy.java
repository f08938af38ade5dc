package com.libragraph.steward.core.shutdown;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Two-phase stop over a node's dependents.
 *
 * <pre>
 * 1. polite stop to every dependent at once          (AWAITING_CHILDREN)
 * 2. all terminated within stopTimeout / 2           → terminate self (TERMINATED)
 * 3. timer fires first: kill the remaining ones only (ESCALATING)
 *    └─▶ all terminated                              → terminate self (TERMINATED)
 * </pre>
 *
 * The timer is one-shot. Nothing bounds the second wait: kills are assumed to be honoured
 * by the runtime. All state is confined to the owning node's mailbox.
 */
public final class EscalatingStopStrategy implements StopStrategy {

    private static final Logger log = Logger.getLogger(EscalatingStopStrategy.class);

    private final List<? extends Stoppable> dependents;
    private final Duration stopTimeout;
    private final ScheduledExecutorService scheduler;

    // mailbox-confined
    private final Map<String, Stoppable> remaining = new LinkedHashMap<>();
    private ScheduledFuture<?> escalation;

    private volatile ShutdownPhase phase = ShutdownPhase.NOT_STARTED;

    public EscalatingStopStrategy(List<? extends Stoppable> dependents, Duration stopTimeout,
                                  ScheduledExecutorService scheduler) {
        this.dependents = List.copyOf(dependents);
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public ShutdownPhase phase() {
        return phase;
    }

    public Duration politeWindow() {
        return stopTimeout.dividedBy(2);
    }

    @Override
    public void onStopRequested(StopContext self) {
        if (phase != ShutdownPhase.NOT_STARTED) {
            return;
        }
        phase = ShutdownPhase.AWAITING_CHILDREN;

        for (Stoppable dependent : dependents) {
            if (!dependent.isTerminated()) {
                remaining.put(dependent.componentId(), dependent);
            }
        }
        if (remaining.isEmpty()) {
            finish(self);
            return;
        }

        Duration window = politeWindow();
        log.debugf("'%s' stopping %d dependent(s), polite window %s",
                self.componentId(), remaining.size(), window);

        escalation = scheduler.schedule(() -> self.execute(() -> onEscalationDue(self)),
                window.toNanos(), TimeUnit.NANOSECONDS);

        for (Stoppable dependent : List.copyOf(remaining.values())) {
            dependent.whenTerminated().whenComplete((ignored, failure) ->
                    self.execute(() -> onDependentTerminated(self, dependent)));
            dependent.requestStop();
        }
    }

    private void onDependentTerminated(StopContext self, Stoppable dependent) {
        if (remaining.remove(dependent.componentId()) == null) {
            return;
        }
        log.debugf("'%s': dependent '%s' terminated, %d remaining",
                self.componentId(), dependent.componentId(), remaining.size());
        if (remaining.isEmpty() && phase.isInProgress()) {
            finish(self);
        }
    }

    private void onEscalationDue(StopContext self) {
        if (phase != ShutdownPhase.AWAITING_CHILDREN || remaining.isEmpty()) {
            return;
        }
        phase = ShutdownPhase.ESCALATING;
        log.warnf("'%s': %d dependent(s) did not stop within %s, killing %s",
                self.componentId(), remaining.size(), politeWindow(), remaining.keySet());
        for (Stoppable dependent : List.copyOf(remaining.values())) {
            dependent.kill();
        }
    }

    private void finish(StopContext self) {
        if (escalation != null) {
            escalation.cancel(false);
        }
        phase = ShutdownPhase.TERMINATED;
        self.terminateSelf();
    }
}
