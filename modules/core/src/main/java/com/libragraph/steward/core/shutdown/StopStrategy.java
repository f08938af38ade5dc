package com.libragraph.steward.core.shutdown;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * How a node reacts to a polite stop. Calls arrive on the node's mailbox.
 */
public interface StopStrategy {

    void onStopRequested(StopContext self);

    ShutdownPhase phase();

    /** Leaf when there is nothing to wait for, escalating otherwise. */
    static StopStrategy forDependents(List<? extends Stoppable> dependents, Duration stopTimeout,
                                      ScheduledExecutorService scheduler) {
        return dependents.isEmpty()
                ? new LeafStopStrategy()
                : new EscalatingStopStrategy(dependents, stopTimeout, scheduler);
    }
}
