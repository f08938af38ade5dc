package com.libragraph.steward.core.shutdown;

import java.util.concurrent.CompletionStage;

/**
 * Handle a parent uses to stop one running unit. Termination is observed only through
 * {@link #whenTerminated()}, never through a reply to {@link #requestStop()}.
 */
public interface Stoppable {

    String componentId();

    /** Polite stop: the unit stops its own dependents first and may take its time. */
    void requestStop();

    /** Forceful stop: cannot be intercepted, completes {@link #whenTerminated()} promptly. */
    void kill();

    CompletionStage<Void> whenTerminated();

    boolean isTerminated();
}
