package com.libragraph.steward.core.shutdown;

/**
 * The node a {@link StopStrategy} runs for.
 */
public interface StopContext {

    String componentId();

    /** Queues {@code task} on the node's own mailbox. */
    void execute(Runnable task);

    /** Runs the node's own stop handler and, if it succeeds, announces termination. */
    void terminateSelf();
}
