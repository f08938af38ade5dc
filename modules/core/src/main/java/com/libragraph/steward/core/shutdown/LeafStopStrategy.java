package com.libragraph.steward.core.shutdown;

/**
 * Node without dependents: terminates itself as soon as the polite stop arrives.
 */
public final class LeafStopStrategy implements StopStrategy {

    private volatile ShutdownPhase phase = ShutdownPhase.NOT_STARTED;

    @Override
    public void onStopRequested(StopContext self) {
        if (phase != ShutdownPhase.NOT_STARTED) {
            return;
        }
        phase = ShutdownPhase.TERMINATED;
        self.terminateSelf();
    }

    @Override
    public ShutdownPhase phase() {
        return phase;
    }
}
