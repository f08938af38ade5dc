package com.libragraph.steward.core.shutdown;

/**
 * Progress of one node's shutdown attempt.
 *
 * <pre>
 * NOT_STARTED → AWAITING_CHILDREN → TERMINATED
 *                       └─▶ ESCALATING → TERMINATED
 * </pre>
 */
public enum ShutdownPhase {
    NOT_STARTED,
    AWAITING_CHILDREN,
    ESCALATING,
    TERMINATED;

    public boolean isInProgress() {
        return this == AWAITING_CHILDREN || this == ESCALATING;
    }
}
