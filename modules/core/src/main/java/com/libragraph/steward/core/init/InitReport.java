package com.libragraph.steward.core.init;

import java.time.Instant;

/**
 * What the tracker knows about one component's initialization.
 * {@code reason} and {@code reportedAt} are null while {@code PENDING}.
 */
public record InitReport(
        String componentId,
        boolean required,
        InitStatus status,
        String reason,
        Instant reportedAt
) {

    static InitReport pending(String componentId, boolean required) {
        return new InitReport(componentId, required, InitStatus.PENDING, null, null);
    }

    static InitReport of(String componentId, boolean required, InitOutcome outcome) {
        String reason = outcome instanceof InitOutcome.Failed failed ? failed.reason() : null;
        return new InitReport(componentId, required, InitStatus.of(outcome), reason, Instant.now());
    }

    public boolean isDecided() {
        return status != InitStatus.PENDING;
    }
}
