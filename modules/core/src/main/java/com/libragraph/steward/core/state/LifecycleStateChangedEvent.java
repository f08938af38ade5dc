package com.libragraph.steward.core.state;

import com.libragraph.steward.types.LifecycleState;

import java.time.Instant;

/**
 * Fired via CDI whenever the process lifecycle state changes.
 */
public record LifecycleStateChangedEvent(
        LifecycleState state,
        Instant timestamp
) {}
