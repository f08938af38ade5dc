package com.libragraph.steward.core.state;

import com.libragraph.steward.types.LifecycleState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The fixed lifecycle transition graph.
 *
 * <pre>
 * STARTING     → INITIALIZING
 * INITIALIZING → ACTIVE, FAILED
 * ACTIVE       → STOPPING
 * FAILED       → STOPPING
 * STOPPING     → STOPPED
 * STOPPED      → (terminal)
 * </pre>
 */
public final class LifecycleTransitions {

    private static final Map<LifecycleState, Set<LifecycleState>> EDGES =
            new EnumMap<>(LifecycleState.class);

    static {
        EDGES.put(LifecycleState.STARTING, EnumSet.of(LifecycleState.INITIALIZING));
        EDGES.put(LifecycleState.INITIALIZING, EnumSet.of(LifecycleState.ACTIVE, LifecycleState.FAILED));
        EDGES.put(LifecycleState.ACTIVE, EnumSet.of(LifecycleState.STOPPING));
        EDGES.put(LifecycleState.FAILED, EnumSet.of(LifecycleState.STOPPING));
        EDGES.put(LifecycleState.STOPPING, EnumSet.of(LifecycleState.STOPPED));
        EDGES.put(LifecycleState.STOPPED, EnumSet.noneOf(LifecycleState.class));
    }

    private LifecycleTransitions() {
    }

    /** Self-transitions are never valid. */
    public static boolean isValid(LifecycleState from, LifecycleState to) {
        return EDGES.get(from).contains(to);
    }

    public static Set<LifecycleState> validTargets(LifecycleState from) {
        Set<LifecycleState> targets = EDGES.get(from);
        return targets.isEmpty()
                ? EnumSet.noneOf(LifecycleState.class)
                : EnumSet.copyOf(targets);
    }
}
