package com.libragraph.steward.core.gate;

import com.libragraph.steward.types.LifecycleState;
import com.libragraph.steward.types.TriggerEvent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which lifecycle states open or close a {@link StreamLifecycleGate}. States without an
 * entry leave the gate as it is. Immutable.
 */
public final class TriggerMapping {

    private static final TriggerMapping DEFAULTS = new TriggerMapping(Map.of(
            LifecycleState.ACTIVE, TriggerEvent.ENABLE,
            LifecycleState.STOPPING, TriggerEvent.DISABLE));

    private final Map<LifecycleState, TriggerEvent> triggers;

    private TriggerMapping(Map<LifecycleState, TriggerEvent> triggers) {
        EnumMap<LifecycleState, TriggerEvent> copy = new EnumMap<>(LifecycleState.class);
        copy.putAll(triggers);
        this.triggers = Collections.unmodifiableMap(copy);
    }

    /** {@code ACTIVE ⇒ ENABLE}, {@code STOPPING ⇒ DISABLE}. */
    public static TriggerMapping defaults() {
        return DEFAULTS;
    }

    public static TriggerMapping of(Map<LifecycleState, TriggerEvent> triggers) {
        return new TriggerMapping(triggers);
    }

    /** Returns a copy with {@code state} mapped to {@code trigger}. */
    public TriggerMapping with(LifecycleState state, TriggerEvent trigger) {
        EnumMap<LifecycleState, TriggerEvent> copy = new EnumMap<>(LifecycleState.class);
        copy.putAll(triggers);
        copy.put(state, trigger);
        return new TriggerMapping(copy);
    }

    public Optional<TriggerEvent> triggerFor(LifecycleState state) {
        return Optional.ofNullable(triggers.get(state));
    }

    public Set<LifecycleState> states() {
        return triggers.isEmpty()
                ? EnumSet.noneOf(LifecycleState.class)
                : EnumSet.copyOf(triggers.keySet());
    }

    @Override
    public String toString() {
        return "TriggerMapping" + triggers;
    }
}
