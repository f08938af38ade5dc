package com.libragraph.steward.core.state;

import com.libragraph.steward.types.LifecycleState;

/**
 * Receives lifecycle notifications from {@link LifecycleRegistry}.
 * <p>
 * Calls for one observer arrive one at a time and in transition order, on a
 * registry-owned thread. Exceptions are logged and do not affect other observers.
 */
@FunctionalInterface
public interface LifecycleObserver {

    void onStateChanged(LifecycleState state);
}
