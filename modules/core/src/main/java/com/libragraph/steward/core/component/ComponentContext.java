package com.libragraph.steward.core.component;

import com.libragraph.steward.core.init.InitOutcome;

/**
 * Handed to {@link ManagedComponent#start}. Reports may be sent from any thread, at any
 * time; only the first one counts.
 */
public interface ComponentContext {

    String componentId();

    void reportInit(InitOutcome outcome);

    default void initSucceeded() {
        reportInit(InitOutcome.succeeded());
    }

    default void initFailed(String reason) {
        reportInit(InitOutcome.failed(reason));
    }
}
