package com.libragraph.steward.core.bootstrap;

import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.core.state.LifecycleStateChangedEvent;
import com.libragraph.steward.types.LifecycleState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.EnumSet;

/**
 * Re-publishes every lifecycle transition as a CDI {@link LifecycleStateChangedEvent}, so
 * beans can {@code @Observes} readiness without holding a registry subscription.
 * <p>
 * Separate bean (not on {@link ComponentSupervisor}) so observers of the event are free to
 * inject the supervisor without circular creation.
 */
@ApplicationScoped
public class LifecycleEventBridge {

    private static final Logger log = Logger.getLogger(LifecycleEventBridge.class);

    static final String OBSERVER_ID = "cdi-event-bridge";

    @Inject
    Event<LifecycleStateChangedEvent> stateEvent;

    void attach(LifecycleRegistry registry) {
        registry.subscribe(OBSERVER_ID, EnumSet.allOf(LifecycleState.class), this::publish);
    }

    void detach(LifecycleRegistry registry) {
        registry.unsubscribe(OBSERVER_ID);
    }

    private void publish(LifecycleState state) {
        log.debugf("Publishing lifecycle event: %s", state);
        stateEvent.fire(new LifecycleStateChangedEvent(state, Instant.now()));
    }
}
