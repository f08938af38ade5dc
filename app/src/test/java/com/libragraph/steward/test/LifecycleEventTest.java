package com.libragraph.steward.test;

import com.libragraph.steward.core.state.LifecycleStateChangedEvent;
import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.types.LifecycleState;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class LifecycleEventTest {

    @Inject
    LifecycleRegistry registry;

    @Inject
    EventCollector eventCollector;

    @Test
    void startupFiresStateEventsInOrder() throws Exception {
        Lifecycle.await(registry, LifecycleState.ACTIVE);
        eventCollector.activeSeen().get(5, TimeUnit.SECONDS);

        assertThat(eventCollector.states())
                .containsSubsequence(LifecycleState.INITIALIZING, LifecycleState.ACTIVE)
                .doesNotContain(LifecycleState.FAILED, LifecycleState.STOPPING);
    }

    @Test
    void selfTransitionFiresNothing() throws Exception {
        Lifecycle.await(registry, LifecycleState.ACTIVE);
        eventCollector.activeSeen().get(5, TimeUnit.SECONDS);
        int before = eventCollector.states().size();

        boolean applied = registry.transitionTo(LifecycleState.ACTIVE).toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertThat(applied).isFalse();
        assertThat(eventCollector.states()).hasSize(before);
    }

    /** CDI bean that collects all {@link LifecycleStateChangedEvent}s for assertions. */
    @ApplicationScoped
    public static class EventCollector {

        private final List<LifecycleStateChangedEvent> events = new CopyOnWriteArrayList<>();
        private final CompletableFuture<Void> active = new CompletableFuture<>();

        void onEvent(@Observes LifecycleStateChangedEvent event) {
            events.add(event);
            if (event.state() == LifecycleState.ACTIVE) {
                active.complete(null);
            }
        }

        List<LifecycleState> states() {
            return events.stream().map(LifecycleStateChangedEvent::state).toList();
        }

        CompletableFuture<Void> activeSeen() {
            return active;
        }
    }
}
