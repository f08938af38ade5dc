package com.libragraph.steward.core.component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contract for independently running units whose start-up and shutdown are coordinated.
 * <p>
 * {@link #start} runs on the component's own mailbox and must eventually report through
 * {@link ComponentContext#reportInit} when {@link #initRequired()} is true. {@link #stop}
 * is the polite stop handler; it runs after every dependent component is gone.
 */
public interface ManagedComponent {

    String componentId();

    void start(ComponentContext context) throws Exception;

    default void stop() throws Exception {
    }

    /** Required components must all succeed before the process becomes ACTIVE. */
    default boolean initRequired() {
        return false;
    }

    /** Advertised stop timeout; empty means the configured default applies. */
    default Optional<Duration> stopTimeout() {
        return Optional.empty();
    }

    /** Returns the {@code @DependsOn} classes declared on this component. */
    default List<Class<? extends ManagedComponent>> dependencies() {
        List<Class<? extends ManagedComponent>> deps = new ArrayList<>();
        for (DependsOn d : getClass().getAnnotationsByType(DependsOn.class)) {
            deps.add(d.value());
        }
        return deps;
    }
}
