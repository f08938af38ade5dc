package com.libragraph.steward.core.state;

import com.libragraph.steward.types.LifecycleState;
import com.libragraph.steward.util.Mailbox;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Owns the single authoritative {@link LifecycleState} and the set of interested observers.
 * <p>
 * Every mutation (transition, subscribe, unsubscribe) is queued on one {@link Mailbox}, so
 * concurrent callers never race. Delivery is fire-and-forget: each subscription has its own
 * mailbox, which keeps per-observer order and isolates observer failures from the registry
 * and from each other.
 * <p>
 * {@link #query()} reads the current state directly and never waits for the writer.
 */
public class LifecycleRegistry {

    private static final Logger log = Logger.getLogger(LifecycleRegistry.class);

    private final Executor executor;
    private final Mailbox writer;

    // writer-confined
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    private volatile LifecycleState current = LifecycleState.STARTING;

    public LifecycleRegistry(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.writer = new Mailbox("lifecycle-registry", executor,
                (name, t) -> log.errorf(t, "Lifecycle registry task failed"));
    }

    public LifecycleState query() {
        return current;
    }

    /**
     * Requests a transition to {@code next}. Completes with {@code true} if it was applied,
     * {@code false} if it was a self-transition or not an edge of the lifecycle graph.
     */
    public CompletionStage<Boolean> transitionTo(LifecycleState next) {
        Objects.requireNonNull(next, "next");
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        writer.execute(() -> result.complete(apply(next)));
        return result;
    }

    /**
     * Registers (or replaces) {@code observerId}'s interest. If the current state is in
     * {@code interests}, it is delivered right away so late subscribers still learn it.
     */
    public void subscribe(String observerId, Set<LifecycleState> interests, LifecycleObserver observer) {
        Objects.requireNonNull(observerId, "observerId");
        Objects.requireNonNull(observer, "observer");
        Set<LifecycleState> interestSet = copyOf(interests);
        writer.execute(() -> {
            Subscription previous = subscriptions.remove(observerId);
            if (previous != null) {
                previous.close();
            }
            Subscription subscription = new Subscription(observerId, interestSet, observer);
            subscriptions.put(observerId, subscription);
            log.debugf("Observer '%s' subscribed to %s", observerId, interestSet);
            if (interestSet.contains(current)) {
                subscription.deliver(current);
            }
        });
    }

    /** Removes {@code observerId}. Deliveries not yet handed to the observer are dropped. */
    public void unsubscribe(String observerId) {
        writer.execute(() -> {
            Subscription removed = subscriptions.remove(observerId);
            if (removed != null) {
                removed.close();
                log.debugf("Observer '%s' unsubscribed", observerId);
            }
        });
    }

    /** Completes once {@code target} is, or becomes, the current state. */
    public CompletionStage<LifecycleState> awaitState(LifecycleState target) {
        CompletableFuture<LifecycleState> reached = new CompletableFuture<>();
        String observerId = "await-" + target.label() + "-" + UUID.randomUUID();
        subscribe(observerId, EnumSet.of(target), state -> {
            reached.complete(state);
            unsubscribe(observerId);
        });
        return reached;
    }

    /** Number of registered observers. Diagnostic only, may lag queued mutations. */
    public CompletionStage<Integer> subscriberCount() {
        CompletableFuture<Integer> count = new CompletableFuture<>();
        writer.execute(() -> count.complete(subscriptions.size()));
        return count;
    }

    // -- internals (writer-confined) --

    private boolean apply(LifecycleState next) {
        LifecycleState previous = current;
        if (previous == next) {
            log.debugf("Lifecycle already %s, ignoring", next);
            return false;
        }
        if (!LifecycleTransitions.isValid(previous, next)) {
            log.warnf("Ignoring illegal lifecycle transition %s -> %s (valid: %s)",
                    previous, next, LifecycleTransitions.validTargets(previous));
            return false;
        }
        current = next;
        log.infof("Lifecycle: %s -> %s", previous, next);
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.interests.contains(next)) {
                subscription.deliver(next);
            }
        }
        return true;
    }

    private static Set<LifecycleState> copyOf(Collection<LifecycleState> states) {
        return states == null || states.isEmpty()
                ? EnumSet.noneOf(LifecycleState.class)
                : EnumSet.copyOf(states);
    }

    private final class Subscription {

        private final Set<LifecycleState> interests;
        private final LifecycleObserver observer;
        private final Mailbox delivery;

        Subscription(String observerId, Set<LifecycleState> interests, LifecycleObserver observer) {
            this.interests = interests;
            this.observer = observer;
            this.delivery = new Mailbox("observer-" + observerId, executor,
                    (name, t) -> log.warnf(t, "Observer '%s' failed handling lifecycle notification",
                            observerId));
        }

        void deliver(LifecycleState state) {
            delivery.execute(() -> observer.onStateChanged(state));
        }

        void close() {
            delivery.close();
        }
    }
}
