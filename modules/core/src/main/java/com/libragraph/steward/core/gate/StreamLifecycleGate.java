package com.libragraph.steward.core.gate;

import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.types.LifecycleState;
import com.libragraph.steward.types.TriggerEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Flow;
import java.util.function.BooleanSupplier;

/**
 * Open/closed control point for continuous streams, driven by lifecycle transitions or by
 * an external trigger source.
 * <p>
 * The gate never buffers. A gated stream only requests from its upstream while the gate
 * is open, one element at a time, so a closed gate stalls a demand-driven upstream and
 * memory stays bounded however long the gate remains shut. An element requested while
 * open is still delivered if the gate closes before it arrives.
 * <p>
 * Construction reads the trigger source's current value synchronously before subscribing
 * to updates, so the open bit is defined from the start. Repeated ENABLE or DISABLE
 * signals are no-ops; unmapped lifecycle states are ignored.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * StreamLifecycleGate gate = StreamLifecycleGate.forLifecycle(registry);
 * Multi<Event> flowing = gate.gate(source.events());
 * }</pre>
 */
public final class StreamLifecycleGate implements AutoCloseable {

    private static final Logger log = Logger.getLogger(StreamLifecycleGate.class);

    private final String gateId;
    private final Set<GatedSubscriber<?>> subscribers = ConcurrentHashMap.newKeySet();
    private volatile boolean open;
    private volatile Runnable detach = () -> { };

    private StreamLifecycleGate(String gateId, TriggerEvent initial) {
        this.gateId = gateId;
        this.open = initial.opens();
        log.debugf("Gate '%s' created %s", gateId, open ? "open" : "closed");
    }

    public static StreamLifecycleGate forLifecycle(LifecycleRegistry registry) {
        return forLifecycle(registry, TriggerMapping.defaults());
    }

    /**
     * Gate following {@code registry}. A snapshot state with no mapping starts the gate closed.
     */
    public static StreamLifecycleGate forLifecycle(LifecycleRegistry registry, TriggerMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        String gateId = "stream-gate-" + UUID.randomUUID();
        LifecycleState snapshot = registry.query();
        StreamLifecycleGate gate = new StreamLifecycleGate(gateId,
                mapping.triggerFor(snapshot).orElse(TriggerEvent.DISABLE));
        registry.subscribe(gateId, mapping.states(),
                state -> mapping.triggerFor(state).ifPresent(gate::onTrigger));
        gate.detach = () -> registry.unsubscribe(gateId);
        return gate;
    }

    /** Gate following an external trigger source, starting from {@code initial}. */
    public static StreamLifecycleGate forTriggers(TriggerEvent initial, Multi<TriggerEvent> triggers) {
        Objects.requireNonNull(initial, "initial");
        StreamLifecycleGate gate = new StreamLifecycleGate("trigger-gate-" + UUID.randomUUID(), initial);
        Cancellable subscription = triggers.subscribe().with(
                gate::onTrigger,
                failure -> log.warnf(failure, "Trigger source of gate '%s' failed; gate stays %s",
                        gate.gateId, gate.isOpen() ? "open" : "closed"));
        gate.detach = subscription::cancel;
        return gate;
    }

    /** Gate following a boolean signal; {@code true} opens. */
    public static StreamLifecycleGate forSignal(BooleanSupplier snapshot, Multi<Boolean> signal) {
        return forTriggers(TriggerEvent.of(snapshot.getAsBoolean()), signal.map(TriggerEvent::of));
    }

    public boolean isOpen() {
        return open;
    }

    public String gateId() {
        return gateId;
    }

    /** Applies one signal. Null is ignored. */
    public void onTrigger(TriggerEvent event) {
        if (event == null) {
            log.debugf("Gate '%s' ignoring null trigger", gateId);
            return;
        }
        synchronized (this) {
            if (open == event.opens()) {
                return;
            }
            open = event.opens();
        }
        log.debugf("Gate '%s' %s", gateId, open ? "opened" : "closed");
        if (event.opens()) {
            for (GatedSubscriber<?> subscriber : subscribers) {
                subscriber.drain();
            }
        }
    }

    /** Wraps {@code upstream} so it only flows while this gate is open. */
    public <T> Multi<T> gate(Multi<T> upstream) {
        Objects.requireNonNull(upstream, "upstream");
        Flow.Publisher<T> gated = downstream -> upstream.subscribe(new GatedSubscriber<T>(downstream, this));
        return Multi.createFrom().publisher(gated);
    }

    /** Stops following the trigger source. The open bit keeps its last value. */
    @Override
    public void close() {
        detach.run();
    }

    void attach(GatedSubscriber<?> subscriber) {
        subscribers.add(subscriber);
    }

    void detach(GatedSubscriber<?> subscriber) {
        subscribers.remove(subscriber);
    }

    @Override
    public String toString() {
        return "StreamLifecycleGate[" + gateId + ", " + (open ? "open" : "closed") + "]";
    }
}
