package com.libragraph.steward.core.gate;

import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sits between one upstream and one downstream of a {@link StreamLifecycleGate}.
 * Downstream demand is accumulated here and handed upstream one element at a time, only
 * while the gate is open. {@link #drain()} is re-entrant safe: a synchronous upstream that
 * emits from inside {@code request(1)} is looped, not recursed.
 */
final class GatedSubscriber<T> implements Flow.Subscriber<T>, Flow.Subscription {

    private final Flow.Subscriber<? super T> downstream;
    private final StreamLifecycleGate gate;

    private final AtomicReference<Flow.Subscription> upstream = new AtomicReference<>();
    private final AtomicLong requested = new AtomicLong();
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean cancelled;
    private volatile boolean done;

    GatedSubscriber(Flow.Subscriber<? super T> downstream, StreamLifecycleGate gate) {
        this.downstream = downstream;
        this.gate = gate;
    }

    // -- upstream side --

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        if (!upstream.compareAndSet(null, subscription)) {
            subscription.cancel();
            return;
        }
        gate.attach(this);
        downstream.onSubscribe(this);
    }

    @Override
    public void onNext(T item) {
        if (done || cancelled) {
            return;
        }
        inFlight.set(false);
        if (requested.get() != Long.MAX_VALUE) {
            requested.decrementAndGet();
        }
        downstream.onNext(item);
        drain();
    }

    @Override
    public void onError(Throwable failure) {
        if (done) {
            return;
        }
        done = true;
        gate.detach(this);
        downstream.onError(failure);
    }

    @Override
    public void onComplete() {
        if (done) {
            return;
        }
        done = true;
        gate.detach(this);
        downstream.onComplete();
    }

    // -- downstream side --

    @Override
    public void request(long n) {
        if (n <= 0) {
            cancel();
            downstream.onError(new IllegalArgumentException("Invalid request: " + n + ", must be greater than 0"));
            return;
        }
        requested.accumulateAndGet(n, (current, add) -> {
            long sum = current + add;
            return sum < 0 ? Long.MAX_VALUE : sum;
        });
        drain();
    }

    @Override
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        gate.detach(this);
        Flow.Subscription subscription = upstream.get();
        if (subscription != null) {
            subscription.cancel();
        }
    }

    /** Forwards one unit of demand upstream if the gate is open and nothing is in flight. */
    void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        for (;;) {
            Flow.Subscription subscription = upstream.get();
            if (subscription != null && !cancelled && !done && gate.isOpen()
                    && requested.get() > 0 && inFlight.compareAndSet(false, true)) {
                subscription.request(1);
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) {
                return;
            }
        }
    }
}
