package com.libragraph.steward.core.init;

import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.types.LifecycleState;
import com.libragraph.steward.util.Mailbox;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Collects per-component readiness reports and decides when the process may become
 * {@link LifecycleState#ACTIVE} or must become {@link LifecycleState#FAILED}.
 * <p>
 * Failure is global and wins over any number of successes; success is counted per
 * required component. The first report from a component sticks. There is no timeout:
 * a required component that never reports keeps the process in {@code INITIALIZING}.
 */
public class InitializationTracker {

    private static final Logger log = Logger.getLogger(InitializationTracker.class);

    private final LifecycleRegistry registry;
    private final Mailbox mailbox;
    private final Map<String, InitReport> reports = new ConcurrentHashMap<>();

    // mailbox-confined
    private boolean begun;
    private boolean decided;
    private boolean shuttingDown;

    public InitializationTracker(LifecycleRegistry registry, Collection<String> requiredComponents,
                                 Executor executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mailbox = new Mailbox("init-tracker", executor,
                (name, t) -> log.errorf(t, "Initialization tracker task failed"));
        for (String componentId : requiredComponents) {
            reports.put(componentId, InitReport.pending(componentId, true));
        }
    }

    /** Moves the process to {@code INITIALIZING} and evaluates reports received so far. */
    public void begin() {
        mailbox.execute(() -> {
            if (begun || shuttingDown) {
                return;
            }
            begun = true;
            log.infof("Initialization started, waiting on %d required component(s)", requiredCount());
            registry.transitionTo(LifecycleState.INITIALIZING);
            evaluate();
        });
    }

    public void reportInit(String componentId, InitOutcome outcome) {
        Objects.requireNonNull(componentId, "componentId");
        Objects.requireNonNull(outcome, "outcome");
        mailbox.execute(() -> record(componentId, outcome));
    }

    /**
     * Freezes the outcome: reports processed after this are recorded for diagnostics but
     * no longer move the lifecycle. Completes once every earlier report has been evaluated.
     */
    public CompletionStage<Void> shutdownStarted() {
        CompletableFuture<Void> frozen = new CompletableFuture<>();
        mailbox.execute(() -> {
            if (!shuttingDown) {
                shuttingDown = true;
                log.debugf("Shutdown started; further reports have no effect (decided=%s)", decided);
            }
            frozen.complete(null);
        });
        return frozen;
    }

    public Optional<InitReport> report(String componentId) {
        return Optional.ofNullable(reports.get(componentId));
    }

    /** All known reports, ordered by component id. */
    public List<InitReport> reports() {
        return reports.values().stream()
                .sorted(Comparator.comparing(InitReport::componentId))
                .toList();
    }

    /** The earliest recorded failure of a required component, if any. */
    public Optional<InitReport> firstFailure() {
        return reports.values().stream()
                .filter(r -> r.required() && r.status() == InitStatus.FAILED)
                .min(Comparator.comparing(InitReport::reportedAt));
    }

    // -- internals (mailbox-confined) --

    private void record(String componentId, InitOutcome outcome) {
        InitReport existing = reports.get(componentId);
        boolean required = existing != null && existing.required();

        if (existing != null && existing.isDecided()) {
            log.warnf("Component '%s' reported %s after already reporting %s; keeping first report",
                    componentId, InitStatus.of(outcome), existing.status());
            return;
        }

        InitReport report = InitReport.of(componentId, required, outcome);
        reports.put(componentId, report);

        if (!required) {
            log.debugf("Component '%s' (init not required) reported %s", componentId, report.status());
            return;
        }
        if (report.status() == InitStatus.FAILED) {
            log.errorf("Component '%s' failed to initialize: %s", componentId, report.reason());
        } else {
            log.infof("Component '%s' initialized", componentId);
        }

        LifecycleState state = registry.query();
        if (shuttingDown || state.isShuttingDown()) {
            log.infof("Shutdown in progress (process is %s); report from '%s' recorded without effect",
                    state, componentId);
            return;
        }
        evaluate();
    }

    private void evaluate() {
        if (!begun || decided || shuttingDown) {
            return;
        }
        if (firstFailure().isPresent()) {
            decided = true;
            registry.transitionTo(LifecycleState.FAILED);
        } else if (pendingCount() == 0) {
            decided = true;
            log.infof("All %d required component(s) initialized", requiredCount());
            registry.transitionTo(LifecycleState.ACTIVE);
        }
    }

    private long requiredCount() {
        return reports.values().stream().filter(InitReport::required).count();
    }

    private long pendingCount() {
        return reports.values().stream()
                .filter(r -> r.required() && !r.isDecided())
                .count();
    }
}
