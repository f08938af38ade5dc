package com.libragraph.steward.core.bootstrap;

import com.libragraph.steward.core.component.ManagedComponent;
import com.libragraph.steward.core.init.InitializationTracker;
import com.libragraph.steward.core.runtime.ComponentRuntime;
import com.libragraph.steward.core.shutdown.GracefulShutdownCoordinator;
import com.libragraph.steward.core.state.LifecycleRegistry;
import com.libragraph.steward.types.LifecycleState;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Boots the lifecycle core at application start: discovers every {@link ManagedComponent}
 * bean, wires the runtime, seeds the initialization tracker and starts the components.
 * On application shutdown it runs the graceful stop and waits for it, bounded by the
 * process stop timeout plus a grace period.
 */
@ApplicationScoped
@Startup
public class ComponentSupervisor {

    private static final Logger log = Logger.getLogger(ComponentSupervisor.class);

    @Inject
    LifecycleRegistry registry;

    @Inject
    LifecycleEventBridge eventBridge;

    @Inject
    Instance<ManagedComponent> components;

    @Inject
    @Named("stewardExecutor")
    ExecutorService executor;

    @Inject
    @Named("stewardScheduler")
    ScheduledExecutorService scheduler;

    @ConfigProperty(name = "steward.shutdown.default-stop-timeout", defaultValue = "10s")
    Duration defaultStopTimeout;

    @ConfigProperty(name = "steward.shutdown.process-stop-timeout", defaultValue = "30s")
    Duration processStopTimeout;

    @ConfigProperty(name = "steward.shutdown.exit-grace", defaultValue = "2s")
    Duration exitGrace;

    private ComponentRuntime runtime;
    private InitializationTracker tracker;
    private GracefulShutdownCoordinator shutdownCoordinator;

    @PostConstruct
    void init() {
        eventBridge.attach(registry);

        runtime = new ComponentRuntime(executor, scheduler, defaultStopTimeout);
        for (ManagedComponent component : components) {
            runtime.register(component);
        }
        runtime.seal();

        tracker = new InitializationTracker(registry, runtime.requiredComponentIds(), executor);
        shutdownCoordinator = new GracefulShutdownCoordinator(
                registry, tracker, runtime.topLevel(), processStopTimeout, executor, scheduler);

        tracker.begin();
        runtime.startAll(tracker::reportInit);
        log.infof("Supervising %d component(s), %d required for readiness",
                runtime.cells().size(), runtime.requiredComponentIds().size());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        Duration bound = processStopTimeout.plus(exitGrace);
        try {
            initiateGracefulStop().toCompletableFuture().get(bound.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warnf("Graceful stop did not finish within %s; exiting anyway", bound);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for graceful stop");
        } catch (ExecutionException e) {
            log.error("Graceful stop failed", e.getCause());
        } finally {
            eventBridge.detach(registry);
        }
    }

    public CompletionStage<Void> initiateGracefulStop() {
        return shutdownCoordinator.initiateGracefulStop();
    }

    public LifecycleState state() {
        return registry.query();
    }

    public LifecycleRegistry registry() {
        return registry;
    }

    public InitializationTracker tracker() {
        return tracker;
    }

    public ComponentRuntime runtime() {
        return runtime;
    }
}
