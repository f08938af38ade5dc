package com.libragraph.steward.core.runtime;

import com.libragraph.steward.core.component.ManagedComponent;
import com.libragraph.steward.core.init.InitOutcome;
import com.libragraph.steward.core.shutdown.StopStrategy;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;

/**
 * Hosts the process's components: one {@link ComponentCell} each, wired into the dependency
 * graph declared with {@link com.libragraph.steward.core.component.DependsOn @DependsOn}.
 * <p>
 * Usage: {@link #register} every component, {@link #seal()} once, then {@link #startAll}.
 * Sealing rejects duplicate ids, unknown dependencies and cycles, and picks each cell's
 * stop strategy from its dependents.
 */
public class ComponentRuntime {

    private static final Logger log = Logger.getLogger(ComponentRuntime.class);

    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final Duration defaultStopTimeout;

    private final Map<String, ComponentCell> cells = new LinkedHashMap<>();
    private final Map<String, List<ComponentCell>> dependencies = new HashMap<>();
    private volatile boolean sealed;

    public ComponentRuntime(Executor executor, ScheduledExecutorService scheduler, Duration defaultStopTimeout) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.defaultStopTimeout = defaultStopTimeout;
    }

    public synchronized ComponentCell register(ManagedComponent component) {
        if (sealed) {
            throw new IllegalStateException(
                    "Cannot register '" + component.componentId() + "': runtime already sealed");
        }
        String id = component.componentId();
        if (cells.containsKey(id)) {
            throw new IllegalStateException(
                    "Duplicate component id '" + id + "': " +
                            cells.get(id).component().getClass().getName() + " and " +
                            component.getClass().getName());
        }
        Duration stopTimeout = component.stopTimeout().orElse(defaultStopTimeout);
        ComponentCell cell = new ComponentCell(component, stopTimeout, executor);
        cells.put(id, cell);
        log.debugf("Registered component '%s' (initRequired=%s, stopTimeout=%s)",
                id, component.initRequired(), stopTimeout);
        return cell;
    }

    public synchronized void seal() {
        if (sealed) {
            return;
        }
        for (ComponentCell cell : cells.values()) {
            dependencies.put(cell.componentId(), resolveDependencies(cell));
        }
        detectCycles();

        Map<String, List<ComponentCell>> dependents = new HashMap<>();
        for (ComponentCell cell : cells.values()) {
            for (ComponentCell dependency : dependencies.get(cell.componentId())) {
                dependents.computeIfAbsent(dependency.componentId(), k -> new ArrayList<>()).add(cell);
            }
        }
        for (ComponentCell cell : cells.values()) {
            List<ComponentCell> mine = dependents.getOrDefault(cell.componentId(), List.of());
            cell.wire(mine, StopStrategy.forDependents(mine, cell.stopTimeout(), scheduler));
        }
        sealed = true;
        log.infof("Component runtime sealed with %d component(s), %d top-level",
                cells.size(), topLevel().size());
    }

    /** Starts every component on its own mailbox; reports go to {@code reporter}. */
    public void startAll(BiConsumer<String, InitOutcome> reporter) {
        requireSealed();
        for (ComponentCell cell : cells()) {
            cell.start(reporter);
        }
    }

    /** Components nothing else is stopped before: those without dependencies. */
    public List<ComponentCell> topLevel() {
        requireSealed();
        return cells().stream()
                .filter(cell -> dependencies.get(cell.componentId()).isEmpty())
                .toList();
    }

    public Set<String> requiredComponentIds() {
        Set<String> required = new LinkedHashSet<>();
        for (ComponentCell cell : cells()) {
            if (cell.initRequired()) {
                required.add(cell.componentId());
            }
        }
        return required;
    }

    public Optional<ComponentCell> cell(String componentId) {
        synchronized (this) {
            return Optional.ofNullable(cells.get(componentId));
        }
    }

    public synchronized List<ComponentCell> cells() {
        return List.copyOf(cells.values());
    }

    public List<ComponentCell> dependenciesOf(String componentId) {
        requireSealed();
        return dependencies.getOrDefault(componentId, List.of());
    }

    public boolean isSealed() {
        return sealed;
    }

    // -- internals --

    private List<ComponentCell> resolveDependencies(ComponentCell cell) {
        List<ComponentCell> resolved = new ArrayList<>();
        for (Class<? extends ManagedComponent> dep : cell.component().dependencies()) {
            boolean found = false;
            for (ComponentCell candidate : cells.values()) {
                if (candidate != cell && dep.isInstance(candidate.component())) {
                    if (!resolved.contains(candidate)) {
                        resolved.add(candidate);
                    }
                    found = true;
                }
            }
            if (!found) {
                throw new IllegalStateException(
                        "Component '" + cell.componentId() + "' depends on "
                                + dep.getSimpleName() + ", which is not registered");
            }
        }
        return resolved;
    }

    private void detectCycles() {
        Set<String> done = new HashSet<>();
        for (ComponentCell cell : cells.values()) {
            visit(cell, new LinkedHashSet<>(), done);
        }
    }

    private void visit(ComponentCell cell, LinkedHashSet<String> path, Set<String> done) {
        String id = cell.componentId();
        if (done.contains(id)) {
            return;
        }
        if (!path.add(id)) {
            throw new IllegalStateException("Dependency cycle: " + String.join(" -> ", path) + " -> " + id);
        }
        for (ComponentCell dependency : dependencies.get(id)) {
            visit(dependency, path, done);
        }
        path.remove(id);
        done.add(id);
    }

    private void requireSealed() {
        if (!sealed) {
            throw new IllegalStateException("Component runtime is not sealed");
        }
    }
}
