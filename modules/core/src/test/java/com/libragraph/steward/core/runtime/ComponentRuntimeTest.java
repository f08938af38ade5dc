package com.libragraph.steward.core.runtime;

import com.libragraph.steward.core.component.AbstractManagedComponent;
import com.libragraph.steward.core.component.ComponentContext;
import com.libragraph.steward.core.component.DependsOn;
import com.libragraph.steward.core.component.ManagedComponent;
import com.libragraph.steward.core.init.InitOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentRuntimeTest {

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private ComponentRuntime runtime;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        runtime = new ComponentRuntime(executor, scheduler, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        executor.shutdownNow();
    }

    static class Store extends AbstractManagedComponent {
        @Override
        public String componentId() {
            return "store";
        }

        @Override
        public boolean initRequired() {
            return true;
        }

        @Override
        protected void doStart() {
        }
    }

    @DependsOn(Store.class)
    static class Index extends AbstractManagedComponent {
        @Override
        public String componentId() {
            return "index";
        }

        @Override
        public Optional<Duration> stopTimeout() {
            return Optional.of(Duration.ofSeconds(3));
        }

        @Override
        protected void doStart() {
            throw new IllegalStateException("index corrupt");
        }
    }

    @DependsOn(Index.class)
    @DependsOn(Store.class)
    static class Search implements ManagedComponent {
        @Override
        public String componentId() {
            return "search";
        }

        @Override
        public void start(ComponentContext context) {
            context.initSucceeded();
        }
    }

    @DependsOn(CycleB.class)
    static class CycleA implements ManagedComponent {
        @Override
        public String componentId() {
            return "cycle-a";
        }

        @Override
        public void start(ComponentContext context) {
        }
    }

    @DependsOn(CycleA.class)
    static class CycleB implements ManagedComponent {
        @Override
        public String componentId() {
            return "cycle-b";
        }

        @Override
        public void start(ComponentContext context) {
        }
    }

    /** Blocks in start until interrupted. */
    static class Hanging implements ManagedComponent {
        final CountDownLatch entered = new CountDownLatch(1);

        @Override
        public String componentId() {
            return "hanging";
        }

        @Override
        public void start(ComponentContext context) throws Exception {
            entered.countDown();
            new CountDownLatch(1).await();
        }
    }

    @Test
    void shouldDeriveTopLevelAndDependents() {
        runtime.register(new Store());
        runtime.register(new Index());
        runtime.register(new Search());
        runtime.seal();

        assertThat(runtime.topLevel()).extracting(ComponentCell::componentId).containsExactly("store");
        assertThat(runtime.cell("store").orElseThrow().dependents())
                .extracting(ComponentCell::componentId).containsExactlyInAnyOrder("index", "search");
        assertThat(runtime.cell("index").orElseThrow().dependents())
                .extracting(ComponentCell::componentId).containsExactly("search");
        assertThat(runtime.dependenciesOf("search"))
                .extracting(ComponentCell::componentId).containsExactlyInAnyOrder("index", "store");
    }

    @Test
    void shouldApplyAdvertisedOrDefaultStopTimeout() {
        runtime.register(new Store());
        runtime.register(new Index());

        assertThat(runtime.cell("store").orElseThrow().stopTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(runtime.cell("index").orElseThrow().stopTimeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void shouldListRequiredComponents() {
        runtime.register(new Store());
        runtime.register(new Index());

        assertThat(runtime.requiredComponentIds()).containsExactly("store");
    }

    @Test
    void shouldRejectDuplicateIds() {
        runtime.register(new Store());

        assertThatThrownBy(() -> runtime.register(new Store()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate component id 'store'");
    }

    @Test
    void shouldRejectUnknownDependency() {
        runtime.register(new Index());

        assertThatThrownBy(runtime::seal)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("depends on Store, which is not registered");
    }

    @Test
    void shouldRejectDependencyCycles() {
        runtime.register(new CycleA());
        runtime.register(new CycleB());

        assertThatThrownBy(runtime::seal)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Dependency cycle");
    }

    @Test
    void shouldRejectRegistrationAfterSeal() {
        runtime.seal();

        assertThatThrownBy(() -> runtime.register(new Store()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already sealed");
    }

    @Test
    void shouldRequireSealBeforeStart() {
        assertThatThrownBy(() -> runtime.startAll((id, outcome) -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReportStartOutcomes() throws Exception {
        runtime.register(new Store());
        runtime.register(new Index());
        runtime.register(new Search());
        runtime.seal();
        Map<String, InitOutcome> outcomes = new ConcurrentHashMap<>();
        CountDownLatch reported = new CountDownLatch(3);

        runtime.startAll((id, outcome) -> {
            if (outcomes.putIfAbsent(id, outcome) == null) {
                reported.countDown();
            }
        });

        assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(outcomes.get("store")).isInstanceOf(InitOutcome.Succeeded.class);
        assertThat(outcomes.get("search")).isInstanceOf(InitOutcome.Succeeded.class);
        assertThat(outcomes.get("index")).isEqualTo(InitOutcome.failed("index corrupt"));
    }

    @Test
    void killShouldNotLeaveThePoolThreadInterrupted() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ComponentRuntime serial = new ComponentRuntime(single, scheduler, Duration.ofSeconds(10));
            Hanging hanging = new Hanging();
            serial.register(hanging);
            serial.seal();
            Map<String, InitOutcome> outcomes = new ConcurrentHashMap<>();
            serial.startAll(outcomes::put);
            assertThat(hanging.entered.await(5, TimeUnit.SECONDS)).isTrue();

            ComponentCell cell = serial.cell("hanging").orElseThrow();
            cell.kill();

            assertThat(cell.isTerminated()).isTrue();
            // the next task on the same (only) pool thread must start clean
            assertThat(single.submit(() -> Thread.currentThread().isInterrupted()).get(5, TimeUnit.SECONDS))
                    .isFalse();
            assertThat(outcomes.get("hanging")).isInstanceOf(InitOutcome.Failed.class);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void killAfterHandlerReturnedShouldNotInterruptLaterTasks() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ComponentRuntime serial = new ComponentRuntime(single, scheduler, Duration.ofSeconds(10));
            serial.register(new Store());
            serial.seal();
            CountDownLatch reported = new CountDownLatch(1);
            serial.startAll((id, outcome) -> reported.countDown());
            assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();

            CountDownLatch release = new CountDownLatch(1);
            Future<Boolean> neighbour = single.submit(() -> {
                release.await(5, TimeUnit.SECONDS);
                return Thread.currentThread().isInterrupted();
            });
            serial.cell("store").orElseThrow().kill();
            release.countDown();

            assertThat(neighbour.get(5, TimeUnit.SECONDS)).isFalse();
        } finally {
            single.shutdownNow();
        }
    }
}
