package com.libragraph.steward.core.state;

import com.libragraph.steward.types.LifecycleState;
import org.junit.jupiter.api.Test;

import static com.libragraph.steward.types.LifecycleState.*;
import static org.assertj.core.api.Assertions.assertThat;

class LifecycleTransitionsTest {

    @Test
    void shouldAllowOnlyTheFixedEdges() {
        assertThat(LifecycleTransitions.validTargets(STARTING)).containsExactly(INITIALIZING);
        assertThat(LifecycleTransitions.validTargets(INITIALIZING)).containsExactlyInAnyOrder(ACTIVE, FAILED);
        assertThat(LifecycleTransitions.validTargets(ACTIVE)).containsExactly(STOPPING);
        assertThat(LifecycleTransitions.validTargets(FAILED)).containsExactly(STOPPING);
        assertThat(LifecycleTransitions.validTargets(STOPPING)).containsExactly(STOPPED);
        assertThat(LifecycleTransitions.validTargets(STOPPED)).isEmpty();
    }

    @Test
    void shouldRejectSelfTransitions() {
        for (LifecycleState state : LifecycleState.values()) {
            assertThat(LifecycleTransitions.isValid(state, state)).as(state.name()).isFalse();
        }
    }

    @Test
    void shouldRejectReverting() {
        assertThat(LifecycleTransitions.isValid(ACTIVE, INITIALIZING)).isFalse();
        assertThat(LifecycleTransitions.isValid(FAILED, ACTIVE)).isFalse();
        assertThat(LifecycleTransitions.isValid(STOPPED, STARTING)).isFalse();
        assertThat(LifecycleTransitions.isValid(INITIALIZING, STOPPING)).isFalse();
    }

    @Test
    void validTargetsShouldBeACopy() {
        LifecycleTransitions.validTargets(ACTIVE).add(INITIALIZING);

        assertThat(LifecycleTransitions.isValid(ACTIVE, INITIALIZING)).isFalse();
    }
}
