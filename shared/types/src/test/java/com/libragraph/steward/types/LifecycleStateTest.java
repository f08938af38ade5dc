package com.libragraph.steward.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LifecycleStateTest {

    @Test
    void shouldResolveByIdAndLabel() {
        for (LifecycleState state : LifecycleState.values()) {
            assertThat(LifecycleState.fromId(state.id())).isEqualTo(state);
            assertThat(LifecycleState.fromLabel(state.label())).isEqualTo(state);
        }
        assertThat(LifecycleState.fromLabel("ACTIVE")).isEqualTo(LifecycleState.ACTIVE);
    }

    @Test
    void shouldRejectUnknownId() {
        assertThatThrownBy(() -> LifecycleState.fromId(42))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("42");
    }

    @Test
    void shouldOnlyTreatStoppedAsTerminal() {
        assertThat(LifecycleState.values())
                .filteredOn(LifecycleState::isTerminal)
                .containsExactly(LifecycleState.STOPPED);
        assertThat(LifecycleState.values())
                .filteredOn(LifecycleState::isShuttingDown)
                .containsExactly(LifecycleState.STOPPING, LifecycleState.STOPPED);
    }

    @Test
    void shouldMapBooleanToTrigger() {
        assertThat(TriggerEvent.of(true)).isEqualTo(TriggerEvent.ENABLE);
        assertThat(TriggerEvent.of(false)).isEqualTo(TriggerEvent.DISABLE);
        assertThat(TriggerEvent.ENABLE.opens()).isTrue();
        assertThat(TriggerEvent.DISABLE.opens()).isFalse();
    }
}
