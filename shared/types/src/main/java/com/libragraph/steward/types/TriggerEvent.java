package com.libragraph.steward.types;

/**
 * Binary signal that opens ({@link #ENABLE}) or closes ({@link #DISABLE}) a stream gate.
 */
public enum TriggerEvent {
    ENABLE,
    DISABLE;

    public boolean opens() {
        return this == ENABLE;
    }

    public static TriggerEvent of(boolean open) {
        return open ? ENABLE : DISABLE;
    }
}
