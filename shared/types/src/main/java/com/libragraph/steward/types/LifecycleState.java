package com.libragraph.steward.types;

/**
 * Process-wide readiness state. Declaration order is lifecycle order:
 * {@code STARTING} is the only initial value and {@code STOPPED} the only terminal one.
 */
public enum LifecycleState {
    STARTING(0, "starting"),
    INITIALIZING(1, "initializing"),
    ACTIVE(2, "active"),
    FAILED(3, "failed"),
    STOPPING(4, "stopping"),
    STOPPED(5, "stopped");

    private final int id;
    private final String label;

    LifecycleState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** True once the process has begun or finished shutting down. */
    public boolean isShuttingDown() {
        return this == STOPPING || this == STOPPED;
    }

    public boolean isTerminal() {
        return this == STOPPED;
    }

    public static LifecycleState fromId(int id) {
        for (LifecycleState s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown LifecycleState id: " + id);
    }

    public static LifecycleState fromLabel(String label) {
        for (LifecycleState s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown LifecycleState label: " + label);
    }
}
