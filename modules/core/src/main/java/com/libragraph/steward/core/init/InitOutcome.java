package com.libragraph.steward.core.init;

/**
 * Result a component reports once its start-up work is done.
 */
public sealed interface InitOutcome {

    record Succeeded() implements InitOutcome {}

    record Failed(String reason) implements InitOutcome {}

    static InitOutcome succeeded() {
        return new Succeeded();
    }

    static InitOutcome failed(String reason) {
        return new Failed(reason);
    }

    static InitOutcome failed(Throwable t) {
        String message = t.getMessage();
        return new Failed(message != null ? message : t.getClass().getName());
    }
}
