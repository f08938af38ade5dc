package com.libragraph.steward.core.init;

public enum InitStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    public static InitStatus of(InitOutcome outcome) {
        return outcome instanceof InitOutcome.Failed ? FAILED : SUCCEEDED;
    }
}
