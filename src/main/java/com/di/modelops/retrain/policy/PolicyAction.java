package com.di.modelops.retrain.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyAction {
    DRY_RUN_NOOP("dry-run-noop"),
    NOOP("noop"),
    ALREADY_QUEUED("already-queued"),
    QUEUED_RETRAIN("queued-retrain");

    private final String wire;

    PolicyAction(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
