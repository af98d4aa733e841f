package com.di.modelops.retrain.worker;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkerStatus {
    NOOP("noop"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wire;

    WorkerStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
