package com.di.modelops.retrain.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrain job lifecycle. Transitions only move forward: queued to running, running to completed or failed.
 */
public enum RetrainJobStatus {
    QUEUED("queued"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wire;

    RetrainJobStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static RetrainJobStatus fromWire(String value) {
        if (value != null) {
            for (RetrainJobStatus status : values()) {
                if (status.wire.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown retrain job status: " + value);
    }
}
