package com.di.modelops.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wire;

    AlertSeverity(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
