package com.di.modelops.retrain.job;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReasonCode {
    ACCURACY_BREACH("accuracy_breach"),
    BRIER_BREACH("brier_breach"),
    NEW_LABELS_THRESHOLD("new_labels_threshold");

    private final String wire;

    ReasonCode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
