package com.di.modelops.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

/**
 * Aggregate urgency of one monitoring evaluation.
 */
public enum EscalationState {
    NONE("none"),
    ACTIVE("active"),
    WATCH("watch"),
    INCIDENT("incident");

    private final String wire;

    EscalationState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static EscalationState aggregate(Collection<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return NONE;
        }
        boolean watch = false;
        for (Alert alert : alerts) {
            if (alert.getEscalationLevel() == EscalationLevel.INCIDENT) {
                return INCIDENT;
            }
            if (alert.getEscalationLevel() == EscalationLevel.WATCH) {
                watch = true;
            }
        }
        return watch ? WATCH : ACTIVE;
    }
}
