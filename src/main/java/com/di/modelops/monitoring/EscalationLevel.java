package com.di.modelops.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency of a single alert, derived from its severity and breach streak, with the action it calls for.
 */
public enum EscalationLevel {
    NONE("none", "monitor"),
    WATCH("watch", "investigate_now"),
    INCIDENT("incident", "open_incident");

    private final String wire;
    private final String recommendedAction;

    EscalationLevel(String wire, String recommendedAction) {
        this.wire = wire;
        this.recommendedAction = recommendedAction;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public String recommendedAction() {
        return recommendedAction;
    }

    /**
     * high with streak >= 2 is an incident; high alone, or medium sustained for 3+ points, is a watch.
     */
    public static EscalationLevel of(AlertSeverity severity, int breachStreak) {
        if (severity == AlertSeverity.HIGH) {
            return breachStreak >= 2 ? INCIDENT : WATCH;
        }
        if (severity == AlertSeverity.MEDIUM && breachStreak >= 3) {
            return WATCH;
        }
        return NONE;
    }
}
