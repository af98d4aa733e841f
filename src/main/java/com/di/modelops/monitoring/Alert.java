package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One threshold breach found by a monitoring evaluation. Stored inside the snapshot details only.
 */
@Value
@Builder
@Jacksonized
public class Alert {

    public static final String ACCURACY_BREACH = "accuracy_breach";
    public static final String BRIER_BREACH = "brier_breach";
    public static final String GAME_DATA_STALE = "game_data_stale";
    public static final String PIPELINE_STALE = "pipeline_stale";

    String id;
    AlertSeverity severity;
    String message;
    /** Consecutive breaching points including the current one. */
    int breachStreak;
    EscalationLevel escalationLevel;
    String recommendedAction;
}
