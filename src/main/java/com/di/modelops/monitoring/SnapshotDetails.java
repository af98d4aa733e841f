package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * JSON body of {@code mlops_monitoring_snapshot.details}.
 */
@Value
@Builder
@Jacksonized
public class SnapshotDetails {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;
    MonitoringThresholds thresholds;
    @Singular
    List<Alert> alerts;
    EscalationState escalationState;
}
