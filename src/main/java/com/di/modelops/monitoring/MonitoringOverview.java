package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one monitoring evaluation: current metrics, the thresholds applied, alerts raised and the
 * id of the snapshot that recorded it.
 */
@Value
@Builder
public class MonitoringOverview {
    String cohort;
    CohortMetrics metrics;
    MonitoringThresholds thresholds;
    List<Alert> alerts;
    EscalationState escalationState;
    Long snapshotId;
}
