package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One persisted monitoring evaluation. Written once per evaluation, never updated.
 */
@Value
@Builder(toBuilder = true)
public class MonitoringSnapshot {
    Long id;
    String cohort;
    Instant capturedAt;
    long evaluatedPredictions;
    Double accuracy;
    Double brierScore;
    Integer gameDataFreshnessDays;
    Integer pipelineFreshnessDays;
    int alertCount;
    SnapshotDetails details;
}
