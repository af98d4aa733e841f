package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One row of {@code retrain_jobs}. Rows are never deleted; they are the retrain audit trail.
 */
@Value
@Builder(toBuilder = true)
public class RetrainJob {
    Long id;
    String cohort;
    RetrainJobStatus status;
    String triggerSource;
    List<RetrainReason> reasons;
    PolicyMetrics metrics;
    PolicyThresholds thresholds;
    ArtifactSnapshot artifactSnapshot;
    RollbackPlan rollbackPlan;
    RunDetails runDetails;
    String error;
    int payloadVersion;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    Instant updatedAt;
}
