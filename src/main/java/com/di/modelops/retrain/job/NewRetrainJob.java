package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything captured when the policy asks for a job; the store adds id, status and timestamps.
 */
@Value
@Builder
public class NewRetrainJob {

    public static final int PAYLOAD_VERSION = 1;

    String cohort;
    String triggerSource;
    List<RetrainReason> reasons;
    PolicyMetrics metrics;
    PolicyThresholds thresholds;
    ArtifactSnapshot artifactSnapshot;
    RollbackPlan rollbackPlan;
}
