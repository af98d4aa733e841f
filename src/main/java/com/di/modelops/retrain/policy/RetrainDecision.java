package com.di.modelops.retrain.policy;

import com.di.modelops.retrain.job.PolicyMetrics;
import com.di.modelops.retrain.job.PolicyThresholds;
import com.di.modelops.retrain.job.RetrainReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetrainDecision {
    String cohort;
    boolean dryRun;
    boolean shouldRetrain;
    PolicyAction action;
    List<RetrainReason> reasons;
    PolicyMetrics metrics;
    PolicyThresholds thresholds;
    PolicyExecution execution;
}
