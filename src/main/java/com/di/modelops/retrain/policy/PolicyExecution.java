package com.di.modelops.retrain.policy;

import com.di.modelops.retrain.job.RetrainJob;
import lombok.Builder;
import lombok.Value;

/**
 * What a non-dry-run evaluation did to the queue. {@code retrainJob} is the queued or already-active job,
 * null when nothing was queued.
 */
@Value
@Builder
public class PolicyExecution {
    boolean duplicateGuardTriggered;
    RetrainJob retrainJob;
    String rollbackStrategy;
}
