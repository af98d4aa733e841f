package com.di.modelops.retrain.job;

import lombok.Value;

/**
 * Outcome of {@link RetrainJobStore#create}: the new job, or the active job that already held the
 * cohort's slot ({@code created=false}).
 */
@Value
public class EnqueueResult {
    RetrainJob job;
    boolean created;

    public static EnqueueResult created(RetrainJob job) {
        return new EnqueueResult(job, true);
    }

    public static EnqueueResult existing(RetrainJob job) {
        return new EnqueueResult(job, false);
    }
}
