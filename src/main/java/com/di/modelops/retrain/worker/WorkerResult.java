package com.di.modelops.retrain.worker;

import com.di.modelops.retrain.job.RetrainJob;
import com.di.modelops.retrain.job.RunDetails;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkerResult {
    WorkerStatus status;
    String message;
    /** Null for noop. */
    RetrainJob job;
    RunDetails runDetails;

    public static WorkerResult noop() {
        return WorkerResult.builder()
                .status(WorkerStatus.NOOP)
                .message("No queued retrain jobs available.")
                .build();
    }
}
