package com.di.modelops.retrain.job;

/**
 * Thrown when finalize is requested for a job that is not running (still queued, or already terminal).
 */
public class RetrainJobStateException extends IllegalStateException {

    private final long jobId;
    private final RetrainJobStatus currentStatus;

    public RetrainJobStateException(long jobId, RetrainJobStatus currentStatus) {
        super("Retrain job " + jobId + " is " + (currentStatus != null ? currentStatus.wire() : "unknown")
                + "; only running jobs can be finalized");
        this.jobId = jobId;
        this.currentStatus = currentStatus;
    }

    public long getJobId() {
        return jobId;
    }

    public RetrainJobStatus getCurrentStatus() {
        return currentStatus;
    }
}
