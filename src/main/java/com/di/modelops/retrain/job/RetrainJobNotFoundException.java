package com.di.modelops.retrain.job;

public class RetrainJobNotFoundException extends RuntimeException {

    private final long jobId;

    public RetrainJobNotFoundException(long jobId) {
        super("Retrain job not found: " + jobId);
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
