package com.di.modelops.retrain.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable queue of retrain jobs. Implementations can be in-memory or JDBC ({@code retrain_jobs}).
 * At most one job per cohort is active (queued or running) at any time.
 */
public interface RetrainJobStore {

    /**
     * Inserts a queued job. When the cohort already has an active job, returns that job instead.
     */
    EnqueueResult create(NewRetrainJob job);

    /** Most recent active job for the cohort created at or after {@code since}. */
    Optional<RetrainJob> findRecentActive(String cohort, Instant since);

    /**
     * Moves the oldest queued job (optionally for one cohort) to running and returns it. Concurrent callers
     * never receive the same job; a caller that finds nothing claimable returns empty without waiting.
     */
    Optional<RetrainJob> claimNext(String cohort);

    /**
     * Moves a running job to a terminal status.
     *
     * @throws RetrainJobNotFoundException when no job has this id
     * @throws RetrainJobStateException when the job is not running
     */
    RetrainJob finalize(long jobId, RetrainJobStatus status, RunDetails runDetails, String error,
                        ArtifactSnapshot artifactSnapshot);

    Optional<RetrainJob> findById(long jobId);

    /** Most recent first. */
    List<RetrainJob> list(String cohort, int limit);
}
