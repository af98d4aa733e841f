package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.util.ModelOpsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service over {@link RetrainJobStore}: attaches artifact snapshots and the rollback plan, resolves the
 * duplicate-guard window and clamps list limits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainJobService {

    private final RetrainJobStore store;
    private final ArtifactInspector artifactInspector;
    private final ModelOpsProperties properties;
    private final ModelOpsMetrics metrics;
    private final Clock clock;

    public EnqueueResult enqueue(String cohort, List<RetrainReason> reasons, PolicyMetrics policyMetrics,
                                 PolicyThresholds thresholds, String triggerSource) {
        NewRetrainJob job = NewRetrainJob.builder()
                .cohort(cohort)
                .triggerSource(triggerSource != null ? triggerSource : properties.getRetrain().getTriggerSource())
                .reasons(reasons)
                .metrics(policyMetrics)
                .thresholds(thresholds)
                .artifactSnapshot(artifactInspector.snapshot())
                .rollbackPlan(RollbackPlan.standard())
                .build();
        return store.create(job);
    }

    /**
     * Active job for the cohort created within the trailing {@code windowHours}.
     */
    public Optional<RetrainJob> findRecentActive(String cohort, int windowHours) {
        Instant since = clock.instant().minus(Duration.ofHours(Math.max(0, windowHours)));
        return store.findRecentActive(cohort, since);
    }

    public Optional<RetrainJob> claimNext(String cohort) {
        String filter = cohort == null || cohort.isBlank() ? null : cohort.trim();
        Optional<RetrainJob> claimed = store.claimNext(filter);
        metrics.recordClaim(claimed.isPresent());
        return claimed;
    }

    /**
     * Finalizes a running job with a fresh artifact snapshot.
     *
     * @throws RetrainJobNotFoundException when no job has this id
     * @throws RetrainJobStateException when the job is not running
     */
    public RetrainJob finalize(long jobId, RetrainJobStatus status, RunDetails runDetails, String error) {
        RetrainJob job = store.finalize(jobId, status, runDetails, error, artifactInspector.snapshot());
        metrics.recordFinalized(status.wire());
        return job;
    }

    public Optional<RetrainJob> findById(long jobId) {
        return store.findById(jobId);
    }

    public List<RetrainJob> list(String requestedCohort, Integer limit) {
        ModelOpsProperties.Retrain retrain = properties.getRetrain();
        int effective = limit == null || limit <= 0
                ? retrain.getListDefaultLimit()
                : Math.min(limit, retrain.getListMaxLimit());
        return store.list(properties.resolveCohort(requestedCohort), effective);
    }
}
