package com.di.modelops.retrain.policy;

import com.di.modelops.audit.AuditModule;
import com.di.modelops.audit.AuditRecord;
import com.di.modelops.audit.AuditSink;
import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.monitoring.CohortMetrics;
import com.di.modelops.monitoring.MetricsAggregator;
import com.di.modelops.monitoring.MetricsSource;
import com.di.modelops.retrain.job.EnqueueResult;
import com.di.modelops.retrain.job.PolicyMetrics;
import com.di.modelops.retrain.job.PolicyThresholds;
import com.di.modelops.retrain.job.RetrainJob;
import com.di.modelops.retrain.job.RetrainJobService;
import com.di.modelops.retrain.job.RetrainReason;
import com.di.modelops.util.ModelOpsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether a cohort needs retraining and, outside dry run, queues at most one job for it.
 * <p>Reasons are checked independently: accuracy below min, Brier above max, and pending new labels
 * (completed items not yet scored) at or above the configured minimum.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainPolicyService {

    private final MetricsAggregator aggregator;
    private final MetricsSource metricsSource;
    private final RetrainJobService jobService;
    private final AuditSink auditSink;
    private final ModelOpsMetrics metrics;
    private final ModelOpsProperties properties;

    public RetrainDecision evaluate(String requestedCohort, boolean dryRun) {
        String cohort = properties.resolveCohort(requestedCohort);
        PolicyThresholds thresholds = PolicyThresholds.from(properties);

        CohortMetrics current = aggregator.compute(cohort);
        long completed = Math.max(0L, metricsSource.countCompletedItems(cohort));
        long evaluated = current.getEvaluatedPredictions();
        PolicyMetrics policyMetrics = PolicyMetrics.builder()
                .completedItems(completed)
                .evaluatedPredictions(evaluated)
                .newLabelsPending(Math.max(completed - evaluated, 0L))
                .accuracy(current.getAccuracy())
                .brierScore(current.getBrierScore())
                .build();

        List<RetrainReason> reasons = reasons(policyMetrics, thresholds);
        boolean shouldRetrain = !reasons.isEmpty();

        PolicyAction action;
        PolicyExecution execution = null;
        if (dryRun) {
            action = PolicyAction.DRY_RUN_NOOP;
        } else if (!shouldRetrain) {
            action = PolicyAction.NOOP;
        } else {
            execution = enqueue(cohort, reasons, policyMetrics, thresholds);
            action = execution.isDuplicateGuardTriggered() ? PolicyAction.ALREADY_QUEUED : PolicyAction.QUEUED_RETRAIN;
        }

        metrics.recordPolicyDecision(action.wire());
        auditSink.record(AuditRecord.builder()
                .module(AuditModule.RETRAIN_POLICY)
                .status(shouldRetrain ? AuditRecord.DEGRADED : AuditRecord.SUCCESS)
                .recordsProcessed((int) Math.min(Integer.MAX_VALUE, policyMetrics.getNewLabelsPending()))
                .detail("cohort", cohort)
                .detail("dry_run", dryRun)
                .detail("action", action.wire())
                .detail("reasons", reasons.stream().map(RetrainReason::getMessage).collect(Collectors.toList()))
                .detail("retrain_job_id", execution != null && execution.getRetrainJob() != null
                        ? execution.getRetrainJob().getId() : null)
                .build());
        log.info("[POLICY] cohort={} dryRun={} shouldRetrain={} action={}", cohort, dryRun, shouldRetrain, action.wire());

        return RetrainDecision.builder()
                .cohort(cohort)
                .dryRun(dryRun)
                .shouldRetrain(shouldRetrain)
                .action(action)
                .reasons(reasons)
                .metrics(policyMetrics)
                .thresholds(thresholds)
                .execution(execution)
                .build();
    }

    static List<RetrainReason> reasons(PolicyMetrics metrics, PolicyThresholds thresholds) {
        List<RetrainReason> reasons = new ArrayList<>();
        if (metrics.getAccuracy() != null && metrics.getAccuracy() < thresholds.getAccuracyMin()) {
            reasons.add(RetrainReason.accuracyBreach(metrics.getAccuracy(), thresholds.getAccuracyMin()));
        }
        if (metrics.getBrierScore() != null && metrics.getBrierScore() > thresholds.getBrierMax()) {
            reasons.add(RetrainReason.brierBreach(metrics.getBrierScore(), thresholds.getBrierMax()));
        }
        if (metrics.getNewLabelsPending() >= thresholds.getNewLabelsMin()) {
            reasons.add(RetrainReason.newLabels(metrics.getNewLabelsPending(), thresholds.getNewLabelsMin()));
        }
        return List.copyOf(reasons);
    }

    private PolicyExecution enqueue(String cohort, List<RetrainReason> reasons, PolicyMetrics policyMetrics,
                                    PolicyThresholds thresholds) {
        Optional<RetrainJob> active = jobService.findRecentActive(cohort, properties.getRetrain().getDuplicateWindowHours());
        if (active.isPresent()) {
            log.info("[POLICY] Duplicate guard: cohort {} already has job id={} ({})",
                    cohort, active.get().getId(), active.get().getStatus().wire());
            return execution(active.get(), true);
        }
        // the store's unique active slot closes the race between the check above and this insert
        EnqueueResult result = jobService.enqueue(cohort, reasons, policyMetrics, thresholds, null);
        return execution(result.getJob(), !result.isCreated());
    }

    private static PolicyExecution execution(RetrainJob job, boolean duplicate) {
        return PolicyExecution.builder()
                .duplicateGuardTriggered(duplicate)
                .retrainJob(job)
                .rollbackStrategy(job.getRollbackPlan() != null ? job.getRollbackPlan().getStrategy() : null)
                .build();
    }
}
