package com.di.modelops.monitoring;

import com.di.modelops.audit.AuditModule;
import com.di.modelops.audit.AuditRecord;
import com.di.modelops.audit.AuditSink;
import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.util.ModelOpsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Monitoring entry points: evaluate a cohort now (metrics, alerts, snapshot, audit) and read its trend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringService {

    private final MetricsAggregator aggregator;
    private final AlertEngine alertEngine;
    private final TrendStore trendStore;
    private final AuditSink auditSink;
    private final ModelOpsMetrics metrics;
    private final ModelOpsProperties properties;
    private final Clock clock;

    /**
     * Computes current metrics, evaluates alerts against prior history, appends one snapshot and
     * records one audit event. Source query failures propagate.
     */
    public MonitoringOverview getOverview(String requestedCohort) {
        String cohort = properties.resolveCohort(requestedCohort);
        ModelOpsProperties.Monitoring monitoring = properties.getMonitoring();
        MonitoringThresholds thresholds = MonitoringThresholds.from(monitoring);

        CohortMetrics current = aggregator.compute(cohort);
        // history is read before the append so the current point is not counted twice
        List<MonitoringSnapshot> history = trendStore.findRecent(cohort, Math.max(1, monitoring.getHistoryLimit()));
        AlertEvaluation evaluation = alertEngine.evaluate(current, thresholds, history);

        MonitoringSnapshot saved = trendStore.append(MonitoringSnapshot.builder()
                .cohort(cohort)
                .capturedAt(current.getComputedAt() != null ? current.getComputedAt() : clock.instant())
                .evaluatedPredictions(current.getEvaluatedPredictions())
                .accuracy(current.getAccuracy())
                .brierScore(current.getBrierScore())
                .gameDataFreshnessDays(current.getGameDataFreshnessDays())
                .pipelineFreshnessDays(current.getPipelineFreshnessDays())
                .alertCount(evaluation.getAlerts().size())
                .details(SnapshotDetails.builder()
                        .thresholds(thresholds)
                        .alerts(evaluation.getAlerts())
                        .escalationState(evaluation.getEscalationState())
                        .build())
                .build());

        metrics.recordSnapshot();
        evaluation.getAlerts().forEach(a -> metrics.recordAlert(a.getSeverity().wire()));

        auditSink.record(AuditRecord.builder()
                .module(AuditModule.MONITORING)
                .status(evaluation.hasAlerts() ? AuditRecord.DEGRADED : AuditRecord.SUCCESS)
                .recordsProcessed((int) Math.min(Integer.MAX_VALUE, current.getEvaluatedPredictions()))
                .detail("cohort", cohort)
                .detail("snapshot_id", saved.getId())
                .detail("alert_count", evaluation.getAlerts().size())
                .detail("escalation_state", evaluation.getEscalationState().wire())
                .build());

        if (evaluation.hasAlerts()) {
            log.warn("[MONITOR] cohort={} alerts={} escalation={}", cohort,
                    evaluation.getAlerts().size(), evaluation.getEscalationState().wire());
        } else {
            log.info("[MONITOR] cohort={} healthy evaluated={}", cohort, current.getEvaluatedPredictions());
        }

        return MonitoringOverview.builder()
                .cohort(cohort)
                .metrics(current)
                .thresholds(thresholds)
                .alerts(evaluation.getAlerts())
                .escalationState(evaluation.getEscalationState())
                .snapshotId(saved.getId())
                .build();
    }

    /**
     * Snapshots of the trailing {@code days}, most recent first. Null or non-positive arguments take the
     * configured defaults; larger values are capped at the configured maxima.
     */
    public MonitoringTrend getTrend(String requestedCohort, Integer days, Integer limit) {
        String cohort = properties.resolveCohort(requestedCohort);
        ModelOpsProperties.Monitoring monitoring = properties.getMonitoring();
        int effectiveDays = clamp(days, monitoring.getTrendDefaultDays(), monitoring.getTrendMaxDays());
        int effectiveLimit = clamp(limit, monitoring.getTrendDefaultLimit(), monitoring.getTrendMaxLimit());
        Instant since = clock.instant().minus(Duration.ofDays(effectiveDays));
        List<MonitoringSnapshot> points = trendStore.findSince(cohort, since, effectiveLimit);
        return MonitoringTrend.builder()
                .cohort(cohort)
                .days(effectiveDays)
                .limit(effectiveLimit)
                .points(points)
                .build();
    }

    static int clamp(Integer requested, int defaultValue, int max) {
        if (requested == null || requested <= 0) {
            return Math.min(defaultValue, max);
        }
        return Math.min(requested, max);
    }
}
