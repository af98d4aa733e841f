package com.di.modelops.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for alerts, policy decisions and retrain job lifecycle.
 */
@Slf4j
@Component
public class ModelOpsMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter snapshotCounter;
    private final Counter jobsClaimedCounter;
    private final Counter emptyClaimCounter;

    public ModelOpsMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.snapshotCounter = Counter.builder("modelops.monitoring.snapshots.total")
                .description("Monitoring evaluations persisted as snapshots")
                .register(meterRegistry);

        this.jobsClaimedCounter = Counter.builder("modelops.jobs.claimed.total")
                .description("Retrain jobs claimed by a worker")
                .tag("result", "claimed")
                .register(meterRegistry);

        this.emptyClaimCounter = Counter.builder("modelops.jobs.claimed.total")
                .description("Claim attempts that found no queued job")
                .tag("result", "empty")
                .register(meterRegistry);

        log.info("[METRICS] ModelOps metrics registered");
    }

    public void recordSnapshot() {
        snapshotCounter.increment();
    }

    /** Tagged by severity: low, medium, high. */
    public void recordAlert(String severity) {
        Counter.builder("modelops.alerts.total")
                .description("Alerts raised by monitoring evaluations")
                .tag("severity", severity)
                .register(meterRegistry)
                .increment();
    }

    public void recordPolicyDecision(String action) {
        Counter.builder("modelops.policy.decisions.total")
                .description("Retrain policy evaluations by resulting action")
                .tag("action", action)
                .register(meterRegistry)
                .increment();
    }

    public void recordClaim(boolean claimed) {
        (claimed ? jobsClaimedCounter : emptyClaimCounter).increment();
    }

    public void recordFinalized(String status) {
        Counter.builder("modelops.jobs.finalized.total")
                .description("Retrain jobs finalized by terminal status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }
}
