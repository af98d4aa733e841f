package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RetrainJobStore}. Suitable for single-node and testing.
 * All operations synchronize on the store, which gives the same exclusivity as the JDBC claim.
 * When modelops.persistence-enabled=true, {@link JdbcRetrainJobStore} is used instead.
 */
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "false")
public class InMemoryRetrainJobStore implements RetrainJobStore {

    private final Map<Long, RetrainJob> jobs = new LinkedHashMap<>();
    private final ModelOpsProperties properties;
    private final Clock clock;
    private long nextId = 1;

    public InMemoryRetrainJobStore(ModelOpsProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized EnqueueResult create(NewRetrainJob job) {
        Optional<RetrainJob> active = jobs.values().stream()
                .filter(j -> j.getCohort().equals(job.getCohort()) && j.getStatus().isActive())
                .findFirst();
        if (active.isPresent()) {
            return EnqueueResult.existing(active.get());
        }
        Instant now = clock.instant();
        RetrainJob created = RetrainJob.builder()
                .id(nextId++)
                .cohort(job.getCohort())
                .status(RetrainJobStatus.QUEUED)
                .triggerSource(job.getTriggerSource() != null ? job.getTriggerSource() : properties.getRetrain().getTriggerSource())
                .reasons(job.getReasons() != null ? List.copyOf(job.getReasons()) : List.of())
                .metrics(job.getMetrics())
                .thresholds(job.getThresholds())
                .artifactSnapshot(job.getArtifactSnapshot())
                .rollbackPlan(job.getRollbackPlan())
                .payloadVersion(NewRetrainJob.PAYLOAD_VERSION)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(created.getId(), created);
        return EnqueueResult.created(created);
    }

    @Override
    public synchronized Optional<RetrainJob> findRecentActive(String cohort, Instant since) {
        return jobs.values().stream()
                .filter(j -> j.getCohort().equals(cohort) && j.getStatus().isActive())
                .filter(j -> since == null || !j.getCreatedAt().isBefore(since))
                .max(Comparator.comparing(RetrainJob::getCreatedAt).thenComparing(RetrainJob::getId));
    }

    @Override
    public synchronized Optional<RetrainJob> claimNext(String cohort) {
        Optional<RetrainJob> oldest = jobs.values().stream()
                .filter(j -> j.getStatus() == RetrainJobStatus.QUEUED)
                .filter(j -> cohort == null || j.getCohort().equals(cohort))
                .min(Comparator.comparing(RetrainJob::getCreatedAt).thenComparing(RetrainJob::getId));
        if (oldest.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        RetrainJob running = oldest.get().toBuilder()
                .status(RetrainJobStatus.RUNNING)
                .startedAt(now)
                .updatedAt(now)
                .build();
        jobs.put(running.getId(), running);
        return Optional.of(running);
    }

    @Override
    public synchronized RetrainJob finalize(long jobId, RetrainJobStatus status, RunDetails runDetails, String error,
                                            ArtifactSnapshot artifactSnapshot) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Finalize status must be completed or failed, got " + status);
        }
        RetrainJob current = jobs.get(jobId);
        if (current == null) {
            throw new RetrainJobNotFoundException(jobId);
        }
        if (current.getStatus() != RetrainJobStatus.RUNNING) {
            throw new RetrainJobStateException(jobId, current.getStatus());
        }
        Instant now = clock.instant();
        RetrainJob finished = current.toBuilder()
                .status(status)
                .runDetails(runDetails)
                .error(error)
                .artifactSnapshot(artifactSnapshot)
                .completedAt(now)
                .updatedAt(now)
                .build();
        jobs.put(jobId, finished);
        return finished;
    }

    @Override
    public synchronized Optional<RetrainJob> findById(long jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<RetrainJob> list(String cohort, int limit) {
        List<RetrainJob> matching = jobs.values().stream()
                .filter(j -> j.getCohort().equals(cohort))
                .collect(Collectors.toCollection(ArrayList::new));
        matching.sort(Comparator.comparing(RetrainJob::getCreatedAt).thenComparing(RetrainJob::getId).reversed());
        return matching.size() > limit ? List.copyOf(matching.subList(0, Math.max(1, limit))) : matching;
    }
}
