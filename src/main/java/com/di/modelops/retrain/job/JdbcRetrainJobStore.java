package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.sql.JsonColumnCodec;
import com.di.modelops.sql.SchemaGuard;
import com.di.modelops.sql.SqlQueriesProperties;
import com.di.modelops.sql.SqlTimes;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link RetrainJobStore} over {@code retrain_jobs}.
 * <p>The unique index on {@code active_cohort} (cohort while queued/running, NULL once terminal) keeps one
 * active job per cohort. A claim reads the oldest queued ids and moves the first it can with a conditional
 * {@code status = 'queued'} update; a candidate taken by a concurrent claim updates zero rows and is passed
 * over. Claiming returns empty only once no queued job is visible, and no lock outlives one update.
 * Active when {@code modelops.persistence-enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class JdbcRetrainJobStore implements RetrainJobStore {

    private static final TypeReference<List<RetrainReason>> REASONS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final SchemaGuard schemaGuard;
    private final JsonColumnCodec codec;
    private final ModelOpsProperties properties;
    private final Clock clock;

    public JdbcRetrainJobStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, SchemaGuard schemaGuard,
                               JsonColumnCodec codec, ModelOpsProperties properties, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.schemaGuard = schemaGuard;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }


    @Override
    public EnqueueResult create(NewRetrainJob job) {
        String reasons = codec.write(job.getReasons() != null ? job.getReasons() : List.of());
        String metrics = codec.write(job.getMetrics());
        String thresholds = codec.write(job.getThresholds());
        String artifacts = codec.write(job.getArtifactSnapshot());
        String rollback = codec.write(job.getRollbackPlan());
        String triggerSource = job.getTriggerSource() != null ? job.getTriggerSource() : properties.getRetrain().getTriggerSource();
        Timestamp now = SqlTimes.toTimestamp(clock.instant());
        try {
            long id = schemaGuard.call("jobs.create", () -> {
                KeyHolder keys = new GeneratedKeyHolder();
                jdbc.update(con -> {
                    PreparedStatement ps = con.prepareStatement(sql.getJobs().getInsert(), new String[]{"id"});
                    ps.setString(1, job.getCohort());
                    ps.setString(2, triggerSource);
                    ps.setString(3, reasons);
                    ps.setString(4, metrics);
                    ps.setString(5, thresholds);
                    ps.setString(6, artifacts);
                    ps.setString(7, rollback);
                    ps.setInt(8, NewRetrainJob.PAYLOAD_VERSION);
                    ps.setString(9, job.getCohort());
                    ps.setTimestamp(10, now);
                    ps.setTimestamp(11, now);
                    return ps;
                }, keys);
                Number key = keys.getKey();
                if (key == null) {
                    throw new IllegalStateException("retrain_jobs insert returned no id");
                }
                return key.longValue();
            });
            RetrainJob created = findById(id).orElseThrow(() -> new RetrainJobNotFoundException(id));
            log.info("[JOBS] Queued retrain job id={} cohort={}", id, job.getCohort());
            return EnqueueResult.created(created);
        } catch (DuplicateKeyException e) {
            // another caller took the cohort's active slot between the guard check and this insert
            Optional<RetrainJob> existing = findActive(job.getCohort());
            if (existing.isEmpty()) {
                throw e;
            }
            log.info("[JOBS] Cohort {} already has active job id={}; not queuing another",
                    job.getCohort(), existing.get().getId());
            return EnqueueResult.existing(existing.get());
        }
    }

    @Override
    public Optional<RetrainJob> findRecentActive(String cohort, Instant since) {
        List<RetrainJob> rows = schemaGuard.call("jobs.findRecentActive",
                () -> jdbc.query(sql.getJobs().getFindRecentActive(), this::mapRow, cohort, SqlTimes.toTimestamp(since)));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Optional<RetrainJob> claimNext(String cohort) {
        int scanLimit = Math.max(1, properties.getRetrain().getClaimScanLimit());
        Long claimedId = schemaGuard.call("jobs.claimNext", () -> {
            while (true) {
                List<Long> candidates = cohort == null
                        ? jdbc.queryForList(sql.getJobs().getClaimCandidates(), Long.class, scanLimit)
                        : jdbc.queryForList(sql.getJobs().getClaimCandidatesByCohort(), Long.class, cohort, scanLimit);
                if (candidates.isEmpty()) {
                    return null;
                }
                Timestamp now = SqlTimes.toTimestamp(clock.instant());
                for (Long id : candidates) {
                    if (jdbc.update(sql.getJobs().getMarkRunning(), now, now, id) == 1) {
                        return id;
                    }
                }
                // every candidate went to a concurrent claim; rescan until none are queued
                log.debug("[JOBS] Lost {} claim candidate(s) to concurrent workers; rescanning", candidates.size());
            }
        });
        if (claimedId == null) {
            return Optional.empty();
        }
        log.info("[JOBS] Claimed retrain job id={}", claimedId);
        return findById(claimedId);
    }

    @Override
    public RetrainJob finalize(long jobId, RetrainJobStatus status, RunDetails runDetails, String error,
                               ArtifactSnapshot artifactSnapshot) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Finalize status must be completed or failed, got " + status);
        }
        String details = codec.write(runDetails);
        String artifacts = codec.write(artifactSnapshot);
        Timestamp now = SqlTimes.toTimestamp(clock.instant());
        int updated = schemaGuard.call("jobs.finalize", () -> jdbc.update(sql.getJobs().getFinalizeRunning(),
                status.wire(), details, error, artifacts, now, now, jobId));
        if (updated == 0) {
            RetrainJob current = findById(jobId).orElseThrow(() -> new RetrainJobNotFoundException(jobId));
            throw new RetrainJobStateException(jobId, current.getStatus());
        }
        log.info("[JOBS] Finalized retrain job id={} status={}", jobId, status.wire());
        return findById(jobId).orElseThrow(() -> new RetrainJobNotFoundException(jobId));
    }

    @Override
    public Optional<RetrainJob> findById(long jobId) {
        List<RetrainJob> rows = schemaGuard.call("jobs.findById",
                () -> jdbc.query(sql.getJobs().getFindById(), this::mapRow, jobId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<RetrainJob> list(String cohort, int limit) {
        return schemaGuard.call("jobs.list",
                () -> jdbc.query(sql.getJobs().getListByCohort(), this::mapRow, cohort, Math.max(1, limit)));
    }

    private Optional<RetrainJob> findActive(String cohort) {
        List<RetrainJob> rows = schemaGuard.call("jobs.findActive",
                () -> jdbc.query(sql.getJobs().getFindActiveByCohort(), this::mapRow, cohort));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<RetrainReason> readReasons(String json) {
        List<RetrainReason> reasons = codec.read(json, REASONS_TYPE);
        return reasons != null ? reasons : List.of();
    }

    private RetrainJob mapRow(ResultSet rs, int rowNum) throws SQLException {
        return RetrainJob.builder()
                .id(rs.getLong("id"))
                .cohort(rs.getString("cohort"))
                .status(RetrainJobStatus.fromWire(rs.getString("status")))
                .triggerSource(rs.getString("trigger_source"))
                .reasons(readReasons(rs.getString("reasons")))
                .metrics(codec.read(rs.getString("metrics"), PolicyMetrics.class))
                .thresholds(codec.read(rs.getString("thresholds"), PolicyThresholds.class))
                .artifactSnapshot(codec.read(rs.getString("artifact_snapshot"), ArtifactSnapshot.class))
                .rollbackPlan(codec.read(rs.getString("rollback_plan"), RollbackPlan.class))
                .runDetails(codec.read(rs.getString("run_details"), RunDetails.class))
                .error(rs.getString("error"))
                .payloadVersion(rs.getInt("payload_version"))
                .createdAt(SqlTimes.toInstant(rs.getTimestamp("created_at")))
                .startedAt(SqlTimes.toInstant(rs.getTimestamp("started_at")))
                .completedAt(SqlTimes.toInstant(rs.getTimestamp("completed_at")))
                .updatedAt(SqlTimes.toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
