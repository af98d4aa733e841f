package com.di.modelops.audit;

import com.di.modelops.error.ErrorCategory;
import com.di.modelops.sql.JsonColumnCodec;
import com.di.modelops.sql.SchemaGuard;
import com.di.modelops.sql.SqlQueriesProperties;
import com.di.modelops.sql.SqlTimes;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of {@link AuditSink} writing to {@code mlops_audit}.
 * Insert failures (other than a missing table, which is provisioned and retried once) are logged and dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class JdbcAuditSink implements AuditSink {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final SchemaGuard schemaGuard;
    private final JsonColumnCodec codec;
    private final Clock clock;

    public JdbcAuditSink(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, SchemaGuard schemaGuard,
                         JsonColumnCodec codec, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.schemaGuard = schemaGuard;
        this.codec = codec;
        this.clock = clock;
    }


    @Override
    public void record(AuditRecord record) {
        if (record == null || record.getModule() == null) return;
        Instant runTime = record.getRunTime() != null ? record.getRunTime() : clock.instant();
        try {
            String details = codec.write(record.getDetails());
            schemaGuard.run("audit.insert", () -> jdbc.update(
                    sql.getAudit().getInsert(),
                    SqlTimes.toTimestamp(runTime),
                    record.getModule(),
                    record.getStatus(),
                    record.getRecordsProcessed(),
                    record.getErrors(),
                    details));
        } catch (RuntimeException e) {
            // do not fail the audited operation if the audit insert fails
            log.warn("[AUDIT] Failed to record {} event ({}): {}",
                    record.getModule(), ErrorCategory.categorize(e), e.getMessage());
        }
    }

    @Override
    public List<AuditRecord> findRecent(String module, int limit) {
        if (module == null || module.isBlank()) return List.of();
        int safeLimit = Math.min(Math.max(1, limit), 500);
        return schemaGuard.call("audit.findRecent",
                () -> jdbc.query(sql.getAudit().getFindRecentByModule(), this::mapRow, module.trim(), safeLimit));
    }

    private Map<String, Object> readDetails(String json) {
        Map<String, Object> details = codec.read(json, DETAILS_TYPE);
        return details != null ? details : Map.of();
    }

    private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return AuditRecord.builder()
                .id(rs.getLong("id"))
                .runTime(SqlTimes.toInstant(rs.getTimestamp("run_time")))
                .module(rs.getString("module"))
                .status(rs.getString("status"))
                .recordsProcessed(rs.getInt("records_processed"))
                .errors(rs.getString("errors"))
                .details(readDetails(rs.getString("details")))
                .build();
    }
}
