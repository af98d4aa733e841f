package com.di.modelops.monitoring;

import com.di.modelops.sql.SqlQueriesProperties;
import com.di.modelops.sql.SqlTimes;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * {@link MetricsSource} over the {@code predictions}, {@code matches} and {@code pipeline_audit} tables.
 * These tables belong to the ingestion pipeline; this class never provisions or writes them.
 */
@Component
public class JdbcMetricsSource implements MetricsSource {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcMetricsSource(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public MetricsSourceRow fetch(String cohort) {
        var q = sql.getSource();
        MetricsSourceRow.MetricsSourceRowBuilder row = jdbc.queryForObject(q.getEvaluatedMetrics(),
                (rs, rowNum) -> MetricsSourceRow.builder()
                        .evaluatedPredictions(rs.getLong("evaluated_predictions"))
                        .accuracy(toDouble(rs, "accuracy"))
                        .brierScore(toDouble(rs, "brier_score")),
                cohort);
        Instant latestGameDate = firstInstant(jdbc.query(q.getLatestGameDate(),
                (rs, rowNum) -> SqlTimes.fromColumn(rs.getObject(1)), cohort));
        Instant latestSync = firstInstant(jdbc.query(q.getLatestPipelineSync(),
                (rs, rowNum) -> SqlTimes.fromColumn(rs.getObject(1))));
        return row
                .latestGameDate(latestGameDate)
                .latestPipelineSync(latestSync)
                .build();
    }

    @Override
    public long countCompletedItems(String cohort) {
        Long count = jdbc.queryForObject(sql.getSource().getCompletedItems(), Long.class, cohort);
        return count != null ? count : 0L;
    }

    private static Double toDouble(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value.doubleValue() : null;
    }

    private static Instant firstInstant(List<Instant> values) {
        return values.isEmpty() ? null : values.get(0);
    }
}
