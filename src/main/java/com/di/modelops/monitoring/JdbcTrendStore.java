package com.di.modelops.monitoring;

import com.di.modelops.sql.JsonColumnCodec;
import com.di.modelops.sql.SchemaGuard;
import com.di.modelops.sql.SqlQueriesProperties;
import com.di.modelops.sql.SqlTimes;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * JDBC implementation of {@link TrendStore} over {@code mlops_monitoring_snapshot}.
 * Active when {@code modelops.persistence-enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "true", matchIfMissing = true)
public class JdbcTrendStore implements TrendStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final SchemaGuard schemaGuard;
    private final JsonColumnCodec codec;

    public JdbcTrendStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, SchemaGuard schemaGuard, JsonColumnCodec codec) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.schemaGuard = schemaGuard;
        this.codec = codec;
    }


    @Override
    public MonitoringSnapshot append(MonitoringSnapshot snapshot) {
        String details = codec.write(snapshot.getDetails());
        Long id = schemaGuard.call("snapshot.append", () -> {
            KeyHolder keys = new GeneratedKeyHolder();
            jdbc.update(con -> {
                PreparedStatement ps = con.prepareStatement(sql.getSnapshot().getInsert(), new String[]{"id"});
                ps.setString(1, snapshot.getCohort());
                ps.setTimestamp(2, SqlTimes.toTimestamp(snapshot.getCapturedAt()));
                ps.setLong(3, snapshot.getEvaluatedPredictions());
                setDecimal(ps, 4, snapshot.getAccuracy());
                setDecimal(ps, 5, snapshot.getBrierScore());
                setInteger(ps, 6, snapshot.getGameDataFreshnessDays());
                setInteger(ps, 7, snapshot.getPipelineFreshnessDays());
                ps.setInt(8, snapshot.getAlertCount());
                ps.setString(9, details);
                ps.setTimestamp(10, SqlTimes.toTimestamp(snapshot.getCapturedAt()));
                return ps;
            }, keys);
            Number key = keys.getKey();
            return key != null ? key.longValue() : null;
        });
        return snapshot.toBuilder().id(id).build();
    }

    @Override
    public List<MonitoringSnapshot> findRecent(String cohort, int limit) {
        return schemaGuard.call("snapshot.findRecent",
                () -> jdbc.query(sql.getSnapshot().getFindRecent(), this::mapRow, cohort, Math.max(1, limit)));
    }

    @Override
    public List<MonitoringSnapshot> findSince(String cohort, Instant since, int limit) {
        return schemaGuard.call("snapshot.findSince",
                () -> jdbc.query(sql.getSnapshot().getFindWithinDays(), this::mapRow,
                        cohort, SqlTimes.toTimestamp(since), Math.max(1, limit)));
    }

    private static Double decimal(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value.doubleValue() : null;
    }

    private static void setDecimal(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DECIMAL);
        } else {
            ps.setBigDecimal(index, BigDecimal.valueOf(value));
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private MonitoringSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
        return MonitoringSnapshot.builder()
                .id(rs.getLong("id"))
                .cohort(rs.getString("cohort"))
                .capturedAt(SqlTimes.toInstant(rs.getTimestamp("snapshot_time")))
                .evaluatedPredictions(rs.getLong("evaluated_predictions"))
                .accuracy(decimal(rs, "accuracy"))
                .brierScore(decimal(rs, "brier_score"))
                .gameDataFreshnessDays(rs.getObject("game_data_freshness_days", Integer.class))
                .pipelineFreshnessDays(rs.getObject("pipeline_freshness_days", Integer.class))
                .alertCount(rs.getInt("alert_count"))
                .details(codec.read(rs.getString("details"), SnapshotDetails.class))
                .build();
    }
}
