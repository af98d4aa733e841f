package com.di.modelops.monitoring;

import com.di.modelops.support.SqlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcMetricsSource Tests")
class JdbcMetricsSourceTest {

    private JdbcTemplate jdbc;
    private JdbcMetricsSource source;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(SqlFixtures.newDatabase());
        SqlFixtures.createSourceTables(jdbc);
        source = new JdbcMetricsSource(jdbc, SqlFixtures.queries());
    }

    private void game(String id, String season, String date, boolean completed, Integer winner) {
        jdbc.update("INSERT INTO matches (game_id, season, game_date, home_team_id, winner_team_id, is_completed)"
                + " VALUES (?, ?, CAST(? AS DATE), 1, ?, ?)", id, season, date, winner, completed);
    }

    private void prediction(String gameId, double homeWinProb, Boolean correct) {
        jdbc.update("INSERT INTO predictions (game_id, home_win_prob, was_correct) VALUES (?, ?, ?)",
                gameId, homeWinProb, correct);
    }

    @Test
    @DisplayName("Should compute count, accuracy and Brier over evaluated predictions of the season")
    void testFetch_Aggregates() {
        game("g1", "2025-26", "2026-01-05", true, 1);
        game("g2", "2025-26", "2026-01-07", true, 2);
        game("g3", "2025-26", "2026-01-08", false, null);
        game("g4", "2024-25", "2025-04-01", true, 1);
        prediction("g1", 0.8, true);
        prediction("g2", 0.6, false);
        prediction("g3", 0.5, null);
        prediction("g4", 0.9, true);
        jdbc.update("INSERT INTO pipeline_audit (sync_time) VALUES (TIMESTAMP '2026-01-09 06:00:00')");

        MetricsSourceRow row = source.fetch("2025-26");

        assertEquals(2, row.getEvaluatedPredictions());
        assertEquals(0.5, row.getAccuracy(), 1e-9);
        // ((0.8 - 1)^2 + (0.6 - 0)^2) / 2
        assertEquals(0.2, row.getBrierScore(), 1e-9);
        assertEquals(Instant.parse("2026-01-08T00:00:00Z"), row.getLatestGameDate());
        assertNotNull(row.getLatestPipelineSync());
    }

    @Test
    @DisplayName("Should return zero count and null rates for a season without evaluated predictions")
    void testFetch_Empty() {
        MetricsSourceRow row = source.fetch("2030-31");

        assertEquals(0, row.getEvaluatedPredictions());
        assertNull(row.getAccuracy());
        assertNull(row.getBrierScore());
        assertNull(row.getLatestGameDate());
        assertNull(row.getLatestPipelineSync());
    }

    @Test
    @DisplayName("Should count completed games of the season only")
    void testCountCompletedItems() {
        game("g1", "2025-26", "2026-01-05", true, 1);
        game("g2", "2025-26", "2026-01-07", true, 2);
        game("g3", "2025-26", "2026-01-08", false, null);
        game("g4", "2024-25", "2025-04-01", true, 1);

        assertEquals(2L, source.countCompletedItems("2025-26"));
    }
}
