package com.di.modelops.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * Append-only time series of monitoring snapshots. Implementations are in-memory or JDBC
 * ({@code mlops_monitoring_snapshot}). Queries return most recent first.
 */
public interface TrendStore {

    /**
     * Persists a new snapshot and returns it with its assigned id.
     */
    MonitoringSnapshot append(MonitoringSnapshot snapshot);

    List<MonitoringSnapshot> findRecent(String cohort, int limit);

    /**
     * Snapshots captured at or after {@code since}.
     */
    List<MonitoringSnapshot> findSince(String cohort, Instant since, int limit);
}
