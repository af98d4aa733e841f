package com.di.modelops.monitoring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link TrendStore}. Suitable for single-node and testing.
 * When modelops.persistence-enabled=true, {@link JdbcTrendStore} is used instead.
 */
@Component
@ConditionalOnProperty(name = "modelops.persistence-enabled", havingValue = "false")
public class InMemoryTrendStore implements TrendStore {

    private final List<MonitoringSnapshot> insertionOrder = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public MonitoringSnapshot append(MonitoringSnapshot snapshot) {
        MonitoringSnapshot saved = snapshot.toBuilder().id(ids.incrementAndGet()).build();
        synchronized (insertionOrder) {
            insertionOrder.add(saved);
        }
        return saved;
    }

    @Override
    public List<MonitoringSnapshot> findRecent(String cohort, int limit) {
        return findSince(cohort, null, limit);
    }

    @Override
    public List<MonitoringSnapshot> findSince(String cohort, Instant since, int limit) {
        int max = Math.max(1, limit);
        List<MonitoringSnapshot> out = new ArrayList<>();
        synchronized (insertionOrder) {
            for (int i = insertionOrder.size() - 1; i >= 0 && out.size() < max; i--) {
                MonitoringSnapshot s = insertionOrder.get(i);
                if (cohort.equals(s.getCohort()) && (since == null || !s.getCapturedAt().isBefore(since))) {
                    out.add(s);
                }
            }
        }
        return out;
    }
}
