package com.di.modelops.monitoring;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns the raw metrics-source row into {@link CohortMetrics}: no-data cases become null rather than
 * zero or NaN, rates are rounded to 4 decimals, and freshness is whole days since the latest timestamp.
 */
@Component
@RequiredArgsConstructor
public class MetricsAggregator {

    private static final int SCALE = 4;

    private final MetricsSource metricsSource;
    private final Clock clock;

    public CohortMetrics compute(String cohort) {
        MetricsSourceRow row = metricsSource.fetch(cohort);
        Instant now = clock.instant();
        long evaluated = Math.max(0L, row.getEvaluatedPredictions());
        return CohortMetrics.builder()
                .cohort(cohort)
                .evaluatedPredictions(evaluated)
                .accuracy(evaluated == 0 ? null : round(row.getAccuracy()))
                .brierScore(evaluated == 0 ? null : round(row.getBrierScore()))
                .latestGameDate(row.getLatestGameDate())
                .latestPipelineSync(row.getLatestPipelineSync())
                .gameDataFreshnessDays(daysSince(row.getLatestGameDate(), now))
                .pipelineFreshnessDays(daysSince(row.getLatestPipelineSync(), now))
                .computedAt(now)
                .build();
    }

    static Double round(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Whole days elapsed, floored, never negative (a timestamp in the future counts as 0).
     */
    static Integer daysSince(Instant latest, Instant now) {
        if (latest == null) {
            return null;
        }
        long days = Duration.between(latest, now).toDays();
        return (int) Math.max(0L, days);
    }
}
