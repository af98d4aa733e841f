package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Raw per-cohort figures returned by the metrics source, before null handling and rounding.
 */
@Value
@Builder
public class MetricsSourceRow {
    long evaluatedPredictions;
    Double accuracy;
    Double brierScore;
    Instant latestGameDate;
    Instant latestPipelineSync;
}
