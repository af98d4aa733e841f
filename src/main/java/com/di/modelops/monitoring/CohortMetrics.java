package com.di.modelops.monitoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time model quality and data freshness for one cohort. Accuracy and Brier score are null
 * when no prediction has been evaluated; freshness is null when the source has no timestamp.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CohortMetrics {
    String cohort;
    long evaluatedPredictions;
    Double accuracy;
    Double brierScore;
    Instant latestGameDate;
    Instant latestPipelineSync;
    Integer gameDataFreshnessDays;
    Integer pipelineFreshnessDays;
    Instant computedAt;
}
