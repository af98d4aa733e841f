package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Metrics captured on a policy evaluation and stored with the job it creates.
 */
@Value
@Builder
@Jacksonized
public class PolicyMetrics {
    long completedItems;
    long evaluatedPredictions;
    long newLabelsPending;
    Double accuracy;
    Double brierScore;
}
