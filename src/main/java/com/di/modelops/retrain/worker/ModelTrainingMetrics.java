package com.di.modelops.retrain.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Metrics the trainer reports for one model. Fields the trainer does not report are null.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelTrainingMetrics {
    Double cvAccuracy;
    Double cvAuc;
    Double trainAccuracy;
    Double trainAuc;
    Double brierScore;
}
