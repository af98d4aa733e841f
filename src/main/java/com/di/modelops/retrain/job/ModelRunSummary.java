package com.di.modelops.retrain.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Training metrics reported for one model. Base models carry cross-validated values; the ensemble
 * carries train AUC instead.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelRunSummary {
    Double cvAccuracy;
    Double cvAuc;
    Double trainAccuracy;
    Double trainAuc;
    Double brierScore;
}
