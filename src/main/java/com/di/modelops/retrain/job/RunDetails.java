package com.di.modelops.retrain.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * What a worker run did: simulated or executed, plus the training summary for executed runs.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunDetails {

    public static final String MODE_SIMULATE = "simulate";
    public static final String MODE_EXECUTE = "execute";

    String mode;
    String note;
    /** Model name to metrics, insertion ordered. */
    Map<String, ModelRunSummary> trainingSummary;

    public static RunDetails simulated() {
        return RunDetails.builder()
                .mode(MODE_SIMULATE)
                .note("Training execution skipped; this run validates lifecycle behavior.")
                .build();
    }

    public static RunDetails forMode(boolean execute) {
        return RunDetails.builder().mode(execute ? MODE_EXECUTE : MODE_SIMULATE).build();
    }
}
