package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RollbackPlan {
    String strategy;
    @Singular("criterion")
    List<String> criteria;

    /** Plan attached to every job the policy queues. */
    public static RollbackPlan standard() {
        return RollbackPlan.builder()
                .strategy("revert to previous artifact")
                .criterion("accuracy regression > 0.03")
                .criterion("brier regression > 0.02")
                .build();
    }
}
