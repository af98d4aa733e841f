package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PolicyThresholds {
    double accuracyMin;
    double brierMax;
    int newLabelsMin;

    public static PolicyThresholds from(ModelOpsProperties properties) {
        return PolicyThresholds.builder()
                .accuracyMin(properties.getMonitoring().getAccuracyMin())
                .brierMax(properties.getMonitoring().getBrierMax())
                .newLabelsMin(properties.getRetrain().getNewLabelsMin())
                .build();
    }
}
