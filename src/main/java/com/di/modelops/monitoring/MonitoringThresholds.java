package com.di.modelops.monitoring;

import com.di.modelops.config.ModelOpsProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Limits a monitoring evaluation is checked against.
 */
@Value
@Builder
@Jacksonized
public class MonitoringThresholds {
    double accuracyMin;
    double brierMax;
    int freshnessDaysMax;

    public static MonitoringThresholds from(ModelOpsProperties.Monitoring monitoring) {
        return MonitoringThresholds.builder()
                .accuracyMin(monitoring.getAccuracyMin())
                .brierMax(monitoring.getBrierMax())
                .freshnessDaysMax(monitoring.getFreshnessDaysMax())
                .build();
    }
}
