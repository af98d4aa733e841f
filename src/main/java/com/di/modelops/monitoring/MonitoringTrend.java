package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MonitoringTrend {
    String cohort;
    int days;
    int limit;
    /** Most recent first. */
    List<MonitoringSnapshot> points;
}
