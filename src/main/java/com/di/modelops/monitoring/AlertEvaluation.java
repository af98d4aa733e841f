package com.di.modelops.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertEvaluation {
    List<Alert> alerts;
    EscalationState escalationState;

    public boolean hasAlerts() {
        return alerts != null && !alerts.isEmpty();
    }
}
