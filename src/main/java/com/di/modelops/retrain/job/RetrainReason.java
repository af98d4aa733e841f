package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

/**
 * One reason the policy found for retraining. {@code message} keeps the human-readable form,
 * e.g. {@code accuracy_breach: 0.500 < 0.550}.
 */
@Value
@Builder
@Jacksonized
public class RetrainReason {
    ReasonCode code;
    double observed;
    double threshold;
    String message;

    public static RetrainReason accuracyBreach(double accuracy, double min) {
        return RetrainReason.builder()
                .code(ReasonCode.ACCURACY_BREACH)
                .observed(accuracy)
                .threshold(min)
                .message(String.format(Locale.ROOT, "accuracy_breach: %.3f < %.3f", accuracy, min))
                .build();
    }

    public static RetrainReason brierBreach(double brier, double max) {
        return RetrainReason.builder()
                .code(ReasonCode.BRIER_BREACH)
                .observed(brier)
                .threshold(max)
                .message(String.format(Locale.ROOT, "brier_breach: %.3f > %.3f", brier, max))
                .build();
    }

    public static RetrainReason newLabels(long pending, int min) {
        return RetrainReason.builder()
                .code(ReasonCode.NEW_LABELS_THRESHOLD)
                .observed(pending)
                .threshold(min)
                .message("new_labels_threshold: " + pending + " >= " + min)
                .build();
    }
}
