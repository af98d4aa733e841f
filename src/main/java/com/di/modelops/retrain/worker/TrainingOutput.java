package com.di.modelops.retrain.worker;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-model metrics returned by one training run, keyed by model name
 * ({@code logistic_regression}, {@code xgboost}, {@code lightgbm}, {@code ensemble}).
 */
@Value
public class TrainingOutput {
    Map<String, ModelTrainingMetrics> models;

    public static TrainingOutput of(Map<String, ModelTrainingMetrics> models) {
        return new TrainingOutput(models != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(models))
                : Map.of());
    }

    public ModelTrainingMetrics model(String name) {
        return models.get(name);
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}
