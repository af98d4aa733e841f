package com.di.modelops.retrain.worker;

import com.di.modelops.retrain.job.ModelRunSummary;
import com.di.modelops.retrain.job.RunDetails;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces trainer output to the run details stored on the job. Base models keep cross-validated accuracy
 * and AUC, train accuracy and Brier; the ensemble keeps train accuracy, train AUC and Brier. Every model
 * has an entry, empty when the trainer did not report it.
 */
@Component
public class TrainingSummarizer {

    static final List<String> BASE_MODELS = List.of("logistic_regression", "xgboost", "lightgbm");
    static final String ENSEMBLE = "ensemble";

    public RunDetails summarize(TrainingOutput output) {
        Map<String, ModelRunSummary> summary = new LinkedHashMap<>();
        for (String name : BASE_MODELS) {
            ModelTrainingMetrics m = output.model(name);
            summary.put(name, m == null ? ModelRunSummary.builder().build() : ModelRunSummary.builder()
                    .cvAccuracy(m.getCvAccuracy())
                    .cvAuc(m.getCvAuc())
                    .trainAccuracy(m.getTrainAccuracy())
                    .brierScore(m.getBrierScore())
                    .build());
        }
        ModelTrainingMetrics ensemble = output.model(ENSEMBLE);
        summary.put(ENSEMBLE, ensemble == null ? ModelRunSummary.builder().build() : ModelRunSummary.builder()
                .trainAccuracy(ensemble.getTrainAccuracy())
                .trainAuc(ensemble.getTrainAuc())
                .brierScore(ensemble.getBrierScore())
                .build());
        return RunDetails.builder()
                .mode(RunDetails.MODE_EXECUTE)
                .trainingSummary(summary)
                .build();
    }
}
