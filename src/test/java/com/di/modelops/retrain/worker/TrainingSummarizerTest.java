package com.di.modelops.retrain.worker;

import com.di.modelops.retrain.job.ModelRunSummary;
import com.di.modelops.retrain.job.RunDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrainingSummarizer Tests")
class TrainingSummarizerTest {

    private final TrainingSummarizer summarizer = new TrainingSummarizer();

    @Test
    @DisplayName("Base models keep CV metrics; the ensemble keeps train AUC")
    void testSummarize_Fields() {
        TrainingOutput output = TrainingOutput.of(Map.of(
                "logistic_regression", ModelTrainingMetrics.builder()
                        .cvAccuracy(0.61).cvAuc(0.65).trainAccuracy(0.63).trainAuc(0.99).brierScore(0.23).build(),
                "ensemble", ModelTrainingMetrics.builder()
                        .cvAccuracy(0.5).trainAccuracy(0.7).trainAuc(0.76).brierScore(0.21).build()));

        RunDetails details = summarizer.summarize(output);

        assertEquals(RunDetails.MODE_EXECUTE, details.getMode());
        ModelRunSummary lr = details.getTrainingSummary().get("logistic_regression");
        assertEquals(0.61, lr.getCvAccuracy());
        assertEquals(0.65, lr.getCvAuc());
        assertEquals(0.63, lr.getTrainAccuracy());
        assertEquals(0.23, lr.getBrierScore());
        assertNull(lr.getTrainAuc());
        ModelRunSummary ensemble = details.getTrainingSummary().get("ensemble");
        assertEquals(0.76, ensemble.getTrainAuc());
        assertNull(ensemble.getCvAccuracy());
    }

    @Test
    @DisplayName("Every known model has an entry, in a stable order, even when not reported")
    void testSummarize_AllModelsPresent() {
        RunDetails details = summarizer.summarize(TrainingOutput.of(Map.of(
                "random_forest", ModelTrainingMetrics.builder().cvAccuracy(0.6).build())));

        assertEquals(List.of("logistic_regression", "xgboost", "lightgbm", "ensemble"),
                List.copyOf(details.getTrainingSummary().keySet()));
        assertNull(details.getTrainingSummary().get("xgboost").getCvAccuracy());
    }
}
