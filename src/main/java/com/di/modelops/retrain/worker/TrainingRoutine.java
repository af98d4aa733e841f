package com.di.modelops.retrain.worker;

/**
 * External training run for a cohort. Implementations raise on failure; the worker records the error
 * on the job.
 */
public interface TrainingRoutine {

    TrainingOutput train(String cohort) throws Exception;
}
