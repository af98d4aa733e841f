package com.di.modelops.monitoring;

/**
 * Read-only view of scored predictions and pipeline activity, owned by the ingestion pipeline.
 * Query failures propagate to the caller unchanged.
 */
public interface MetricsSource {

    /**
     * Evaluated-prediction count, mean correctness, mean squared probability error and the latest
     * observed game date / pipeline sync for a cohort.
     */
    MetricsSourceRow fetch(String cohort);

    /**
     * Number of items in the cohort whose ground truth is known (completed games).
     */
    long countCompletedItems(String cohort);
}
