package com.di.modelops.retrain.worker;

import com.di.modelops.retrain.job.ArtifactSnapshot;

/**
 * Handle to the artifacts the serving path predicts with. Loaded on first use and replaced only by an
 * explicit {@link #reload()}.
 */
public interface PredictorHandle {

    /** Artifacts currently in use, loading them on first call. */
    ArtifactSnapshot current();

    /** Re-reads the artifact directory and swaps the handle's view. */
    ArtifactSnapshot reload();
}
