package com.di.modelops.retrain.worker;

import com.di.modelops.retrain.job.ArtifactInspector;
import com.di.modelops.retrain.job.ArtifactSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link PredictorHandle} backed by the model directory listing.
 */
@Slf4j
@Component
public class ArtifactPredictorHandle implements PredictorHandle {

    private final ArtifactInspector inspector;
    private final AtomicReference<ArtifactSnapshot> loaded = new AtomicReference<>();

    public ArtifactPredictorHandle(ArtifactInspector inspector) {
        this.inspector = inspector;
    }

    @Override
    public ArtifactSnapshot current() {
        ArtifactSnapshot snapshot = loaded.get();
        if (snapshot != null) {
            return snapshot;
        }
        loaded.compareAndSet(null, inspector.snapshot());
        return loaded.get();
    }

    @Override
    public ArtifactSnapshot reload() {
        ArtifactSnapshot snapshot = inspector.snapshot();
        loaded.set(snapshot);
        log.info("[WORKER] Predictor handle reloaded: {} artifact(s)", snapshot.getArtifacts().size());
        return snapshot;
    }
}
