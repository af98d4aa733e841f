package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Listing of model artifact files at a point in time, newest first. Used as the rollback reference.
 */
@Value
@Builder
@Jacksonized
public class ArtifactSnapshot {
    boolean available;
    Instant capturedAt;
    @Singular
    List<ArtifactFile> artifacts;

    public static ArtifactSnapshot unavailable(Instant capturedAt) {
        return ArtifactSnapshot.builder().available(false).capturedAt(capturedAt).build();
    }
}
