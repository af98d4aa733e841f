package com.di.modelops.retrain.job;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ArtifactFile {
    String name;
    long sizeBytes;
    Instant modifiedAt;
}
