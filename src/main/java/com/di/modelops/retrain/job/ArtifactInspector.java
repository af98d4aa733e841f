package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the model artifact directory: regular files only, newest first, capped at
 * {@code modelops.artifacts.max-listed}.
 */
@Slf4j
@Component
public class ArtifactInspector {

    private final ModelOpsProperties properties;
    private final Clock clock;

    public ArtifactInspector(ModelOpsProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ArtifactSnapshot snapshot() {
        Path dir = Paths.get(properties.getArtifacts().getModelDir());
        if (!Files.isDirectory(dir)) {
            return ArtifactSnapshot.unavailable(clock.instant());
        }
        List<ArtifactFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path path : entries.filter(Files::isRegularFile).collect(Collectors.toList())) {
                files.add(ArtifactFile.builder()
                        .name(path.getFileName().toString())
                        .sizeBytes(Files.size(path))
                        .modifiedAt(Files.getLastModifiedTime(path).toInstant())
                        .build());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list model directory " + dir, e);
        }
        files.sort(Comparator.comparing(ArtifactFile::getModifiedAt).reversed()
                .thenComparing(ArtifactFile::getName));
        int max = Math.max(1, properties.getArtifacts().getMaxListed());
        return ArtifactSnapshot.builder()
                .available(true)
                .capturedAt(clock.instant())
                .artifacts(files.size() > max ? files.subList(0, max) : files)
                .build();
    }
}
