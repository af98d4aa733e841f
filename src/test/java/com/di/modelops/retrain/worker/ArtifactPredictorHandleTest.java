package com.di.modelops.retrain.worker;

import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.retrain.job.ArtifactFile;
import com.di.modelops.retrain.job.ArtifactInspector;
import com.di.modelops.retrain.job.ArtifactSnapshot;
import com.di.modelops.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArtifactPredictorHandle Tests")
class ArtifactPredictorHandleTest {

    @TempDir
    Path modelDir;

    private ArtifactPredictorHandle handle;

    @BeforeEach
    void setUp() {
        ModelOpsProperties properties = new ModelOpsProperties();
        properties.getArtifacts().setModelDir(modelDir.toString());
        handle = new ArtifactPredictorHandle(new ArtifactInspector(properties, MutableClock.at("2026-01-10T12:00:00Z")));
    }

    private static List<String> names(ArtifactSnapshot snapshot) {
        return snapshot.getArtifacts().stream().map(ArtifactFile::getName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Loads on first use and keeps that view until reloaded")
    void testCurrent_LoadsOnceThenCached() throws Exception {
        Files.writeString(modelDir.resolve("xgboost.pkl"), "v1");

        ArtifactSnapshot first = handle.current();
        Files.writeString(modelDir.resolve("ensemble.pkl"), "v2");

        assertTrue(first.isAvailable());
        assertEquals(List.of("xgboost.pkl"), names(first));
        assertSame(first, handle.current());
    }

    @Test
    @DisplayName("Reload swaps in the current directory listing")
    void testReload_SwapsSnapshot() throws Exception {
        Files.writeString(modelDir.resolve("xgboost.pkl"), "v1");
        ArtifactSnapshot before = handle.current();
        Files.writeString(modelDir.resolve("ensemble.pkl"), "v2");

        ArtifactSnapshot reloaded = handle.reload();

        assertNotSame(before, reloaded);
        assertSame(reloaded, handle.current());
        assertEquals(2, reloaded.getArtifacts().size());
        assertTrue(names(reloaded).contains("ensemble.pkl"));
    }

    @Test
    @DisplayName("A missing model directory yields an unavailable snapshot")
    void testCurrent_MissingDirectory() {
        ModelOpsProperties properties = new ModelOpsProperties();
        properties.getArtifacts().setModelDir(modelDir.resolve("absent").toString());
        ArtifactPredictorHandle missing = new ArtifactPredictorHandle(
                new ArtifactInspector(properties, MutableClock.at("2026-01-10T12:00:00Z")));

        ArtifactSnapshot snapshot = missing.current();

        assertFalse(snapshot.isAvailable());
        assertTrue(snapshot.getArtifacts().isEmpty());
    }
}
