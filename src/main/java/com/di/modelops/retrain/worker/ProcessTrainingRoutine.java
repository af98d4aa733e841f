package com.di.modelops.retrain.worker;

import com.di.modelops.config.ModelOpsProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured training command ({@code modelops.training.command}, {@code {cohort}} substituted)
 * and reads the per-model metrics from the last JSON object line on its stdout. Stderr goes to this
 * process's stderr. There is no timeout; callers needing one impose it around the worker call. A trainer
 * still running when {@code train} exits (interrupt, I/O failure) is killed.
 */
@Slf4j
@Component
public class ProcessTrainingRoutine implements TrainingRoutine {

    static final String COHORT_PLACEHOLDER = "{cohort}";

    private static final TypeReference<Map<String, ModelTrainingMetrics>> OUTPUT_TYPE = new TypeReference<>() {};

    private final ModelOpsProperties properties;
    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ProcessTrainingRoutine(ModelOpsProperties properties) {
        this.properties = properties;
    }

    @Override
    public TrainingOutput train(String cohort) throws IOException, InterruptedException {
        List<String> command = command(properties.getTraining().getCommand(), cohort);
        Path stdout = Files.createTempFile("modelops-training-", ".out");
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(stdout.toFile())
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        String workingDir = properties.getTraining().getWorkingDir();
        if (workingDir != null && !workingDir.isBlank()) {
            builder.directory(new File(workingDir));
        }
        log.info("[WORKER] Starting training command for cohort {}: {}", cohort, command);
        Process process = null;
        try {
            process = builder.start();
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IllegalStateException("Training command exited with code " + exitCode);
            }
            return parse(lastJsonLine(stdout));
        } finally {
            if (process != null && process.isAlive()) {
                log.warn("[WORKER] Stopping training command for cohort {} (pid {})", cohort, process.pid());
                process.destroyForcibly();
            }
            Files.deleteIfExists(stdout);
        }
    }

    private static String lastJsonLine(Path stdout) throws IOException {
        String lastJson = null;
        try (BufferedReader reader = Files.newBufferedReader(stdout, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith("{")) {
                    lastJson = trimmed;
                }
            }
        }
        return lastJson;
    }

    TrainingOutput parse(String json) throws IOException {
        if (json == null) {
            throw new IllegalStateException("Training pipeline returned no output");
        }
        return TrainingOutput.of(mapper.readValue(json, OUTPUT_TYPE));
    }

    static List<String> command(List<String> configured, String cohort) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("Training command is not configured (modelops.training.command)");
        }
        List<String> argv = new ArrayList<>(configured.size());
        for (String token : configured) {
            argv.add(token.replace(COHORT_PLACEHOLDER, cohort));
        }
        return argv;
    }
}
