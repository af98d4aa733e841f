package com.di.modelops.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for monitoring thresholds, retrain policy limits, artifact listing and training command.
 *
 * <pre>
 * modelops:
 *   default-cohort: 2025-26
 *   monitoring:
 *     accuracy-min: 0.55
 *     brier-max: 0.25
 *     freshness-days-max: 3
 *   retrain:
 *     new-labels-min: 40
 *     duplicate-window-hours: 12
 *   artifacts:
 *     model-dir: models
 *   training:
 *     command: [python, -m, src.models.trainer, --season, "{cohort}", --json]
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "modelops")
public class ModelOpsProperties {

    /** true = JDBC stores and audit table; false = in-memory store, no-op audit. */
    private boolean persistenceEnabled = true;

    /** Cohort used when a caller passes none. */
    private String defaultCohort = "2025-26";

    private Monitoring monitoring = new Monitoring();
    private Retrain retrain = new Retrain();
    private Artifacts artifacts = new Artifacts();
    private Training training = new Training();
    private Schema schema = new Schema();

    /**
     * Returns the configured default cohort when {@code requested} is null or blank.
     */
    public String resolveCohort(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultCohort;
        }
        return requested.trim();
    }

    @Data
    public static class Monitoring {
        private double accuracyMin = 0.55;
        private double brierMax = 0.25;
        private int freshnessDaysMax = 3;
        /** Prior snapshots fed to the alert engine for breach streaks. */
        private int historyLimit = 12;
        private int trendDefaultDays = 14;
        private int trendMaxDays = 90;
        private int trendDefaultLimit = 30;
        private int trendMaxLimit = 180;
    }

    @Data
    public static class Retrain {
        private int newLabelsMin = 40;
        private int duplicateWindowHours = 12;
        private String triggerSource = "policy";
        /** Oldest queued candidates read per claim attempt. */
        private int claimScanLimit = 16;
        private int listDefaultLimit = 20;
        private int listMaxLimit = 100;
    }

    @Data
    public static class Artifacts {
        private String modelDir = "models";
        private int maxListed = 10;
    }

    @Data
    public static class Training {
        /** argv of the external trainer; "{cohort}" is substituted. Empty = not configured. */
        private List<String> command = new ArrayList<>();
        private String workingDir;
    }

    @Data
    public static class Schema {
        private boolean provisionOnStartup = true;
    }
}
