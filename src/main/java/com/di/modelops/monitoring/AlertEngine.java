package com.di.modelops.monitoring;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Checks current metrics against thresholds and the trailing snapshot history.
 * <p>Severity per metric:
 * <ul>
 *   <li>accuracy below min: high (message marks a deep breach below min - 0.07)</li>
 *   <li>brier above max: medium, high above max + 0.08</li>
 *   <li>game data / pipeline older than max days: medium, high above max + 2 days</li>
 * </ul>
 * The breach streak counts the current point plus the consecutive prior snapshots (most recent first)
 * breaching the same threshold; a non-breaching or missing value ends the streak.
 */
@Component
public class AlertEngine {

    static final BigDecimal ACCURACY_DEEP_MARGIN = new BigDecimal("0.07");
    static final BigDecimal BRIER_HIGH_MARGIN = new BigDecimal("0.08");
    static final int FRESHNESS_HIGH_MARGIN_DAYS = 2;

    /**
     * @param history prior snapshots for the cohort, most recent first; the current point is not in it
     */
    public AlertEvaluation evaluate(CohortMetrics metrics, MonitoringThresholds thresholds, List<MonitoringSnapshot> history) {
        List<MonitoringSnapshot> prior = history != null ? history : List.of();
        List<Alert> alerts = new ArrayList<>();

        Double accuracy = metrics.getAccuracy();
        double accuracyMin = thresholds.getAccuracyMin();
        if (accuracy != null && accuracy < accuracyMin) {
            boolean deep = accuracy < minus(accuracyMin, ACCURACY_DEEP_MARGIN);
            String message = String.format(Locale.ROOT, "Accuracy %.3f below threshold %.3f", accuracy, accuracyMin);
            if (deep) {
                message += String.format(Locale.ROOT, " by more than %s", ACCURACY_DEEP_MARGIN.toPlainString());
            }
            int streak = streak(prior, s -> s.getAccuracy() != null && s.getAccuracy() < accuracyMin);
            alerts.add(alert(Alert.ACCURACY_BREACH, AlertSeverity.HIGH, message, streak));
        }

        Double brier = metrics.getBrierScore();
        double brierMax = thresholds.getBrierMax();
        if (brier != null && brier > brierMax) {
            AlertSeverity severity = brier > plus(brierMax, BRIER_HIGH_MARGIN) ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            String message = String.format(Locale.ROOT, "Brier score %.3f above threshold %.3f", brier, brierMax);
            int streak = streak(prior, s -> s.getBrierScore() != null && s.getBrierScore() > brierMax);
            alerts.add(alert(Alert.BRIER_BREACH, severity, message, streak));
        }

        int freshnessMax = thresholds.getFreshnessDaysMax();
        Integer gameDays = metrics.getGameDataFreshnessDays();
        if (gameDays != null && gameDays > freshnessMax) {
            int streak = streak(prior, s -> s.getGameDataFreshnessDays() != null && s.getGameDataFreshnessDays() > freshnessMax);
            alerts.add(alert(Alert.GAME_DATA_STALE, freshnessSeverity(gameDays, freshnessMax),
                    "Latest game data is " + gameDays + " days old.", streak));
        }
        Integer pipelineDays = metrics.getPipelineFreshnessDays();
        if (pipelineDays != null && pipelineDays > freshnessMax) {
            int streak = streak(prior, s -> s.getPipelineFreshnessDays() != null && s.getPipelineFreshnessDays() > freshnessMax);
            alerts.add(alert(Alert.PIPELINE_STALE, freshnessSeverity(pipelineDays, freshnessMax),
                    "Latest pipeline sync is " + pipelineDays + " days old.", streak));
        }

        return AlertEvaluation.builder()
                .alerts(List.copyOf(alerts))
                .escalationState(EscalationState.aggregate(alerts))
                .build();
    }

    /**
     * 1 for the current breach plus each consecutive breaching prior point.
     */
    static int streak(List<MonitoringSnapshot> history, Predicate<MonitoringSnapshot> breaches) {
        int count = 1;
        for (MonitoringSnapshot snapshot : history) {
            if (snapshot == null || !breaches.test(snapshot)) {
                break;
            }
            count++;
        }
        return count;
    }

    private static AlertSeverity freshnessSeverity(int days, int max) {
        return days > max + FRESHNESS_HIGH_MARGIN_DAYS ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
    }

    private static Alert alert(String id, AlertSeverity severity, String message, int streak) {
        EscalationLevel level = EscalationLevel.of(severity, streak);
        return Alert.builder()
                .id(id)
                .severity(severity)
                .message(message)
                .breachStreak(streak)
                .escalationLevel(level)
                .recommendedAction(level.recommendedAction())
                .build();
    }

    // margins are applied in decimal so 0.55 - 0.07 is exactly 0.48
    private static double minus(double value, BigDecimal margin) {
        return BigDecimal.valueOf(value).subtract(margin).doubleValue();
    }

    private static double plus(double value, BigDecimal margin) {
        return BigDecimal.valueOf(value).add(margin).doubleValue();
    }
}
