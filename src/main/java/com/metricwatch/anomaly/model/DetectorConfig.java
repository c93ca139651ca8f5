package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of one scheduled detector. Immutable; replaced wholesale on reload.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Detector configuration: scoring strategy, guardrail thresholds and schedule")
public class DetectorConfig {

    @Schema(description = "Unique detector identifier", example = "checkout-volume-if")
    String id;

    @Schema(description = "Scoring strategy", example = "ISOLATION_FOREST")
    @Builder.Default
    DetectorType detectorType = DetectorType.ISOLATION_FOREST;

    @Schema(description = "Metric name fetched from the analytics data source", example = "tx_count")
    String metric;

    @Schema(description = "Number of most recent observations fetched per cohort", example = "96")
    @Builder.Default
    int windowSize = 96;

    @Schema(description = "Explicit cohorts to evaluate. Empty means every cohort the data source knows for the metric")
    @Singular
    List<Cohort> cohorts;

    @Schema(description = "Number of isolation trees", example = "100")
    @Builder.Default
    int treeCount = 100;

    @Schema(description = "Expected outlier fraction, reported as the contamination cut-off", example = "0.1")
    @Builder.Default
    double contamination = 0.1;

    @Schema(description = "Anomaly multiplier: scores above k are anomalous", example = "3.5")
    @Builder.Default
    double k = 3.5;

    @Schema(description = "Consecutive breaching cycles required before alerting", example = "2")
    @Builder.Default
    int persistenceRequired = 2;

    @Schema(description = "Minimum number of samples required to score a series", example = "24")
    @Builder.Default
    int minSupport = 24;

    @Schema(description = "Whether the detector is scheduled", example = "true")
    @Builder.Default
    boolean enabled = true;

    @Schema(description = "Minutes between scheduled evaluations", example = "15")
    @Builder.Default
    int scheduleIntervalMinutes = 15;

    @Schema(description = "Score at or above which a non-alerting slice starts alerting", example = "4.0")
    @Builder.Default
    double hysteresisRaiseK = 4.0;

    @Schema(description = "Score at or below which an alerting slice stops alerting", example = "3.0")
    @Builder.Default
    double hysteresisClearK = 3.0;

    @Schema(description = "Lower bound of the randomized cooldown between alerts, minutes", example = "30")
    @Builder.Default
    double cooldownMinMinutes = 30;

    @Schema(description = "Upper bound of the randomized cooldown between alerts, minutes", example = "60")
    @Builder.Default
    double cooldownMaxMinutes = 60;

    @Schema(description = "Seed for the isolation forest", example = "42")
    @Builder.Default
    long seed = 42L;

    @Schema(description = "Isolation forest sub-sample size per tree", example = "256")
    @Builder.Default
    int maxSamples = 256;

    /**
     * Collect every constraint violation of this configuration.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        String name = id == null || id.isBlank() ? "<unnamed>" : id;

        if (id == null || id.isBlank()) errors.add("Detector id must not be blank");
        if (detectorType == null) errors.add(name + ": detectorType must be set");
        if (metric == null || metric.isBlank()) errors.add(name + ": metric must not be blank");
        if (!(k >= 0)) errors.add(name + ": k must be >= 0, got " + k);
        if (persistenceRequired < 1) {
            errors.add(name + ": persistenceRequired must be >= 1, got " + persistenceRequired);
        }
        if (minSupport < 1) errors.add(name + ": minSupport must be >= 1, got " + minSupport);
        if (windowSize < minSupport) {
            errors.add(name + ": windowSize (" + windowSize + ") must be >= minSupport (" + minSupport + ")");
        }
        if (treeCount < 1) errors.add(name + ": treeCount must be >= 1, got " + treeCount);
        if (maxSamples < 2) errors.add(name + ": maxSamples must be >= 2, got " + maxSamples);
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add(name + ": contamination must be in (0, 0.5], got " + contamination);
        }
        if (scheduleIntervalMinutes < 1) {
            errors.add(name + ": scheduleIntervalMinutes must be >= 1, got " + scheduleIntervalMinutes);
        }
        if (!(hysteresisRaiseK > hysteresisClearK)) {
            errors.add(name + ": hysteresisRaiseK (" + hysteresisRaiseK
                    + ") must be greater than hysteresisClearK (" + hysteresisClearK + ")");
        }
        if (!(cooldownMinMinutes >= 0)) {
            errors.add(name + ": cooldownMinMinutes must be >= 0, got " + cooldownMinMinutes);
        }
        if (!(cooldownMaxMinutes >= cooldownMinMinutes)) {
            errors.add(name + ": cooldownMaxMinutes (" + cooldownMaxMinutes
                    + ") must be >= cooldownMinMinutes (" + cooldownMinMinutes + ")");
        }
        if (cohorts != null && new HashSet<>(cohorts).size() != cohorts.size()) {
            errors.add(name + ": cohorts must not contain duplicates");
        }
        return errors;
    }

    /**
     * @throws IllegalStateException listing every violation, if any
     */
    public void validate() {
        List<String> errors = validationErrors();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid detector configuration:\n  - " + String.join("\n  - ", errors));
        }
    }

    /**
     * Validate a whole configuration set: every config, id uniqueness, and at most one enabled
     * detector per metric. Guardrail state is keyed by cohort + metric, so two enabled detectors
     * on one metric would each advance the same persistence count every cycle.
     *
     * @throws IllegalStateException listing every violation across all configs
     */
    public static void validateAll(List<DetectorConfig> configs) {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<String, String> enabledByMetric = new HashMap<>();
        for (DetectorConfig config : configs) {
            errors.addAll(config.validationErrors());
            if (config.getId() != null && !seen.add(config.getId())) {
                errors.add("Duplicate detector id: " + config.getId());
            }
            if (config.isEnabled() && config.getMetric() != null) {
                String other = enabledByMetric.putIfAbsent(config.getMetric(), config.getId());
                if (other != null) {
                    errors.add("Detectors " + other + " and " + config.getId() + " are both enabled on metric "
                            + config.getMetric() + "; at most one enabled detector per metric is allowed");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detector configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }
}
