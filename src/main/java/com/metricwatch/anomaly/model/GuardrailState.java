package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Guardrail state of one (cohort, metric) slice. Every update produces a new instance with
 * {@code version} bumped by one; stores use the version for compare-and-swap.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Guardrail state for one cohort + metric slice")
public class GuardrailState {

    private static final GuardrailState INITIAL = GuardrailState.builder().build();

    @Schema(description = "Consecutive cycles with a score above k", example = "2")
    int persistenceCount;

    @Schema(description = "Hysteresis flag: true between a raise and the next clear", example = "true")
    boolean alerting;

    @Schema(description = "When the last anomaly event was emitted for this slice; null if never")
    Instant lastAlertTime;

    @Schema(description = "Cooldown pinned when the last alert was raised, minutes", example = "45.3")
    double cooldownMinutes;

    @Schema(description = "Optimistic concurrency version", example = "7")
    long version;

    public static GuardrailState initial() {
        return INITIAL;
    }

    @JsonIgnore
    public boolean hasAlerted() {
        return lastAlertTime != null;
    }

    @JsonIgnore
    public Duration cooldown() {
        return Duration.ofMillis(Math.round(cooldownMinutes * 60_000d));
    }
}
