package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Actionable anomaly that passed persistence, hysteresis and cooldown guardrails")
public class AnomalyEvent {

    @Schema(description = "Cohort dimensions of the anomalous slice", example = "{\"merchant\": \"acme\", \"channel\": \"web\"}")
    Cohort cohort;

    @Schema(description = "Metric name", example = "tx_count")
    String metric;

    @Schema(description = "Normalized anomaly score of the latest observation", example = "5.2")
    double score;

    @Schema(description = "Detector that produced the score", example = "checkout-volume-if")
    String detectorId;

    @Schema(description = "Consecutive breaching cycles at emission", example = "3")
    int persistenceCount;

    @Schema(description = "Detector evidence plus guardrail diagnostics")
    Map<String, Object> evidence;

    @Schema(description = "Emission time")
    Instant timestamp;
}
