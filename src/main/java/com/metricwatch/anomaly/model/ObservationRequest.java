package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "One observation appended to the in-process metric buffer")
public record ObservationRequest(
        @Schema(description = "Metric name", example = "tx_count") String metric,
        @Schema(description = "Cohort dimensions; empty or absent for the global cohort",
                example = "{\"merchant\": \"acme\"}") Map<String, String> cohort,
        @Schema(description = "Observation values; one for a scalar metric, several for a feature vector",
                example = "[42.0]") double[] values) {
}
