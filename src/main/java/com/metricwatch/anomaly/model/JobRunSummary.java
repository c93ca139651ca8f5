package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
@Schema(description = "Outcome of one detection job execution")
public class JobRunSummary {

    @Schema(description = "Detector identifier", example = "checkout-volume-if")
    String detectorId;

    @Schema(description = "Cohorts scored and passed through the guardrails", example = "12")
    int cohortsEvaluated;

    @Schema(description = "Cohorts skipped because of data or detection errors", example = "1")
    int cohortsFailed;

    @Schema(description = "Anomaly events emitted", example = "2")
    int eventsEmitted;

    Instant startedAt;

    Instant finishedAt;
}
