package com.metricwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Detection scheduler state and registered jobs")
public record SchedulerStatus(
        @Schema(description = "Scheduler state", example = "RUNNING") SchedulerState state,
        @Schema(description = "Detector ids with a registered periodic job") List<String> scheduledDetectors,
        @Schema(description = "Job bodies executing right now", example = "0") int inFlightJobs) {
}
