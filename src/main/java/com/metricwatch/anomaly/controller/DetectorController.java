package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.JobRunSummary;
import com.metricwatch.anomaly.service.DetectionScheduler;
import com.metricwatch.anomaly.service.DetectorConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/detectors")
@Tag(name = "Detectors", description = "Manage scheduled detectors (list, upsert, delete, run now)")
public class DetectorController {

    private final DetectorConfigService configService;
    private final DetectionScheduler scheduler;

    public DetectorController(DetectorConfigService configService, DetectionScheduler scheduler) {
        this.configService = configService;
        this.scheduler = scheduler;
    }

    @Operation(summary = "List all detectors",
            description = "Returns every configured detector, enabled or not, with its guardrail thresholds and schedule.")
    @GetMapping
    public ResponseEntity<List<DetectorConfig>> listDetectors() {
        return ResponseEntity.ok(configService.findAll());
    }

    @Operation(summary = "Get a detector by ID")
    @GetMapping("/{id}")
    public ResponseEntity<DetectorConfig> getDetector(
            @Parameter(description = "Detector ID", example = "checkout-volume-if")
            @PathVariable String id) {
        return configService.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Create or replace a detector",
            description = "Validates the configuration, swaps it into the active set and reschedules its job. "
                    + "Unchanged detectors keep their timers.")
    @PutMapping("/{id}")
    public ResponseEntity<?> upsertDetector(
            @Parameter(description = "Detector ID", example = "checkout-volume-if")
            @PathVariable String id,
            @RequestBody DetectorConfig config) {
        if (config.getId() != null && !config.getId().equals(id)) {
            return badRequest("Body id '" + config.getId() + "' does not match path id '" + id + "'");
        }
        try {
            return ResponseEntity.ok(configService.upsert(config.toBuilder().id(id).build()));
        } catch (IllegalStateException | IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @Operation(summary = "Delete a detector", description = "Cancels its job and drops it from the active set.")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDetector(
            @Parameter(description = "Detector ID", example = "checkout-volume-if")
            @PathVariable String id) {
        if (!configService.remove(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Run a detector now",
            description = "Executes one detection cycle synchronously, outside the schedule, and returns its summary.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = JobRunSummary.class)))
    @ApiResponse(responseCode = "404", description = "Unknown detector", content = @Content)
    @ApiResponse(responseCode = "409", description = "Scheduling disabled", content = @Content)
    @PostMapping("/{id}/run")
    public ResponseEntity<?> runDetector(
            @Parameter(description = "Detector ID", example = "checkout-volume-if")
            @PathVariable String id) {
        if (configService.findById(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Optional<JobRunSummary> summary = scheduler.runNow(id);
        if (summary.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Detection scheduling is disabled"));
        }
        return ResponseEntity.ok(summary.get());
    }

    private ResponseEntity<Map<String, String>> badRequest(String error) {
        return ResponseEntity.badRequest().body(Map.of("error", error));
    }
}
