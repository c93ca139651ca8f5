package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.service.GuardrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/guardrails")
@Tag(name = "Guardrails", description = "Inspect and reset persistence / hysteresis / cooldown state per cohort + metric")
public class GuardrailController {

    private final GuardrailService guardrailService;

    public GuardrailController(GuardrailService guardrailService) {
        this.guardrailService = guardrailService;
    }

    @Operation(summary = "Guardrail state for a slice")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = GuardrailState.class)))
    @ApiResponse(responseCode = "404", description = "No state recorded for the slice", content = @Content)
    @GetMapping
    public ResponseEntity<?> getState(
            @Parameter(description = "Metric name", example = "tx_count")
            @RequestParam String metric,
            @Parameter(description = "Cohort key, dimensions sorted by name; empty for the global cohort",
                    example = "channel=web,merchant=acme")
            @RequestParam(defaultValue = "") String cohort) {
        Cohort parsed;
        try {
            parsed = Cohort.parse(cohort);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        Optional<GuardrailState> state = guardrailService.snapshot(parsed, metric);
        if (state.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(state.get());
    }

    @Operation(summary = "Reset guardrail state for a slice",
            description = "Clears persistence, hysteresis and cooldown; the next breach starts from scratch.")
    @DeleteMapping
    public ResponseEntity<?> resetState(
            @RequestParam String metric,
            @RequestParam(defaultValue = "") String cohort) {
        Cohort parsed;
        try {
            parsed = Cohort.parse(cohort);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        guardrailService.reset(parsed, metric);
        return ResponseEntity.noContent().build();
    }
}
