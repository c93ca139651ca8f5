package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.ObservationRequest;
import com.metricwatch.anomaly.repository.MetricSeriesBuffer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/observations")
@Tag(name = "Observations", description = "Feed the in-process metric buffer")
public class ObservationController {

    private final MetricSeriesBuffer buffer;

    public ObservationController(MetricSeriesBuffer buffer) {
        this.buffer = buffer;
    }

    @Operation(summary = "Append an observation",
            description = "Appends one row to the cohort + metric series. Rows of a series must keep the same width.")
    @PostMapping
    public ResponseEntity<?> append(@RequestBody ObservationRequest request) {
        if (request.metric() == null || request.metric().isBlank()) {
            return badRequest("metric must not be blank", "metric");
        }
        if (request.values() == null || request.values().length == 0) {
            return badRequest("values must not be empty", "values");
        }
        Cohort cohort;
        try {
            cohort = request.cohort() == null ? Cohort.global() : Cohort.of(request.cohort());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), "cohort");
        }
        try {
            buffer.append(cohort, request.metric(), request.values());
            return ResponseEntity.accepted().build();
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), "values");
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
