package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.AnomalyEvent;
import com.metricwatch.anomaly.service.RecentAnomalyLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Recently emitted anomaly events")
public class AnomalyController {

    private final RecentAnomalyLog recentAnomalyLog;

    public AnomalyController(RecentAnomalyLog recentAnomalyLog) {
        this.recentAnomalyLog = recentAnomalyLog;
    }

    @Operation(summary = "Recent anomaly events", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<AnomalyEvent>> getRecent(
            @Parameter(description = "Max events to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(recentAnomalyLog.getRecent(limit));
    }
}
