package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.SchedulerStatus;
import com.metricwatch.anomaly.service.DetectionScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/scheduler")
@Tag(name = "Scheduler", description = "Start, stop and inspect periodic detection")
public class SchedulerController {

    private final DetectionScheduler scheduler;

    public SchedulerController(DetectionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Operation(summary = "Scheduler status",
            description = "STOPPED, RUNNING or DISABLED, with the detector ids that currently have a periodic job.")
    @GetMapping
    public ResponseEntity<SchedulerStatus> getStatus() {
        return ResponseEntity.ok(scheduler.status());
    }

    @Operation(summary = "Start periodic detection", description = "No-op if already running or disabled.")
    @PostMapping("/start")
    public ResponseEntity<SchedulerStatus> start() {
        scheduler.start();
        return ResponseEntity.ok(scheduler.status());
    }

    @Operation(summary = "Stop periodic detection",
            description = "Cancels every job and waits, bounded, for running cycles to finish.")
    @PostMapping("/stop")
    public ResponseEntity<SchedulerStatus> stop() {
        scheduler.stop();
        return ResponseEntity.ok(scheduler.status());
    }
}
