package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.JobRunSummary;
import com.metricwatch.anomaly.model.SchedulerState;
import com.metricwatch.anomaly.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Stand-in wired when scheduling is unavailable. Every operation is a no-op.
 */
public class DisabledDetectionScheduler implements DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DisabledDetectionScheduler.class);

    private final String reason;

    public DisabledDetectionScheduler(String reason) {
        this.reason = reason;
        log.warn("Detection scheduling disabled: {}. Detectors will not run periodically.", reason);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public void start() {
        log.debug("Ignoring start(): scheduling disabled");
    }

    @Override
    public void stop() {
    }

    @Override
    public void refreshJobs(List<DetectorConfig> configs) {
    }

    @Override
    public Optional<JobRunSummary> runNow(String detectorId) {
        return Optional.empty();
    }

    @Override
    public SchedulerStatus status() {
        return new SchedulerStatus(SchedulerState.DISABLED, List.of(), 0);
    }
}
