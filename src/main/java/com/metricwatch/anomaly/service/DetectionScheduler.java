package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.JobRunSummary;
import com.metricwatch.anomaly.model.SchedulerStatus;

import java.util.List;
import java.util.Optional;

/**
 * Runs one periodic detection job per enabled detector.
 *
 * <pre>
 *   STOPPED --start--> RUNNING --stop--> STOPPED
 *   RUNNING --refreshJobs--> RUNNING
 * </pre>
 * Starting a running scheduler and stopping a stopped one are no-ops.
 */
public interface DetectionScheduler {

    void start();

    /**
     * Cancel every job and wait, bounded, for job bodies already executing.
     */
    void stop();

    /**
     * Replace the detector set atomically. Unchanged detectors keep their timers, changed ones
     * are rescheduled, removed or disabled ones are cancelled. While stopped, only records the set.
     */
    void refreshJobs(List<DetectorConfig> configs);

    /**
     * Run a known detector once on the calling thread, outside its schedule.
     *
     * @return empty when scheduling is unavailable
     * @throws IllegalArgumentException for an unknown detector id
     */
    Optional<JobRunSummary> runNow(String detectorId);

    SchedulerStatus status();
}
