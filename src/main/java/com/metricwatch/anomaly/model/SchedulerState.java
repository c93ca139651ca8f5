package com.metricwatch.anomaly.model;

public enum SchedulerState {
    STOPPED,
    RUNNING,
    /** Scheduling substrate unavailable at startup; detection is a no-op. */
    DISABLED
}
