package com.metricwatch.anomaly.service;

/**
 * The scheduling substrate could not be created. Detection then runs without periodic jobs.
 */
public class SchedulerUnavailableException extends RuntimeException {

    public SchedulerUnavailableException(String message) {
        super(message);
    }

    public SchedulerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
