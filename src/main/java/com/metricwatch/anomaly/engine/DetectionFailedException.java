package com.metricwatch.anomaly.engine;

/**
 * Internal model failure while fitting or scoring. Not fatal: the cohort is retried on the
 * next scheduled cycle.
 */
public class DetectionFailedException extends DetectionException {

    public DetectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "detection_failed";
    }
}
