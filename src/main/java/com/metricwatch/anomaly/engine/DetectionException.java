package com.metricwatch.anomaly.engine;

/**
 * Base of all detection failures. Caught per cohort by the job runner: a failing cohort is
 * logged and skipped, the rest of the batch continues.
 */
public abstract class DetectionException extends RuntimeException {

    protected DetectionException(String message) {
        super(message);
    }

    protected DetectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason, used as a metrics tag.
     */
    public abstract String reason();
}
