package com.metricwatch.anomaly.engine;

/**
 * A series contains a non-finite value (NaN or infinity) or rows of inconsistent width.
 */
public class InvalidDataException extends DetectionException {

    public InvalidDataException(String message) {
        super(message);
    }

    @Override
    public String reason() {
        return "invalid_data";
    }
}
