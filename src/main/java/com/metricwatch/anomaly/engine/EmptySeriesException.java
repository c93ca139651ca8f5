package com.metricwatch.anomaly.engine;

public class EmptySeriesException extends DetectionException {

    public EmptySeriesException() {
        super("Metric series is empty");
    }

    @Override
    public String reason() {
        return "empty_series";
    }
}
