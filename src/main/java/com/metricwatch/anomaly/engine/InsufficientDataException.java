package com.metricwatch.anomaly.engine;

public class InsufficientDataException extends DetectionException {

    private final int sampleCount;
    private final int minSupport;

    public InsufficientDataException(int sampleCount, int minSupport) {
        super("Insufficient data: " + sampleCount + " samples, at least " + minSupport + " required");
        this.sampleCount = sampleCount;
        this.minSupport = minSupport;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getMinSupport() {
        return minSupport;
    }

    @Override
    public String reason() {
        return "insufficient_data";
    }
}
