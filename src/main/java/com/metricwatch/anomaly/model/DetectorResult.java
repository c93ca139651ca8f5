package com.metricwatch.anomaly.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a detector: one score per input row, the rows classified anomalous (ascending),
 * and a free-form evidence payload for diagnostics.
 */
public final class DetectorResult {

    private final double[] scores;
    private final List<Integer> anomalyIndices;
    private final Map<String, Object> evidence;

    public DetectorResult(double[] scores, List<Integer> anomalyIndices, Map<String, Object> evidence) {
        this.scores = scores.clone();
        this.anomalyIndices = List.copyOf(anomalyIndices);
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public double[] getScores() {
        return scores.clone();
    }

    public double scoreAt(int index) {
        return scores[index];
    }

    public int size() {
        return scores.length;
    }

    public List<Integer> getAnomalyIndices() {
        return anomalyIndices;
    }

    public boolean isAnomalous(int index) {
        return Collections.binarySearch(anomalyIndices, index) >= 0;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return "DetectorResult{scores=" + Arrays.toString(scores)
                + ", anomalyIndices=" + anomalyIndices + ", evidence=" + evidence + '}';
    }
}
