package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.model.MetricSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Contract for all scoring strategies.
 *
 * Implementations are pure: {@link #detect(MetricSeries)} depends only on its input and the
 * detector's configuration and has no side effects. Validation must happen before any model
 * is fitted, in the order empty, invalid, insufficient.
 */
public interface Detector {

    /** Guard against division by a (near) zero standard deviation or spread. */
    double EPSILON = 1e-9;

    DetectorType getType();

    /**
     * Score every observation of the series.
     *
     * @return scores aligned to the input rows, plus the indices classified anomalous
     * @throws EmptySeriesException       if the series has no observations
     * @throws InvalidDataException       if any value is non-finite or rows differ in width
     * @throws InsufficientDataException  if the series has fewer than {@code minSupport} rows
     * @throws DetectionFailedException   if the underlying model fails
     */
    DetectorResult detect(MetricSeries series);

    /**
     * Shared input validation.
     */
    static void validate(MetricSeries series, int minSupport) {
        Objects.requireNonNull(series, "MetricSeries must not be null");
        if (series.isEmpty()) {
            throw new EmptySeriesException();
        }
        int width = series.width();
        if (width == 0) {
            throw new InvalidDataException("Observation 0 has no values");
        }
        for (int i = 0; i < series.size(); i++) {
            double[] row = series.row(i);
            if (row.length != width) {
                throw new InvalidDataException("Observation " + i + " has width " + row.length
                        + ", expected " + width);
            }
            for (int f = 0; f < row.length; f++) {
                if (!Double.isFinite(row[f])) {
                    throw new InvalidDataException("Non-finite value " + row[f]
                            + " at observation " + i + ", feature " + f);
                }
            }
        }
        if (series.size() < minSupport) {
            throw new InsufficientDataException(series.size(), minSupport);
        }
    }

    /**
     * Shared threshold filter: indices whose score strictly exceeds {@code k}, ascending.
     */
    static List<Integer> indicesAbove(double[] scores, double k) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > k) {
                indices.add(i);
            }
        }
        return indices;
    }
}
