package com.metricwatch.anomaly.model;

import java.util.Arrays;
import java.util.List;

/**
 * Chronologically ordered observations for one (cohort, metric) slice.
 *
 * Every observation is a row: a scalar series is a single-column matrix. Rows are copied on the
 * way in and out, so a series never changes after construction. Width consistency and
 * finiteness are not enforced here; detectors validate before scoring.
 */
public final class MetricSeries {

    private static final MetricSeries EMPTY = new MetricSeries(new double[0][]);

    private final double[][] rows;

    private MetricSeries(double[][] rows) {
        this.rows = rows;
    }

    public static MetricSeries empty() {
        return EMPTY;
    }

    /**
     * A scalar series; each value becomes a one-element row.
     */
    public static MetricSeries ofValues(double... values) {
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[]{values[i]};
        }
        return new MetricSeries(rows);
    }

    public static MetricSeries ofRows(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i] == null ? new double[0] : rows[i].clone();
        }
        return new MetricSeries(copy);
    }

    public static MetricSeries ofRows(List<double[]> rows) {
        return ofRows(rows.toArray(new double[0][]));
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    /**
     * Width of the first row, or 0 for an empty series.
     */
    public int width() {
        return rows.length == 0 ? 0 : rows[0].length;
    }

    public double[] row(int index) {
        return rows[index].clone();
    }

    public int latestIndex() {
        return rows.length - 1;
    }

    public double[][] toMatrix() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    /**
     * Values of one feature column.
     */
    public double[] column(int feature) {
        double[] col = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            col[i] = rows[i][feature];
        }
        return col;
    }

    @Override
    public String toString() {
        return "MetricSeries{size=" + rows.length + ", width=" + width()
                + (rows.length > 0 ? ", latest=" + Arrays.toString(rows[rows.length - 1]) : "") + '}';
    }
}
