package com.metricwatch.anomaly.engine.detectors;

import com.metricwatch.anomaly.engine.Detector;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.model.MetricSeries;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interquartile-range fence detector, robust to the outliers it is looking for.
 *
 * Per feature, values inside [Q1 - 1.5 IQR, Q3 + 1.5 IQR] score zero; outside, the score is
 * the distance to the nearest fence in units of IQR. A row scores its worst feature.
 */
public class IqrDetector implements Detector {

    static final double FENCE_MULTIPLIER = 1.5;

    private final double k;
    private final int minSupport;

    public IqrDetector(DetectorConfig config) {
        this.k = config.getK();
        this.minSupport = config.getMinSupport();
    }

    @Override
    public DetectorType getType() {
        return DetectorType.IQR;
    }

    @Override
    public DetectorResult detect(MetricSeries series) {
        Detector.validate(series, minSupport);
        int n = series.size();
        int width = series.width();

        double[] scores = new double[n];
        double[] lowerFences = new double[width];
        double[] upperFences = new double[width];
        for (int f = 0; f < width; f++) {
            double[] column = series.column(f);
            double[] sorted = column.clone();
            Arrays.sort(sorted);
            double q1 = sorted[n / 4];
            double q3 = sorted[Math.min(n - 1, 3 * n / 4)];
            double iqr = q3 - q1;
            double lower = q1 - FENCE_MULTIPLIER * iqr;
            double upper = q3 + FENCE_MULTIPLIER * iqr;
            lowerFences[f] = lower;
            upperFences[f] = upper;

            double scale = Math.max(iqr, EPSILON);
            for (int i = 0; i < n; i++) {
                double distance = Math.max(0.0, Math.max(lower - column[i], column[i] - upper));
                scores[i] = Math.max(scores[i], distance / scale);
            }
        }
        List<Integer> anomalies = Detector.indicesAbove(scores, k);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("detectorType", getType().name());
        evidence.put("samples", n);
        evidence.put("k", k);
        evidence.put("lowerFences", lowerFences);
        evidence.put("upperFences", upperFences);
        return new DetectorResult(scores, anomalies, evidence);
    }
}
