package com.metricwatch.anomaly.engine.detectors;

import com.metricwatch.anomaly.engine.Detector;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.model.MetricSeries;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Univariate z-score detector.
 *
 * Each feature column is standardized on the window, |x - mean| / std (population std,
 * epsilon-guarded). A row's score is its largest absolute z across features.
 */
public class ZScoreDetector implements Detector {

    private final double k;
    private final int minSupport;

    public ZScoreDetector(DetectorConfig config) {
        this.k = config.getK();
        this.minSupport = config.getMinSupport();
    }

    @Override
    public DetectorType getType() {
        return DetectorType.ZSCORE;
    }

    @Override
    public DetectorResult detect(MetricSeries series) {
        Detector.validate(series, minSupport);
        int n = series.size();
        int width = series.width();

        double[] scores = new double[n];
        double[] means = new double[width];
        double[] stds = new double[width];
        for (int f = 0; f < width; f++) {
            double[] column = series.column(f);
            double mean = 0.0;
            for (double v : column) mean += v;
            mean /= n;
            double sumSq = 0.0;
            for (double v : column) sumSq += (v - mean) * (v - mean);
            double std = Math.sqrt(sumSq / n);
            means[f] = mean;
            stds[f] = std;

            double divisor = std < EPSILON ? EPSILON : std;
            for (int i = 0; i < n; i++) {
                // identical values carry no deviation, whatever the epsilon
                double z = std < EPSILON ? 0.0 : Math.abs(column[i] - mean) / divisor;
                scores[i] = Math.max(scores[i], z);
            }
        }
        List<Integer> anomalies = Detector.indicesAbove(scores, k);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("detectorType", getType().name());
        evidence.put("samples", n);
        evidence.put("k", k);
        evidence.put("means", means);
        evidence.put("stdDevs", stds);
        return new DetectorResult(scores, anomalies, evidence);
    }
}
