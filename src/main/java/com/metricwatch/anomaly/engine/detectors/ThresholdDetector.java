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
 * Static ceiling: a row's score is its largest value (floored at zero) and rows above k are
 * anomalous. Stateless; meant for metrics that already are a rate or a ratio.
 */
public class ThresholdDetector implements Detector {

    private final double k;
    private final int minSupport;

    public ThresholdDetector(DetectorConfig config) {
        this.k = config.getK();
        this.minSupport = config.getMinSupport();
    }

    @Override
    public DetectorType getType() {
        return DetectorType.THRESHOLD;
    }

    @Override
    public DetectorResult detect(MetricSeries series) {
        Detector.validate(series, minSupport);
        double[] scores = new double[series.size()];
        for (int i = 0; i < scores.length; i++) {
            double max = 0.0;
            for (double v : series.row(i)) {
                max = Math.max(max, v);
            }
            scores[i] = max;
        }
        List<Integer> anomalies = Detector.indicesAbove(scores, k);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("detectorType", getType().name());
        evidence.put("samples", scores.length);
        evidence.put("threshold", k);
        return new DetectorResult(scores, anomalies, evidence);
    }
}
