package com.metricwatch.anomaly.engine.detectors;

import com.metricwatch.anomaly.engine.DetectionFailedException;
import com.metricwatch.anomaly.engine.Detector;
import com.metricwatch.anomaly.engine.isolationforest.IsolationForest;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multivariate detector backed by an isolation forest fitted on the window it scores.
 *
 * Scoring:
 *   Raw forest scores (higher = more anomalous) are normalized to a z-scale across the
 *   window, (raw - mean) / std, and floored at zero, so output scores are never negative.
 *   Rows whose normalized score exceeds k are anomalous.
 *
 * The contamination rate does not influence the scores. It yields a second, rank-based view
 * reported in the evidence: the raw-score cut-off above which the expected outlier fraction
 * lies, and the rows above it.
 */
public class IsolationForestDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final String detectorId;
    private final int treeCount;
    private final int maxSamples;
    private final double contamination;
    private final double k;
    private final int minSupport;
    private final long seed;

    public IsolationForestDetector(DetectorConfig config) {
        this.detectorId = config.getId();
        this.treeCount = config.getTreeCount();
        this.maxSamples = config.getMaxSamples();
        this.contamination = config.getContamination();
        this.k = config.getK();
        this.minSupport = config.getMinSupport();
        this.seed = config.getSeed();
    }

    @Override
    public DetectorType getType() {
        return DetectorType.ISOLATION_FOREST;
    }

    @Override
    public DetectorResult detect(MetricSeries series) {
        Detector.validate(series, minSupport);
        double[][] data = series.toMatrix();

        IsolationForest forest;
        double[] raw;
        try {
            forest = IsolationForest.fit(data, treeCount, maxSamples, seed);
            raw = forest.scoreAll(data);
        } catch (RuntimeException e) {
            throw new DetectionFailedException("Isolation forest failed for detector "
                    + detectorId + ": " + e.getMessage(), e);
        }

        double mean = Arrays.stream(raw).average().orElse(0.0);
        double variance = 0.0;
        for (double r : raw) {
            variance += (r - mean) * (r - mean);
        }
        double std = Math.sqrt(variance / raw.length);
        // every row equally isolated: no deviation to report
        double[] scores = new double[raw.length];
        if (std >= EPSILON) {
            for (int i = 0; i < raw.length; i++) {
                scores[i] = Math.max(0.0, (raw[i] - mean) / std);
            }
        }
        List<Integer> anomalies = Detector.indicesAbove(scores, k);

        double cutoff = contaminationCutoff(raw);
        List<Integer> contaminationOutliers = new ArrayList<>();
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] > cutoff) contaminationOutliers.add(i);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("detectorType", getType().name());
        evidence.put("samples", data.length);
        evidence.put("features", forest.featureCount());
        evidence.put("trees", forest.treeCount());
        evidence.put("subsampleSize", forest.sampleSize());
        evidence.put("k", k);
        evidence.put("rawScoreMean", mean);
        evidence.put("rawScoreStd", std);
        evidence.put("latestRawScore", raw[raw.length - 1]);
        evidence.put("contamination", contamination);
        evidence.put("contaminationCutoff", cutoff);
        evidence.put("contaminationOutliers", contaminationOutliers);
        if (forest.featureCount() > 1) {
            evidence.put("latestFeatureContributions",
                    forest.featureContributions(data[data.length - 1], featureMeans(data)));
        }

        log.debug("Isolation forest [{}]: samples={}, features={}, anomalies={}",
                detectorId, data.length, forest.featureCount(), anomalies.size());
        return new DetectorResult(scores, anomalies, evidence);
    }

    /**
     * Raw score at the (1 - contamination) quantile, nearest-rank.
     */
    private double contaminationCutoff(double[] raw) {
        double[] sorted = raw.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil((1.0 - contamination) * sorted.length) - 1;
        rank = Math.max(0, Math.min(sorted.length - 1, rank));
        return sorted[rank];
    }

    private static double[] featureMeans(double[][] data) {
        double[] means = new double[data[0].length];
        for (double[] row : data) {
            for (int f = 0; f < row.length; f++) {
                means[f] += row[f];
            }
        }
        for (int f = 0; f < means.length; f++) {
            means[f] /= data.length;
        }
        return means;
    }
}
