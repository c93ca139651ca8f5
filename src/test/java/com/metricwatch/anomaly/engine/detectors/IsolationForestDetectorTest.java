package com.metricwatch.anomaly.engine.detectors;

import com.metricwatch.anomaly.engine.EmptySeriesException;
import com.metricwatch.anomaly.engine.InsufficientDataException;
import com.metricwatch.anomaly.engine.InvalidDataException;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.DetectorType;
import com.metricwatch.anomaly.model.MetricSeries;
import com.metricwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestDetectorTest {

    private final DetectorConfig config = TestDataFactory
            .createDetectorConfig("if-1", DetectorType.ISOLATION_FOREST, "tx_count")
            .toBuilder()
            .windowSize(200)
            .minSupport(20)
            .treeCount(100)
            .build();

    private final IsolationForestDetector detector = new IsolationForestDetector(config);

    @Test
    void detect_emptySeries_throwsEmptySeries() {
        assertThatThrownBy(() -> detector.detect(MetricSeries.empty()))
                .isInstanceOf(EmptySeriesException.class);
    }

    @Test
    void detect_nanValue_throwsInvalidData() {
        assertThatThrownBy(() -> detector.detect(MetricSeries.ofValues(1.0, Double.NaN, 2.0)))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("observation 1");
    }

    @Test
    void detect_infiniteValue_throwsInvalidDataBeforeSupportCheck() {
        assertThatThrownBy(() -> detector.detect(MetricSeries.ofValues(Double.POSITIVE_INFINITY)))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    void detect_inconsistentWidth_throwsInvalidData() {
        MetricSeries ragged = MetricSeries.ofRows(new double[][]{{1.0, 2.0}, {1.0}});

        assertThatThrownBy(() -> detector.detect(ragged))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("width");
    }

    @Test
    void detect_belowMinSupport_throwsInsufficientData() {
        MetricSeries series = MetricSeries.ofValues(TestDataFactory.steadyValues(19, 100, 1L));

        assertThatThrownBy(() -> detector.detect(series))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                    assertThat(e.getSampleCount()).isEqualTo(19);
                    assertThat(e.getMinSupport()).isEqualTo(20);
                    assertThat(e.reason()).isEqualTo("insufficient_data");
                });
    }

    @Test
    void detect_singleSpike_isFlaggedWithHighestScore() {
        MetricSeries series = TestDataFactory.seriesWithSpike(100, 100.0, 160.0);

        DetectorResult result = detector.detect(series);

        double[] scores = result.getScores();
        double max = Arrays.stream(scores).max().orElseThrow();
        assertThat(result.size()).isEqualTo(100);
        assertThat(result.scoreAt(99)).isEqualTo(max);
        assertThat(result.getAnomalyIndices()).contains(99);
        assertThat(result.isAnomalous(99)).isTrue();
    }

    @Test
    void detect_scoresAreNeverNegative() {
        Random random = new Random(11);
        for (int trial = 0; trial < 10; trial++) {
            double[][] rows = new double[40][];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = new double[]{random.nextGaussian() * 50, random.nextDouble() * 1e6};
            }

            DetectorResult result = detector.detect(MetricSeries.ofRows(rows));

            assertThat(Arrays.stream(result.getScores()).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void detect_constantSeries_scoresZeroAndFlagsNothing() {
        double[] values = new double[50];
        Arrays.fill(values, 7.0);

        DetectorResult result = detector.detect(MetricSeries.ofValues(values));

        assertThat(result.getScores()).containsOnly(0.0);
        assertThat(result.getAnomalyIndices()).isEmpty();
    }

    @Test
    void detect_sameSeedSameInput_isReproducible() {
        MetricSeries series = TestDataFactory.seriesWithSpike(80, 50.0, 90.0);

        DetectorResult first = detector.detect(series);
        DetectorResult second = new IsolationForestDetector(config).detect(series);

        assertThat(first.getScores()).containsExactly(second.getScores());
        assertThat(first.getAnomalyIndices()).isEqualTo(second.getAnomalyIndices());
    }

    @Test
    void detect_evidenceDescribesForestAndContamination() {
        MetricSeries series = TestDataFactory.seriesWithSpike(100, 100.0, 160.0);

        DetectorResult result = detector.detect(series);

        assertThat(result.getEvidence())
                .containsEntry("detectorType", "ISOLATION_FOREST")
                .containsEntry("samples", 100)
                .containsEntry("features", 1)
                .containsEntry("trees", 100)
                .containsEntry("contamination", 0.1)
                .containsKeys("rawScoreMean", "rawScoreStd", "contaminationCutoff", "latestRawScore");
        @SuppressWarnings("unchecked")
        List<Integer> outliers = (List<Integer>) result.getEvidence().get("contaminationOutliers");
        assertThat(outliers).contains(99).hasSizeLessThanOrEqualTo(10);
    }

    @Test
    void detect_multivariate_reportsFeatureContributions() {
        double[][] rows = new double[60][];
        Random random = new Random(5);
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[]{10 + random.nextGaussian(), 20 + random.nextGaussian()};
        }
        rows[59] = new double[]{10.0, 80.0};

        DetectorResult result = detector.detect(MetricSeries.ofRows(rows));

        double[] contributions = (double[]) result.getEvidence().get("latestFeatureContributions");
        assertThat(contributions).hasSize(2);
        assertThat(contributions[1]).isGreaterThan(contributions[0]);
        assertThat(result.scoreAt(59)).isEqualTo(Arrays.stream(result.getScores()).max().orElseThrow());
    }
}
