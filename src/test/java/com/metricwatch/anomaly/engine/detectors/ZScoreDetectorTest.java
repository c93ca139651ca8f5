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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ZScoreDetectorTest {

    private final DetectorConfig config = TestDataFactory
            .createDetectorConfig("z-1", DetectorType.ZSCORE, "latency")
            .toBuilder().minSupport(4).k(1.5).build();

    private final ZScoreDetector detector = new ZScoreDetector(config);

    @Test
    void detect_knownValues_scoresAbsoluteZ() {
        // mean 5, population std 2
        MetricSeries series = MetricSeries.ofValues(2, 4, 4, 4, 5, 5, 7, 9);

        DetectorResult result = detector.detect(series);

        assertThat(result.scoreAt(0)).isCloseTo(1.5, within(1e-9));
        assertThat(result.scoreAt(4)).isCloseTo(0.0, within(1e-9));
        assertThat(result.scoreAt(7)).isCloseTo(2.0, within(1e-9));
        assertThat(result.getAnomalyIndices()).containsExactly(7);
    }

    @Test
    void detect_multivariate_rowScoreIsWorstColumn() {
        MetricSeries series = MetricSeries.ofRows(new double[][]{
                {2, 10}, {4, 10}, {4, 10}, {4, 10}, {5, 10}, {5, 10}, {7, 10}, {9, 10}});

        DetectorResult result = detector.detect(series);

        // constant second column contributes nothing
        assertThat(result.scoreAt(7)).isCloseTo(2.0, within(1e-9));
        assertThat(result.getEvidence()).containsEntry("detectorType", "ZSCORE");
    }

    @Test
    void detect_constantSeries_flagsNothing() {
        DetectorResult result = detector.detect(MetricSeries.ofValues(3, 3, 3, 3, 3));

        assertThat(result.getScores()).containsOnly(0.0);
        assertThat(result.getAnomalyIndices()).isEmpty();
    }

    @Test
    void detect_invalidInput_followsValidationOrder() {
        assertThatThrownBy(() -> detector.detect(MetricSeries.empty()))
                .isInstanceOf(EmptySeriesException.class);
        assertThatThrownBy(() -> detector.detect(MetricSeries.ofValues(1.0, Double.NaN, 2.0)))
                .isInstanceOf(InvalidDataException.class);
        assertThatThrownBy(() -> detector.detect(MetricSeries.ofValues(1.0, 2.0, 3.0)))
                .isInstanceOf(InsufficientDataException.class);
    }
}
