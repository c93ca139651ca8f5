package com.metricwatch.anomaly.config;

import com.metricwatch.anomaly.engine.DetectorProvider;
import com.metricwatch.anomaly.engine.detectors.IqrDetector;
import com.metricwatch.anomaly.engine.detectors.IsolationForestDetector;
import com.metricwatch.anomaly.engine.detectors.ThresholdDetector;
import com.metricwatch.anomaly.engine.detectors.ZScoreDetector;
import com.metricwatch.anomaly.model.DetectorType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One provider per scoring strategy. The registry picks up every DetectorProvider bean, so a new
 * strategy only needs another bean here.
 */
@Configuration
public class DetectorProviderConfig {

    @Bean
    public DetectorProvider isolationForestDetectorProvider() {
        return DetectorProvider.of(DetectorType.ISOLATION_FOREST, IsolationForestDetector::new);
    }

    @Bean
    public DetectorProvider zScoreDetectorProvider() {
        return DetectorProvider.of(DetectorType.ZSCORE, ZScoreDetector::new);
    }

    @Bean
    public DetectorProvider thresholdDetectorProvider() {
        return DetectorProvider.of(DetectorType.THRESHOLD, ThresholdDetector::new);
    }

    @Bean
    public DetectorProvider iqrDetectorProvider() {
        return DetectorProvider.of(DetectorType.IQR, IqrDetector::new);
    }
}
