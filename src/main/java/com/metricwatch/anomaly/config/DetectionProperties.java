package com.metricwatch.anomaly.config;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    private Scheduler scheduler = new Scheduler();

    private Guardrail guardrail = new Guardrail();

    private Buffer buffer = new Buffer();

    private RecentEvents recentEvents = new RecentEvents();

    // Detectors loaded at startup; replaced at runtime through DetectorConfigService
    private List<DetectorSettings> detectors = new ArrayList<>();

    @Data
    public static class Scheduler {
        // false wires the no-op scheduler
        private boolean enabled = true;
        private int poolSize = 4;
        // Upper bound stop() waits for running job bodies
        private int awaitTerminationSeconds = 30;
        private boolean autoStart = true;
    }

    @Data
    public static class Guardrail {
        // memory | aerospike
        private String store = "memory";
        private int casMaxRetries = 5;
        private int lockStripes = 64;
    }

    @Data
    public static class Buffer {
        // Max observations kept per cohort + metric
        private int capacity = 2016;
        // Max cohort + metric slices held; least recently used is dropped beyond this
        private int maxSlices = 10_000;
    }

    @Data
    public static class RecentEvents {
        private int capacity = 200;
    }

    @Data
    public static class DetectorSettings {
        private String id;
        private String detectorType = "isolation_forest";
        private String metric;
        private int windowSize = 96;
        private List<Map<String, String>> cohorts = new ArrayList<>();
        private int treeCount = 100;
        private double contamination = 0.1;
        private double k = 3.5;
        private int persistenceRequired = 2;
        private int minSupport = 24;
        private boolean enabled = true;
        private int scheduleIntervalMinutes = 15;
        private double hysteresisRaiseK = 4.0;
        private double hysteresisClearK = 3.0;
        private double cooldownMinMinutes = 30;
        private double cooldownMaxMinutes = 60;
        private long seed = 42L;
        private int maxSamples = 256;

        /**
         * Convert to the immutable runtime form. Does not validate.
         *
         * @throws IllegalArgumentException for an unknown detector type
         */
        public DetectorConfig toConfig() {
            DetectorConfig.DetectorConfigBuilder builder = DetectorConfig.builder()
                    .id(id)
                    .detectorType(DetectorType.fromString(detectorType))
                    .metric(metric)
                    .windowSize(windowSize)
                    .treeCount(treeCount)
                    .contamination(contamination)
                    .k(k)
                    .persistenceRequired(persistenceRequired)
                    .minSupport(minSupport)
                    .enabled(enabled)
                    .scheduleIntervalMinutes(scheduleIntervalMinutes)
                    .hysteresisRaiseK(hysteresisRaiseK)
                    .hysteresisClearK(hysteresisClearK)
                    .cooldownMinMinutes(cooldownMinMinutes)
                    .cooldownMaxMinutes(cooldownMaxMinutes)
                    .seed(seed)
                    .maxSamples(maxSamples);
            if (cohorts != null) {
                cohorts.forEach(dimensions -> builder.cohort(Cohort.of(dimensions)));
            }
            return builder.build();
        }
    }
}
