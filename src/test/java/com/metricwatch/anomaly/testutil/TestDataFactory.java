package com.metricwatch.anomaly.testutil;

import com.metricwatch.anomaly.model.*;

import java.time.Instant;
import java.util.Map;
import java.util.Random;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    /**
     * Z-score detector with permissive guardrails: raise at 4, clear at 3, persistence 1,
     * fixed 60 minute cooldown.
     */
    public static DetectorConfig createDetectorConfig(String id, DetectorType type, String metric) {
        return DetectorConfig.builder()
                .id(id)
                .detectorType(type)
                .metric(metric)
                .windowSize(50)
                .minSupport(10)
                .k(3.5)
                .persistenceRequired(1)
                .hysteresisRaiseK(4.0)
                .hysteresisClearK(3.0)
                .cooldownMinMinutes(60)
                .cooldownMaxMinutes(60)
                .scheduleIntervalMinutes(15)
                .build();
    }

    /**
     * {@code n} values around {@code mean} with small deterministic noise.
     */
    public static double[] steadyValues(int n, double mean, long seed) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + random.nextGaussian();
        }
        return values;
    }

    /**
     * Steady values with the last one replaced by {@code spike}.
     */
    public static MetricSeries seriesWithSpike(int n, double mean, double spike) {
        double[] values = steadyValues(n, mean, 7L);
        values[n - 1] = spike;
        return MetricSeries.ofValues(values);
    }

    public static AnomalyEvent createAnomalyEvent(String detectorId, Cohort cohort, String metric, double score) {
        return AnomalyEvent.builder()
                .detectorId(detectorId)
                .cohort(cohort)
                .metric(metric)
                .score(score)
                .persistenceCount(2)
                .evidence(Map.of("detectorType", "ZSCORE"))
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }

    public static JobRunSummary createJobRunSummary(String detectorId, int evaluated, int emitted) {
        return JobRunSummary.builder()
                .detectorId(detectorId)
                .cohortsEvaluated(evaluated)
                .cohortsFailed(0)
                .eventsEmitted(emitted)
                .startedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .finishedAt(Instant.parse("2024-03-01T10:00:01Z"))
                .build();
    }
}
