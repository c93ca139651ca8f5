package com.metricwatch.anomaly.model;

import java.util.Objects;

/**
 * Identifies one (cohort, metric) slice. Guardrail state and buffered series are keyed by it.
 */
public record MetricKey(Cohort cohort, String metric) {

    public MetricKey {
        Objects.requireNonNull(cohort, "Cohort must not be null");
        Objects.requireNonNull(metric, "Metric must not be null");
    }

    public static MetricKey of(Cohort cohort, String metric) {
        return new MetricKey(cohort, metric);
    }

    /**
     * Flat form used as a storage key: {@code metric|dim=value,dim=value}.
     */
    public String asString() {
        return metric + "|" + cohort.key();
    }

    @Override
    public String toString() {
        return asString();
    }
}
