package com.metricwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger scheduledJobCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.scheduledJobCount = registry.gauge("detection.scheduled.jobs", new AtomicInteger(0));
    }

    public void recordCycle(String detectorId, int cohortsEvaluated) {
        Counter.builder("detection.cycle.count")
                .tag("detector", detectorId)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.cycle.cohorts")
                .tag("detector", detectorId)
                .register(registry)
                .record(cohortsEvaluated);
    }

    public void recordCohortFailure(String reason) {
        Counter.builder("detection.cohort.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAnomalyEmitted(String detectorId) {
        Counter.builder("anomaly.emitted.count")
                .tag("detector", detectorId)
                .register(registry)
                .increment();
    }

    public void recordGuardrailSuppressed(String stage) {
        Counter.builder("guardrail.suppressed.count")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordSinkFailure(String sink) {
        Counter.builder("anomaly.sink.failure.count")
                .tag("sink", sink)
                .register(registry)
                .increment();
    }

    public void updateScheduledJobCount(int count) {
        scheduledJobCount.set(count);
    }
}
