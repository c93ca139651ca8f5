package com.metricwatch.anomaly.config;

import com.metricwatch.anomaly.engine.guardrail.KeyedLocks;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.model.MetricKey;
import com.metricwatch.anomaly.repository.InMemoryStateStore;
import com.metricwatch.anomaly.repository.KeyedStateStore;
import com.metricwatch.anomaly.repository.MetricSeriesBuffer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class DetectionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricSeriesBuffer metricSeriesBuffer(DetectionProperties properties) {
        return new MetricSeriesBuffer(properties.getBuffer().getCapacity(),
                properties.getBuffer().getMaxSlices());
    }

    @Bean
    public KeyedLocks guardrailLocks(DetectionProperties properties) {
        return new KeyedLocks(properties.getGuardrail().getLockStripes());
    }

    // Single-instance default; see AerospikeConfig for the shared store
    @Bean
    @ConditionalOnProperty(prefix = "detection.guardrail", name = "store", havingValue = "memory", matchIfMissing = true)
    public KeyedStateStore<MetricKey, GuardrailState> guardrailStateStore() {
        return new InMemoryStateStore<>();
    }
}
