package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.engine.guardrail.GuardrailEngine;
import com.metricwatch.anomaly.engine.guardrail.GuardrailPolicy;
import com.metricwatch.anomaly.engine.guardrail.KeyedLocks;
import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.model.MetricKey;
import com.metricwatch.anomaly.repository.KeyedStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Hands out one {@link GuardrailEngine} per detector. All engines share the same state store and
 * lock stripes, so state is keyed by cohort + metric only; {@link DetectorConfig#validateAll}
 * keeps a metric to a single enabled detector.
 */
@Service
public class GuardrailService {

    private static final Logger log = LoggerFactory.getLogger(GuardrailService.class);

    private final KeyedStateStore<MetricKey, GuardrailState> stateStore;
    private final KeyedLocks locks;
    private final Random random;
    private final int casMaxRetries;
    private final Map<String, GuardrailEngine> engines = new ConcurrentHashMap<>();

    @Autowired
    public GuardrailService(KeyedStateStore<MetricKey, GuardrailState> stateStore,
                            KeyedLocks locks,
                            DetectionProperties properties) {
        this(stateStore, locks, new Random(), properties.getGuardrail().getCasMaxRetries());
    }

    GuardrailService(KeyedStateStore<MetricKey, GuardrailState> stateStore,
                     KeyedLocks locks, Random random, int casMaxRetries) {
        this.stateStore = stateStore;
        this.locks = locks;
        this.random = random;
        this.casMaxRetries = casMaxRetries;
    }

    /**
     * The engine for this detector; rebuilt when the detector's thresholds changed.
     */
    public GuardrailEngine engineFor(DetectorConfig config) {
        GuardrailPolicy policy = GuardrailPolicy.from(config);
        return engines.compute(config.getId(), (id, existing) -> {
            if (existing != null && existing.getPolicy().equals(policy)) {
                return existing;
            }
            log.debug("Guardrail policy for detector {}: {}", id, policy);
            return new GuardrailEngine(policy, stateStore, locks, random, casMaxRetries);
        });
    }

    public void forget(String detectorId) {
        engines.remove(detectorId);
    }

    public Optional<GuardrailState> snapshot(Cohort cohort, String metric) {
        return stateStore.get(MetricKey.of(cohort, metric));
    }

    public void reset(Cohort cohort, String metric) {
        MetricKey key = MetricKey.of(cohort, metric);
        Lock lock = locks.lockFor(key);
        lock.lock();
        try {
            stateStore.remove(key);
        } finally {
            lock.unlock();
        }
        log.info("Guardrail state reset for {}", key);
    }
}
