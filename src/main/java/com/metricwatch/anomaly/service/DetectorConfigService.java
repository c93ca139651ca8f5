package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.engine.DetectorRegistry;
import com.metricwatch.anomaly.model.DetectorConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active detector set. Loaded from {@code detection.detectors} at startup; every change
 * is validated as a whole, swapped in atomically and pushed to the scheduler.
 */
@Service
public class DetectorConfigService {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfigService.class);

    private final DetectionProperties properties;
    private final DetectorRegistry detectorRegistry;
    private final DetectionScheduler scheduler;
    private final GuardrailService guardrailService;

    // Readers see either the old or the new set, never a mix
    private final AtomicReference<Map<String, DetectorConfig>> detectors =
            new AtomicReference<>(Collections.emptyMap());

    public DetectorConfigService(DetectionProperties properties,
                                 DetectorRegistry detectorRegistry,
                                 DetectionScheduler scheduler,
                                 GuardrailService guardrailService) {
        this.properties = properties;
        this.detectorRegistry = detectorRegistry;
        this.scheduler = scheduler;
        this.guardrailService = guardrailService;
    }

    @PostConstruct
    public void init() {
        List<DetectorConfig> configs = properties.getDetectors().stream()
                .map(DetectionProperties.DetectorSettings::toConfig)
                .toList();
        reload(configs);
        log.info("Loaded {} detector(s) from configuration", configs.size());
    }

    public List<DetectorConfig> findAll() {
        return List.copyOf(detectors.get().values());
    }

    public Optional<DetectorConfig> findById(String id) {
        return Optional.ofNullable(detectors.get().get(id));
    }

    /**
     * Replace the whole detector set.
     *
     * @throws IllegalStateException    if any config is invalid; the current set stays active
     * @throws IllegalArgumentException if a detector type has no registered provider
     */
    public synchronized void reload(List<DetectorConfig> configs) {
        DetectorConfig.validateAll(configs);
        for (DetectorConfig config : configs) {
            if (!detectorRegistry.supports(config.getDetectorType())) {
                throw new IllegalArgumentException("Detector " + config.getId() + ": unsupported type "
                        + config.getDetectorType() + ". Supported types: " + detectorRegistry.supportedTypes());
            }
        }

        Map<String, DetectorConfig> next = new LinkedHashMap<>();
        configs.forEach(config -> next.put(config.getId(), config));
        Map<String, DetectorConfig> previous = detectors.getAndSet(Collections.unmodifiableMap(next));

        previous.keySet().stream()
                .filter(id -> !next.containsKey(id))
                .forEach(guardrailService::forget);

        scheduler.refreshJobs(List.copyOf(next.values()));
    }

    public synchronized DetectorConfig upsert(DetectorConfig config) {
        Map<String, DetectorConfig> merged = new LinkedHashMap<>(detectors.get());
        boolean existed = merged.put(config.getId(), config) != null;
        reload(new ArrayList<>(merged.values()));
        log.info("Detector {} {}", config.getId(), existed ? "updated" : "created");
        return config;
    }

    public synchronized boolean remove(String id) {
        Map<String, DetectorConfig> remaining = new LinkedHashMap<>(detectors.get());
        if (remaining.remove(id) == null) {
            return false;
        }
        reload(new ArrayList<>(remaining.values()));
        log.info("Detector {} removed", id);
        return true;
    }
}
