package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a detector type to the constructor of its implementation.
 * Adding a scoring strategy means declaring one more {@link DetectorProvider} bean.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectorType, DetectorProvider> providers = new EnumMap<>(DetectorType.class);

    public DetectorRegistry(List<DetectorProvider> providers) {
        for (DetectorProvider provider : providers) {
            DetectorProvider previous = this.providers.put(provider.getSupportedType(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two detector providers registered for "
                        + provider.getSupportedType() + ": " + previous + ", " + provider);
            }
            log.info("Registered detector provider: {}", provider.getSupportedType());
        }
    }

    /**
     * Build the detector for a configuration.
     *
     * @throws IllegalArgumentException if no provider handles the configured type
     */
    public Detector create(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        DetectorProvider provider = providers.get(config.getDetectorType());
        if (provider == null) {
            throw new IllegalArgumentException("No detector registered for type "
                    + config.getDetectorType() + " (detector " + config.getId()
                    + "). Supported types: " + providers.keySet());
        }
        return provider.create(config);
    }

    public boolean supports(DetectorType type) {
        return providers.containsKey(type);
    }

    public Set<DetectorType> supportedTypes() {
        return Collections.unmodifiableSet(providers.keySet());
    }
}
