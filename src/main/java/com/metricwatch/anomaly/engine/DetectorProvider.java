package com.metricwatch.anomaly.engine;

import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorType;

import java.util.Objects;
import java.util.function.Function;

/**
 * Constructor entry of the detector registry. Every provider bean in the context is
 * registered automatically under its supported type.
 */
public interface DetectorProvider {

    DetectorType getSupportedType();

    Detector create(DetectorConfig config);

    static DetectorProvider of(DetectorType type, Function<DetectorConfig, Detector> constructor) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(constructor, "Detector constructor must not be null");
        return new DetectorProvider() {
            @Override
            public DetectorType getSupportedType() {
                return type;
            }

            @Override
            public Detector create(DetectorConfig config) {
                return constructor.apply(config);
            }

            @Override
            public String toString() {
                return "DetectorProvider[" + type + "]";
            }
        };
    }
}
