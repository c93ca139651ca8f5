package com.metricwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum DetectorType {
    ISOLATION_FOREST,
    ZSCORE,
    THRESHOLD,
    IQR;

    /**
     * Parse a configured detector type. Case-insensitive; accepts a few common spellings.
     *
     * @throws IllegalArgumentException if the name matches no detector type
     */
    @JsonCreator
    public static DetectorType fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Detector type must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "isolation_forest", "isolationforest", "iforest" -> ISOLATION_FOREST;
            case "zscore", "z_score" -> ZSCORE;
            case "threshold" -> THRESHOLD;
            case "iqr" -> IQR;
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + name
                            + "'. Supported types: isolation_forest, zscore, threshold, iqr");
        };
    }
}
