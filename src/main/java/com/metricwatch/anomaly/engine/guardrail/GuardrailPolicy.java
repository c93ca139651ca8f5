package com.metricwatch.anomaly.engine.guardrail;

import com.metricwatch.anomaly.model.DetectorConfig;

/**
 * Hysteresis band and cooldown range applied by a {@link GuardrailEngine}.
 */
public record GuardrailPolicy(double raiseK, double clearK,
                              double cooldownMinMinutes, double cooldownMaxMinutes) {

    public GuardrailPolicy {
        if (!(raiseK > clearK)) {
            throw new IllegalArgumentException("Hysteresis raise threshold (" + raiseK
                    + ") must be greater than clear threshold (" + clearK + ")");
        }
        if (!(cooldownMinMinutes >= 0) || !(cooldownMaxMinutes >= cooldownMinMinutes)) {
            throw new IllegalArgumentException("Cooldown range must satisfy 0 <= min <= max, got ["
                    + cooldownMinMinutes + ", " + cooldownMaxMinutes + "]");
        }
    }

    public static GuardrailPolicy from(DetectorConfig config) {
        return new GuardrailPolicy(config.getHysteresisRaiseK(), config.getHysteresisClearK(),
                config.getCooldownMinMinutes(), config.getCooldownMaxMinutes());
    }
}
