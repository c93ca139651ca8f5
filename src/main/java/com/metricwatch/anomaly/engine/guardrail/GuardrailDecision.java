package com.metricwatch.anomaly.engine.guardrail;

import com.metricwatch.anomaly.model.GuardrailState;

/**
 * Outcome of the composite guardrail check, with the stage results that produced it.
 *
 * @param raised          all three stages passed and the alert was recorded
 * @param state           state after this evaluation was committed
 */
public record GuardrailDecision(boolean raised,
                                boolean persistenceMet,
                                boolean alerting,
                                boolean cooldownElapsed,
                                GuardrailState state) {

    /**
     * First stage that blocked the alert: {@code persistence}, {@code hysteresis} or
     * {@code cooldown}; {@code null} when raised.
     */
    public String suppressedBy() {
        if (raised) return null;
        if (!persistenceMet) return "persistence";
        if (!alerting) return "hysteresis";
        return "cooldown";
    }
}
