package com.metricwatch.anomaly.engine.guardrail;

import com.metricwatch.anomaly.engine.DetectionException;
import com.metricwatch.anomaly.model.MetricKey;

/**
 * Guardrail state kept changing under a compare-and-swap for longer than the retry budget.
 * Nothing was written; the slice is evaluated again next cycle.
 */
public class GuardrailConflictException extends DetectionException {

    public GuardrailConflictException(MetricKey key, int attempts) {
        super("Guardrail state for " + key + " changed concurrently " + attempts + " times, giving up");
    }

    @Override
    public String reason() {
        return "guardrail_conflict";
    }
}
