package com.metricwatch.anomaly.engine.guardrail;

import com.google.common.util.concurrent.Striped;

import java.util.concurrent.locks.Lock;

/**
 * Lock stripes for guardrail keys. Equal keys always map to the same lock.
 */
public final class KeyedLocks {

    private final Striped<Lock> stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be >= 1, got " + stripeCount);
        }
        this.stripes = Striped.lock(stripeCount);
    }

    public Lock lockFor(Object key) {
        return stripes.get(key);
    }
}
