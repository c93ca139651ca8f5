package com.metricwatch.anomaly.engine.guardrail;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.model.MetricKey;
import com.metricwatch.anomaly.repository.KeyedStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Decides whether an anomaly score becomes an actionable alert for a (cohort, metric) slice.
 *
 * Three stages, each with state kept per slice:
 * <ol>
 *   <li>Persistence: the score must exceed k for {@code persistenceRequired} consecutive cycles.</li>
 *   <li>Hysteresis: alerting starts at score &gt;= raiseK and only ends at score &lt;= clearK.</li>
 *   <li>Cooldown: a randomized minimum gap between two alerts, drawn once per raised alert.</li>
 * </ol>
 *
 * Every update is computed from a snapshot and committed with a single compare-and-swap, under a
 * per-key lock. A slice's state is therefore never partially updated, and concurrent jobs on
 * the same slice apply their updates one after the other.
 */
public class GuardrailEngine {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEngine.class);

    private final GuardrailPolicy policy;
    private final KeyedStateStore<MetricKey, GuardrailState> store;
    private final KeyedLocks locks;
    private final Random random;
    private final int maxAttempts;

    public GuardrailEngine(GuardrailPolicy policy,
                           KeyedStateStore<MetricKey, GuardrailState> store,
                           KeyedLocks locks,
                           Random random,
                           int maxAttempts) {
        this.policy = Objects.requireNonNull(policy, "GuardrailPolicy must not be null");
        this.store = Objects.requireNonNull(store, "State store must not be null");
        this.locks = Objects.requireNonNull(locks, "KeyedLocks must not be null");
        this.random = Objects.requireNonNull(random, "Random must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public GuardrailPolicy getPolicy() {
        return policy;
    }

    /**
     * Count one more breaching cycle if {@code score > kThreshold}, otherwise reset to zero.
     *
     * @return the persistence count after the update
     */
    public int checkPersistence(MetricKey key, double score, double kThreshold) {
        return update(key, current -> {
            GuardrailState next = applyPersistence(current, score, kThreshold);
            return new Transition<>(next, next.getPersistenceCount());
        }).result();
    }

    /**
     * Move the hysteresis flag: a quiet slice starts alerting at {@code score >= raiseK}; an
     * alerting slice stops only at {@code score <= clearK}.
     *
     * @return whether the slice is alerting after the update
     */
    public boolean checkHysteresis(MetricKey key, double score) {
        return update(key, current -> {
            GuardrailState next = applyHysteresis(current, score);
            return new Transition<>(next, next.isAlerting());
        }).result();
    }

    /**
     * Read-only: true if the slice never alerted or its pinned cooldown has elapsed at {@code now}.
     */
    public boolean checkCooldown(MetricKey key, Instant now) {
        return cooldownElapsed(store.get(key).orElse(GuardrailState.initial()), now);
    }

    /**
     * Composite decision. Persistence and hysteresis are updated on every call; only when
     * persistence is met, hysteresis says alert and the cooldown has elapsed is the alert
     * recorded ({@code lastAlertTime = now}, fresh cooldown pinned) and true returned.
     */
    public boolean shouldRaiseAnomaly(Cohort cohort, String metric, double score,
                                      double kThreshold, int persistenceRequired, Instant now) {
        return evaluate(cohort, metric, score, kThreshold, persistenceRequired, now).raised();
    }

    /**
     * Same as {@link #shouldRaiseAnomaly} but reports every stage outcome.
     */
    public GuardrailDecision evaluate(Cohort cohort, String metric, double score,
                                      double kThreshold, int persistenceRequired, Instant now) {
        MetricKey key = MetricKey.of(cohort, metric);
        Transition<Stages> committed = update(key, current -> {
            GuardrailState next = applyHysteresis(applyPersistence(current, score, kThreshold), score);
            boolean persistenceMet = next.getPersistenceCount() >= persistenceRequired;
            boolean cooldownElapsed = cooldownElapsed(current, now);
            boolean raised = persistenceMet && next.isAlerting() && cooldownElapsed;
            if (raised) {
                next = next.toBuilder()
                        .lastAlertTime(now)
                        .cooldownMinutes(sampleCooldownMinutes())
                        .build();
            }
            return new Transition<>(next, new Stages(persistenceMet, next.isAlerting(), cooldownElapsed, raised));
        });

        Stages stages = committed.result();
        GuardrailDecision decision = new GuardrailDecision(stages.raised(), stages.persistenceMet(),
                stages.alerting(), stages.cooldownElapsed(), committed.state());
        log.debug("Guardrail {} score={} -> persistence={} alerting={} cooldownElapsed={} raised={}",
                key, score, committed.state().getPersistenceCount(), stages.alerting(),
                stages.cooldownElapsed(), stages.raised());
        return decision;
    }

    public Optional<GuardrailState> snapshot(MetricKey key) {
        return store.get(key);
    }

    public void reset(MetricKey key) {
        Lock lock = locks.lockFor(key);
        lock.lock();
        try {
            store.remove(key);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    static GuardrailState applyPersistence(GuardrailState state, double score, double kThreshold) {
        int count = score > kThreshold
                ? (state.getPersistenceCount() == Integer.MAX_VALUE ? Integer.MAX_VALUE : state.getPersistenceCount() + 1)
                : 0;
        return state.toBuilder().persistenceCount(count).build();
    }

    GuardrailState applyHysteresis(GuardrailState state, double score) {
        boolean alerting = state.isAlerting()
                ? !(score <= policy.clearK())
                : score >= policy.raiseK();
        return state.toBuilder().alerting(alerting).build();
    }

    static boolean cooldownElapsed(GuardrailState state, Instant now) {
        if (!state.hasAlerted()) {
            return true;
        }
        return !now.isBefore(state.getLastAlertTime().plus(state.cooldown()));
    }

    double sampleCooldownMinutes() {
        double min = policy.cooldownMinMinutes();
        double max = policy.cooldownMaxMinutes();
        if (max <= min) return min;
        return min + random.nextDouble() * (max - min);
    }

    private <T> Transition<T> update(MetricKey key, Function<GuardrailState, Transition<T>> transition) {
        Lock lock = locks.lockFor(key);
        lock.lock();
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                GuardrailState current = store.get(key).orElse(null);
                GuardrailState base = current != null ? current : GuardrailState.initial();
                Transition<T> proposed = transition.apply(base);
                GuardrailState next = proposed.state().toBuilder().version(base.getVersion() + 1).build();
                if (store.compareAndSwap(key, current, next)) {
                    return new Transition<>(next, proposed.result());
                }
                log.debug("Guardrail state for {} changed concurrently (attempt {}/{})", key, attempt, maxAttempts);
            }
            throw new GuardrailConflictException(key, maxAttempts);
        } finally {
            lock.unlock();
        }
    }

    private record Transition<T>(GuardrailState state, T result) {
    }

    private record Stages(boolean persistenceMet, boolean alerting, boolean cooldownElapsed, boolean raised) {
    }
}
