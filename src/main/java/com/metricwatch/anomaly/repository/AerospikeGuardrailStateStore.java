package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.model.MetricKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Guardrail state shared through Aerospike so several engine instances see the same slices.
 *
 * One record per slice in set {@code guardrail_state}. The record generation doubles as the
 * state version: compare-and-swap writes with {@link GenerationPolicy#EXPECT_GEN_EQUAL} against
 * the version that was read, or {@link RecordExistsAction#CREATE_ONLY} when no state existed.
 */
public class AerospikeGuardrailStateStore implements KeyedStateStore<MetricKey, GuardrailState> {

    private static final Logger log = LoggerFactory.getLogger(AerospikeGuardrailStateStore.class);

    static final String BIN_METRIC = "metric";
    static final String BIN_COHORT = "cohort";
    static final String BIN_PERSISTENCE = "persistCount";
    static final String BIN_ALERTING = "alerting";
    static final String BIN_LAST_ALERT = "lastAlertMs";
    static final String BIN_COOLDOWN = "cooldownMin";

    private static final long NO_ALERT = -1L;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeGuardrailStateStore(AerospikeClient client,
                                        String namespace,
                                        WritePolicy writePolicy,
                                        Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public Optional<GuardrailState> get(MetricKey key) {
        Record record = client.get(readPolicy, toKey(key));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecordToState(record));
    }

    @Override
    public void put(MetricKey key, GuardrailState value) {
        client.put(writePolicy, toKey(key), toBins(key, value));
    }

    @Override
    public boolean compareAndSwap(MetricKey key, GuardrailState expected, GuardrailState replacement) {
        WritePolicy policy = new WritePolicy(writePolicy);
        if (expected == null) {
            policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        } else {
            policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
            policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            policy.generation = (int) expected.getVersion();
        }

        try {
            client.put(policy, toKey(key), toBins(key, replacement));
            return true;
        } catch (AerospikeException e) {
            int code = e.getResultCode();
            if (code == ResultCode.GENERATION_ERROR
                    || code == ResultCode.KEY_EXISTS_ERROR
                    || code == ResultCode.KEY_NOT_FOUND_ERROR) {
                log.debug("Guardrail CAS lost for {} (resultCode={})", key, code);
                return false;
            }
            throw e;
        }
    }

    @Override
    public void remove(MetricKey key) {
        client.delete(writePolicy, toKey(key));
    }

    private Key toKey(MetricKey key) {
        return new Key(namespace, AerospikeConfig.SET_GUARDRAIL_STATE, key.asString());
    }

    private static Bin[] toBins(MetricKey key, GuardrailState state) {
        long lastAlert = state.getLastAlertTime() != null
                ? state.getLastAlertTime().toEpochMilli()
                : NO_ALERT;
        return new Bin[]{
                new Bin(BIN_METRIC, key.metric()),
                new Bin(BIN_COHORT, key.cohort().key()),
                new Bin(BIN_PERSISTENCE, state.getPersistenceCount()),
                new Bin(BIN_ALERTING, state.isAlerting() ? 1 : 0),
                new Bin(BIN_LAST_ALERT, lastAlert),
                new Bin(BIN_COOLDOWN, state.getCooldownMinutes())
        };
    }

    // The stored generation is authoritative for the version, whatever the writer proposed.
    static GuardrailState mapRecordToState(Record record) {
        long lastAlert = record.getLong(BIN_LAST_ALERT);
        return GuardrailState.builder()
                .persistenceCount(record.getInt(BIN_PERSISTENCE))
                .alerting(record.getLong(BIN_ALERTING) != 0)
                .lastAlertTime(lastAlert == NO_ALERT ? null : Instant.ofEpochMilli(lastAlert))
                .cooldownMinutes(record.getDouble(BIN_COOLDOWN))
                .version(record.generation)
                .build();
    }
}
