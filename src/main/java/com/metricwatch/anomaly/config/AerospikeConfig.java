package com.metricwatch.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.model.GuardrailState;
import com.metricwatch.anomaly.model.MetricKey;
import com.metricwatch.anomaly.repository.AerospikeGuardrailStateStore;
import com.metricwatch.anomaly.repository.KeyedStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared guardrail state in Aerospike, for deployments running several engine instances.
 * Only active with {@code detection.guardrail.store=aerospike}.
 */
@Configuration
@ConditionalOnProperty(prefix = "detection.guardrail", name = "store", havingValue = "aerospike")
public class AerospikeConfig {

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    public static final String SET_GUARDRAIL_STATE = "guardrail_state";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:metricwatch}")
    private String namespace;

    // Per-call budget in ms; socket timeout is a third of it
    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        applyTimeouts(clientPolicy.readPolicyDefault);
        applyTimeouts(clientPolicy.writePolicyDefault);

        log.info("Connecting guardrail state store to Aerospike at {}:{} (namespace={})", host, port, namespace);
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    @Bean
    public KeyedStateStore<MetricKey, GuardrailState> guardrailStateStore(
            AerospikeClient client,
            @Qualifier("aerospikeNamespace") String namespace,
            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        return new AerospikeGuardrailStateStore(client, namespace, writePolicy, readPolicy);
    }

    private void applyTimeouts(Policy policy) {
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = Math.max(1, totalTimeoutMs / 3);
    }
}
