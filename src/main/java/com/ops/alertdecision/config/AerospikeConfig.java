package com.ops.alertdecision.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Getter
@Configuration
public class AerospikeConfig {

    public static final String SET_ALERT_HISTORY = "alert_history";
    public static final String SET_AUDIT_LOG = "alert_audit_log";

    // Secondary-indexed bins
    public static final String BIN_PATTERN_KEY = "patternKey";
    public static final String BIN_HOST = "host";
    public static final String BIN_ACTION = "action";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:alerts}")
    private String namespace;

    @Value("${aerospike.query-timeout-ms:3000}")
    private int queryTimeoutMs;

    @Value("${aerospike.write-timeout-ms:3000}")
    private int writeTimeoutMs;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;
        // tolerate an unreachable cluster at startup
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = queryTimeoutMs;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = writeTimeoutMs;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = writeTimeoutMs;
        policy.socketTimeout = 1000;
        // history and audit records are append-only
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        return policy;
    }

    @Bean
    public QueryPolicy defaultQueryPolicy() {
        QueryPolicy policy = new QueryPolicy();
        policy.totalTimeout = queryTimeoutMs;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
