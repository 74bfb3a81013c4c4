package com.signals.common.kafka;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.common.KafkaException;

import lombok.extern.slf4j.Slf4j;

/**
 * Checks at startup that the broker answers a cluster description request.
 */
@Slf4j
public class BrokerConnectionVerifier {

    private final Map<String, Object> adminConfig;
    private final Duration timeout;

    public BrokerConnectionVerifier(Map<String, Object> adminConfig, Duration timeout) {
        this.adminConfig = adminConfig;
        this.timeout = timeout;
    }

    /**
     * @return the cluster id reported by the broker
     * @throws BrokerUnavailableException if the broker does not answer within the timeout
     */
    public String verify() {
        Object servers = adminConfig.get(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG);
        log.info("Verifying broker connection: bootstrapServers={}", servers);

        try (AdminClient admin = AdminClient.create(adminConfig)) {
            String clusterId = admin.describeCluster()
                    .clusterId()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Connected to broker cluster {}", clusterId);
            return clusterId;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while connecting to " + servers, e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new BrokerUnavailableException("Cannot connect to broker at " + servers, e);
        }
    }
}
