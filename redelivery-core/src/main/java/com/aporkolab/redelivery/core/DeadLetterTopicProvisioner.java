package com.aporkolab.redelivery.core;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.redelivery.exception.ConfigurationException;

/**
 * Creates dead-letter topics ahead of time so the first dead-letter write does not stall.
 *
 * A topic that already exists is left untouched, whatever its partition count or retention.
 * Replication factor is the broker default.
 */
public class DeadLetterTopicProvisioner {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterTopicProvisioner.class);

    private final Admin admin;
    private final RedeliveryConfig config;
    private final Duration timeout;

    public DeadLetterTopicProvisioner(Admin admin, RedeliveryConfig config) {
        this.admin = Objects.requireNonNull(admin, "admin must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.timeout = config.publishTimeout();
    }

    /**
     * @return source topic to whether its dead-letter topic was created by this call
     */
    public Map<String, Boolean> provision(Collection<String> sourceTopics) {
        Map<String, Boolean> created = new LinkedHashMap<>();
        for (String sourceTopic : sourceTopics) {
            created.put(sourceTopic, provision(sourceTopic));
        }
        return created;
    }

    /**
     * @return true if the dead-letter topic was created, false if it already existed
     * @throws ConfigurationException if the topic cannot be described or created
     */
    public boolean provision(String sourceTopic) {
        String topic = sourceTopic + config.deadLetterSuffix();
        int partitions = partitionCount(sourceTopic);

        NewTopic newTopic = new NewTopic(topic, Optional.of(partitions), Optional.empty())
                .configs(Map.of(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(config.deadLetterRetention().toMillis())));

        try {
            admin.createTopics(List.of(newTopic)).all().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Created dead-letter topic {} with {} partition(s), retention {}",
                    topic, partitions, config.deadLetterRetention());
            return true;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.debug("Dead-letter topic {} already exists", topic);
                return false;
            }
            throw new ConfigurationException("deadletter.topic", "could not create " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new ConfigurationException("deadletter.topic", "timed out creating " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException("deadletter.topic", "interrupted while creating " + topic, e);
        }
    }

    int partitionCount(String sourceTopic) {
        if (config.partitionStrategy() == PartitionStrategy.FIXED) {
            return config.deadLetterPartition() + 1;
        }
        try {
            Map<String, TopicDescription> descriptions = admin.describeTopics(List.of(sourceTopic))
                    .allTopicNames()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return descriptions.get(sourceTopic).partitions().size();
        } catch (ExecutionException e) {
            throw new ConfigurationException(RedeliveryConfig.DEAD_LETTER_PARTITION_STRATEGY,
                    "MIRROR needs the partition count of " + sourceTopic, e.getCause());
        } catch (TimeoutException e) {
            throw new ConfigurationException(RedeliveryConfig.DEAD_LETTER_PARTITION_STRATEGY,
                    "timed out describing " + sourceTopic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException(RedeliveryConfig.DEAD_LETTER_PARTITION_STRATEGY,
                    "interrupted while describing " + sourceTopic, e);
        }
    }
}
