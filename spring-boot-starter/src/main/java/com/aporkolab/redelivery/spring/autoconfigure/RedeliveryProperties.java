package com.aporkolab.redelivery.spring.autoconfigure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.redelivery.core.BackoffSchedule;
import com.aporkolab.redelivery.core.PartitionStrategy;
import com.aporkolab.redelivery.core.RedeliveryConfig;

/**
 * Configuration properties for Kafka redelivery.
 *
 * Example application.yml:
 * <pre>
 * redelivery:
 *   enabled: true
 *   dead-letter:
 *     suffix: .dlt
 *     retention: 28d
 *     partition-strategy: FIXED
 *     partition: 0
 *     publish-timeout: 30s
 *     provision-topics: true
 *   backoff:
 *     initial-interval: 1s
 *     multiplier: 2.0
 *     max-interval: 10s
 *     max-retries: 3
 *   delivery:
 *     initial-interval: 1s
 *     max-interval: 30s
 *   non-retryable-error-kinds:
 *     - com.fasterxml.jackson.core.JsonProcessingException
 *   consumer:
 *     topics: orders
 *     group-id: order-consumer
 *     concurrency: 4
 *   metrics:
 *     enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "redelivery")
public class RedeliveryProperties {

    private boolean enabled = true;
    private DeadLetterProperties deadLetter = new DeadLetterProperties();
    private BackoffProperties backoff = new BackoffProperties();
    private BackoffProperties delivery = BackoffProperties.delivery();
    private List<String> nonRetryableErrorKinds = new ArrayList<>();
    private ConsumerProperties consumer = new ConsumerProperties();
    private MetricsProperties metrics = new MetricsProperties();

    /**
     * Builds the core configuration. Invalid values raise a
     * {@link com.aporkolab.redelivery.exception.ConfigurationException} and stop the context.
     */
    public RedeliveryConfig toConfig() {
        return RedeliveryConfig.builder()
                .deadLetterSuffix(deadLetter.getSuffix())
                .deadLetterRetention(deadLetter.getRetention())
                .partitionStrategy(deadLetter.getPartitionStrategy())
                .deadLetterPartition(deadLetter.getPartition())
                .publishTimeout(deadLetter.getPublishTimeout())
                .backoff(backoff.toSchedule())
                .deliveryBackoff(delivery.toSchedule())
                .nonRetryableErrorKinds(nonRetryableErrorKinds)
                .pollTimeout(consumer.getPollTimeout())
                .maxPollInterval(consumer.getMaxPollInterval())
                .concurrency(consumer.getConcurrency())
                .maxPollRecords(consumer.getMaxPollRecords())
                .build();
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public DeadLetterProperties getDeadLetter() {
        return deadLetter;
    }

    public void setDeadLetter(DeadLetterProperties deadLetter) {
        this.deadLetter = deadLetter;
    }

    public BackoffProperties getBackoff() {
        return backoff;
    }

    public void setBackoff(BackoffProperties backoff) {
        this.backoff = backoff;
    }

    public BackoffProperties getDelivery() {
        return delivery;
    }

    public void setDelivery(BackoffProperties delivery) {
        this.delivery = delivery;
    }

    public List<String> getNonRetryableErrorKinds() {
        return nonRetryableErrorKinds;
    }

    public void setNonRetryableErrorKinds(List<String> nonRetryableErrorKinds) {
        this.nonRetryableErrorKinds = nonRetryableErrorKinds;
    }

    public ConsumerProperties getConsumer() {
        return consumer;
    }

    public void setConsumer(ConsumerProperties consumer) {
        this.consumer = consumer;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    // ==================== NESTED PROPERTIES ====================

    public static class DeadLetterProperties {
        private String suffix = ".dlt";
        private Duration retention = Duration.ofDays(28);
        private PartitionStrategy partitionStrategy = PartitionStrategy.FIXED;
        private int partition = 0;
        private Duration publishTimeout = Duration.ofSeconds(30);
        /** Create missing dead-letter topics before the consumer starts. */
        private boolean provisionTopics = false;

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public PartitionStrategy getPartitionStrategy() {
            return partitionStrategy;
        }

        public void setPartitionStrategy(PartitionStrategy partitionStrategy) {
            this.partitionStrategy = partitionStrategy;
        }

        public int getPartition() {
            return partition;
        }

        public void setPartition(int partition) {
            this.partition = partition;
        }

        public Duration getPublishTimeout() {
            return publishTimeout;
        }

        public void setPublishTimeout(Duration publishTimeout) {
            this.publishTimeout = publishTimeout;
        }

        public boolean isProvisionTopics() {
            return provisionTopics;
        }

        public void setProvisionTopics(boolean provisionTopics) {
            this.provisionTopics = provisionTopics;
        }
    }

    public static class BackoffProperties {
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(10);
        private int maxRetries = 3;

        static BackoffProperties delivery() {
            BackoffProperties delivery = new BackoffProperties();
            delivery.setMaxInterval(Duration.ofSeconds(30));
            delivery.setMaxRetries(Integer.MAX_VALUE);
            return delivery;
        }

        BackoffSchedule toSchedule() {
            return BackoffSchedule.builder()
                    .initialInterval(initialInterval)
                    .multiplier(multiplier)
                    .maxInterval(maxInterval)
                    .maxRetries(maxRetries)
                    .build();
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxInterval() {
            return maxInterval;
        }

        public void setMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class ConsumerProperties {
        /** Source topics. The consumer loop is only started when at least one is set. */
        private List<String> topics = new ArrayList<>();
        /** Falls back to spring.kafka.consumer.group-id when unset. */
        private String groupId;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration maxPollInterval = Duration.ofMinutes(5);
        private int concurrency = 4;
        /** Also applied as max.poll.records; the retry budget of a full batch must fit in maxPollInterval. */
        private int maxPollRecords = 50;

        public List<String> getTopics() {
            return topics;
        }

        public void setTopics(List<String> topics) {
            this.topics = topics;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getMaxPollInterval() {
            return maxPollInterval;
        }

        public void setMaxPollInterval(Duration maxPollInterval) {
            this.maxPollInterval = maxPollInterval;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxPollRecords() {
            return maxPollRecords;
        }

        public void setMaxPollRecords(int maxPollRecords) {
            this.maxPollRecords = maxPollRecords;
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;
        /** Value of the "consumer" tag on every redelivery meter. */
        private String name = "default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
