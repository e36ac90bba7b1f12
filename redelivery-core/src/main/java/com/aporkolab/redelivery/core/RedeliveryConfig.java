package com.aporkolab.redelivery.core;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import com.aporkolab.redelivery.exception.ConfigurationException;

/**
 * Process-wide redelivery configuration. Immutable; built once at startup and passed
 * explicitly to the components that need it.
 *
 * Usage:
 * <pre>
 * RedeliveryConfig config = RedeliveryConfig.fromProperties(props);
 * // or
 * RedeliveryConfig config = RedeliveryConfig.builder()
 *         .backoff(BackoffSchedule.builder().maxRetries(5).build())
 *         .deadLetterSuffix("-dlt")
 *         .build();
 * </pre>
 */
public final class RedeliveryConfig {

    public static final String DEAD_LETTER_SUFFIX = "deadletter.suffix";
    public static final String DEAD_LETTER_RETENTION = "deadletter.retention";
    public static final String DEAD_LETTER_PARTITION_STRATEGY = "deadletter.partitionStrategy";
    public static final String DEAD_LETTER_PARTITION = "deadletter.partition";
    public static final String DEAD_LETTER_PUBLISH_TIMEOUT = "deadletter.publishTimeout";
    public static final String BACKOFF_INITIAL_INTERVAL = "backoff.initialInterval";
    public static final String BACKOFF_MULTIPLIER = "backoff.multiplier";
    public static final String BACKOFF_MAX_INTERVAL = "backoff.maxInterval";
    public static final String BACKOFF_MAX_RETRIES = "backoff.maxRetries";
    public static final String DELIVERY_INITIAL_INTERVAL = "delivery.initialInterval";
    public static final String DELIVERY_MULTIPLIER = "delivery.multiplier";
    public static final String DELIVERY_MAX_INTERVAL = "delivery.maxInterval";
    public static final String NON_RETRYABLE_ERROR_KINDS = "nonRetryableErrorKinds";
    public static final String CONSUMER_POLL_TIMEOUT = "consumer.pollTimeout";
    public static final String CONSUMER_MAX_POLL_INTERVAL = "consumer.maxPollInterval";
    public static final String CONSUMER_CONCURRENCY = "consumer.concurrency";
    public static final String CONSUMER_MAX_POLL_RECORDS = "consumer.maxPollRecords";

    private final String deadLetterSuffix;
    private final Duration deadLetterRetention;
    private final PartitionStrategy partitionStrategy;
    private final int deadLetterPartition;
    private final Duration publishTimeout;
    private final BackoffSchedule backoff;
    private final BackoffSchedule deliveryBackoff;
    private final List<String> nonRetryableErrorKinds;
    private final Duration pollTimeout;
    private final Duration maxPollInterval;
    private final int concurrency;
    private final int maxPollRecords;

    private RedeliveryConfig(Builder builder) {
        this.deadLetterSuffix = builder.deadLetterSuffix;
        this.deadLetterRetention = builder.deadLetterRetention;
        this.partitionStrategy = builder.partitionStrategy;
        this.deadLetterPartition = builder.deadLetterPartition;
        this.publishTimeout = builder.publishTimeout;
        this.backoff = builder.backoff;
        this.deliveryBackoff = builder.deliveryBackoff;
        this.nonRetryableErrorKinds = List.copyOf(builder.nonRetryableErrorKinds);
        this.pollTimeout = builder.pollTimeout;
        this.maxPollInterval = builder.maxPollInterval;
        this.concurrency = builder.concurrency;
        this.maxPollRecords = builder.maxPollRecords;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RedeliveryConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from properties. Absent keys take their defaults.
     *
     * @throws ConfigurationException on any malformed or out-of-range value
     */
    public static RedeliveryConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props must not be null");
        Builder builder = builder();

        String suffix = props.getProperty(DEAD_LETTER_SUFFIX);
        if (suffix != null) {
            builder.deadLetterSuffix(suffix);
        }
        Duration retention = duration(props, DEAD_LETTER_RETENTION);
        if (retention != null) {
            builder.deadLetterRetention(retention);
        }
        String strategy = trimmed(props, DEAD_LETTER_PARTITION_STRATEGY);
        if (strategy != null) {
            try {
                builder.partitionStrategy(PartitionStrategy.valueOf(strategy.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(DEAD_LETTER_PARTITION_STRATEGY,
                        "expected one of " + Arrays.toString(PartitionStrategy.values()) + " but was " + strategy, e);
            }
        }
        Integer partition = integer(props, DEAD_LETTER_PARTITION);
        if (partition != null) {
            builder.deadLetterPartition(partition);
        }
        Duration publishTimeout = duration(props, DEAD_LETTER_PUBLISH_TIMEOUT);
        if (publishTimeout != null) {
            builder.publishTimeout(publishTimeout);
        }

        BackoffSchedule.Builder backoff = BackoffSchedule.builder();
        Duration initial = duration(props, BACKOFF_INITIAL_INTERVAL);
        if (initial != null) {
            backoff.initialInterval(initial);
        }
        Double multiplier = decimal(props, BACKOFF_MULTIPLIER);
        if (multiplier != null) {
            backoff.multiplier(multiplier);
        }
        Duration max = duration(props, BACKOFF_MAX_INTERVAL);
        if (max != null) {
            backoff.maxInterval(max);
        }
        Integer maxRetries = integer(props, BACKOFF_MAX_RETRIES);
        if (maxRetries != null) {
            backoff.maxRetries(maxRetries);
        }
        builder.backoff(backoff.build());

        BackoffSchedule.Builder delivery = Builder.defaultDeliveryBackoff();
        Duration deliveryInitial = duration(props, DELIVERY_INITIAL_INTERVAL);
        if (deliveryInitial != null) {
            delivery.initialInterval(deliveryInitial);
        }
        Double deliveryMultiplier = decimal(props, DELIVERY_MULTIPLIER);
        if (deliveryMultiplier != null) {
            delivery.multiplier(deliveryMultiplier);
        }
        Duration deliveryMax = duration(props, DELIVERY_MAX_INTERVAL);
        if (deliveryMax != null) {
            delivery.maxInterval(deliveryMax);
        }
        builder.deliveryBackoff(delivery.build());

        String kinds = trimmed(props, NON_RETRYABLE_ERROR_KINDS);
        if (kinds != null) {
            List<String> names = new ArrayList<>();
            for (String name : kinds.split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
            builder.nonRetryableErrorKinds(names);
        }

        Duration pollTimeout = duration(props, CONSUMER_POLL_TIMEOUT);
        if (pollTimeout != null) {
            builder.pollTimeout(pollTimeout);
        }
        Duration maxPollInterval = duration(props, CONSUMER_MAX_POLL_INTERVAL);
        if (maxPollInterval != null) {
            builder.maxPollInterval(maxPollInterval);
        }
        Integer concurrency = integer(props, CONSUMER_CONCURRENCY);
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        Integer maxPollRecords = integer(props, CONSUMER_MAX_POLL_RECORDS);
        if (maxPollRecords != null) {
            builder.maxPollRecords(maxPollRecords);
        }

        return builder.build();
    }

    /**
     * Parses ISO-8601 ({@code PT2S}) or a plain number of milliseconds.
     */
    public static Duration parseDuration(String option, String value) {
        String text = value.trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofMillis(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(option, "milliseconds out of range: " + text, e);
            }
        }
        try {
            return Duration.parse(text);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(option, "expected ISO-8601 duration or milliseconds but was '" + text + "'", e);
        }
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(backoff);
    }

    public BackoffPolicy deliveryBackoffPolicy() {
        return new BackoffPolicy(deliveryBackoff);
    }

    /**
     * @throws ConfigurationException if a configured error kind does not resolve
     */
    public ErrorClassifier errorClassifier() {
        return ErrorClassifier.builder()
                .nonRetryableKinds(nonRetryableErrorKinds)
                .build();
    }

    public DeadLetterRouter deadLetterRouter(ErrorClassifier classifier) {
        return new DeadLetterRouter(deadLetterSuffix, partitionStrategy, deadLetterPartition, classifier);
    }

    public String deadLetterSuffix() {
        return deadLetterSuffix;
    }

    public Duration deadLetterRetention() {
        return deadLetterRetention;
    }

    public PartitionStrategy partitionStrategy() {
        return partitionStrategy;
    }

    public int deadLetterPartition() {
        return deadLetterPartition;
    }

    public Duration publishTimeout() {
        return publishTimeout;
    }

    public BackoffSchedule backoff() {
        return backoff;
    }

    public BackoffSchedule deliveryBackoff() {
        return deliveryBackoff;
    }

    public List<String> nonRetryableErrorKinds() {
        return nonRetryableErrorKinds;
    }

    public Duration pollTimeout() {
        return pollTimeout;
    }

    public Duration maxPollInterval() {
        return maxPollInterval;
    }

    public int concurrency() {
        return concurrency;
    }

    /**
     * Upper bound on records per poll. Must match {@code max.poll.records} on the consumer.
     */
    public int maxPollRecords() {
        return maxPollRecords;
    }

    @Override
    public String toString() {
        return "RedeliveryConfig{" +
                "suffix='" + deadLetterSuffix + '\'' +
                ", retention=" + deadLetterRetention +
                ", partitionStrategy=" + partitionStrategy +
                ", partition=" + deadLetterPartition +
                ", publishTimeout=" + publishTimeout +
                ", backoff=" + backoff +
                ", delivery=" + deliveryBackoff +
                ", nonRetryable=" + nonRetryableErrorKinds +
                ", pollTimeout=" + pollTimeout +
                ", maxPollInterval=" + maxPollInterval +
                ", concurrency=" + concurrency +
                ", maxPollRecords=" + maxPollRecords +
                '}';
    }

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Duration duration(Properties props, String key) {
        String value = trimmed(props, key);
        return value == null ? null : parseDuration(key, value);
    }

    private static Integer integer(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "expected an integer but was '" + value + "'", e);
        }
    }

    private static Double decimal(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, "expected a number but was '" + value + "'", e);
        }
    }

    public static class Builder {
        private String deadLetterSuffix = DeadLetterRouter.DEFAULT_SUFFIX;
        private Duration deadLetterRetention = Duration.ofDays(28);
        private PartitionStrategy partitionStrategy = PartitionStrategy.FIXED;
        private int deadLetterPartition = 0;
        private Duration publishTimeout = Duration.ofSeconds(30);
        private BackoffSchedule backoff = BackoffSchedule.defaults();
        private BackoffSchedule deliveryBackoff = defaultDeliveryBackoff().build();
        private List<String> nonRetryableErrorKinds = List.of();
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration maxPollInterval = Duration.ofMinutes(5);
        private int concurrency = 4;
        private int maxPollRecords = 50;

        // delivery is retried until it succeeds, so the budget is effectively unbounded
        static BackoffSchedule.Builder defaultDeliveryBackoff() {
            return BackoffSchedule.builder()
                    .initialInterval(Duration.ofSeconds(1))
                    .multiplier(2.0)
                    .maxInterval(Duration.ofSeconds(30))
                    .maxRetries(Integer.MAX_VALUE);
        }

        public Builder deadLetterSuffix(String deadLetterSuffix) {
            if (deadLetterSuffix == null || deadLetterSuffix.isBlank()) {
                throw new ConfigurationException(DEAD_LETTER_SUFFIX, "must not be blank");
            }
            this.deadLetterSuffix = deadLetterSuffix.trim();
            return this;
        }

        public Builder deadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = positive(DEAD_LETTER_RETENTION, deadLetterRetention);
            return this;
        }

        public Builder partitionStrategy(PartitionStrategy partitionStrategy) {
            this.partitionStrategy = Objects.requireNonNull(partitionStrategy, "partitionStrategy must not be null");
            return this;
        }

        public Builder deadLetterPartition(int deadLetterPartition) {
            if (deadLetterPartition < 0) {
                throw new ConfigurationException(DEAD_LETTER_PARTITION, "must be >= 0");
            }
            this.deadLetterPartition = deadLetterPartition;
            return this;
        }

        public Builder publishTimeout(Duration publishTimeout) {
            this.publishTimeout = positive(DEAD_LETTER_PUBLISH_TIMEOUT, publishTimeout);
            return this;
        }

        public Builder backoff(BackoffSchedule backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }

        /**
         * Backoff between dead-letter publish attempts. Its {@code maxRetries} is ignored.
         */
        public Builder deliveryBackoff(BackoffSchedule deliveryBackoff) {
            this.deliveryBackoff = Objects.requireNonNull(deliveryBackoff, "deliveryBackoff must not be null");
            return this;
        }

        public Builder nonRetryableErrorKinds(List<String> nonRetryableErrorKinds) {
            this.nonRetryableErrorKinds = List.copyOf(nonRetryableErrorKinds);
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = positive(CONSUMER_POLL_TIMEOUT, pollTimeout);
            return this;
        }

        public Builder maxPollInterval(Duration maxPollInterval) {
            this.maxPollInterval = positive(CONSUMER_MAX_POLL_INTERVAL, maxPollInterval);
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new ConfigurationException(CONSUMER_CONCURRENCY, "must be >= 1");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder maxPollRecords(int maxPollRecords) {
            if (maxPollRecords < 1) {
                throw new ConfigurationException(CONSUMER_MAX_POLL_RECORDS, "must be >= 1");
            }
            this.maxPollRecords = maxPollRecords;
            return this;
        }

        public RedeliveryConfig build() {
            // fail at startup on unknown error kinds
            ErrorClassifier.builder().nonRetryableKinds(nonRetryableErrorKinds);
            return new RedeliveryConfig(this);
        }

        private static Duration positive(String option, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(option, "must be a positive duration");
            }
            return value;
        }
    }
}
