package com.aporkolab.redelivery.core;

import java.time.Duration;
import java.util.Objects;

import com.aporkolab.redelivery.exception.ConfigurationException;

/**
 * Immutable retry timing configuration: {@code initialInterval}, {@code multiplier},
 * {@code maxInterval} and {@code maxRetries}. Loaded once at startup.
 */
public final class BackoffSchedule {

    private final Duration initialInterval;
    private final double multiplier;
    private final Duration maxInterval;
    private final int maxRetries;

    private BackoffSchedule(Builder builder) {
        this.initialInterval = builder.initialInterval;
        this.multiplier = builder.multiplier;
        this.maxInterval = builder.maxInterval;
        this.maxRetries = builder.maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 1s, doubling, capped at 10s, three attempts.
     */
    public static BackoffSchedule defaults() {
        return builder().build();
    }

    public Duration initialInterval() {
        return initialInterval;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration maxInterval() {
        return maxInterval;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return String.format("BackoffSchedule{initial=%s, multiplier=%s, max=%s, maxRetries=%d}",
                initialInterval, multiplier, maxInterval, maxRetries);
    }

    public static class Builder {
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(10);
        private int maxRetries = 3;

        public Builder initialInterval(Duration initialInterval) {
            Objects.requireNonNull(initialInterval, "initialInterval must not be null");
            if (initialInterval.isNegative()) {
                throw new ConfigurationException("backoff.initialInterval", "must not be negative");
            }
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
                throw new ConfigurationException("backoff.multiplier", "must be a finite number >= 0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            Objects.requireNonNull(maxInterval, "maxInterval must not be null");
            if (maxInterval.isNegative()) {
                throw new ConfigurationException("backoff.maxInterval", "must not be negative");
            }
            this.maxInterval = maxInterval;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new ConfigurationException("backoff.maxRetries", "must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public BackoffSchedule build() {
            if (maxInterval.compareTo(initialInterval) < 0) {
                throw new ConfigurationException("backoff.maxInterval",
                        "must be >= backoff.initialInterval (" + initialInterval + ")");
            }
            return new BackoffSchedule(this);
        }
    }
}
