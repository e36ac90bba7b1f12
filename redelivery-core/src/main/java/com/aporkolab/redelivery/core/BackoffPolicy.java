package com.aporkolab.redelivery.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff over a {@link BackoffSchedule}.
 *
 * {@code attempt} is the number of failed handler invocations so far. The first
 * retry waits exactly {@code initialInterval}; each later one is multiplied by
 * {@code multiplier} and capped at {@code maxInterval}. Pure and deterministic.
 */
public class BackoffPolicy {

    private final BackoffSchedule schedule;

    public BackoffPolicy(BackoffSchedule schedule) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
    }

    public BackoffDecision nextDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        return new BackoffDecision(delayFor(attempt), attempt >= schedule.maxRetries());
    }

    /**
     * Upper bound of the time one message can spend waiting between attempts before it is exhausted.
     * Saturates at {@code Long.MAX_VALUE} milliseconds.
     */
    public Duration maxTotalDelay() {
        long maxMs = schedule.maxInterval().toMillis();
        long total = 0;
        for (int attempt = 1; attempt < schedule.maxRetries(); attempt++) {
            long delayMs = delayFor(attempt).toMillis();
            if (delayMs >= maxMs) {
                // every remaining wait is capped
                long remaining = (long) schedule.maxRetries() - attempt;
                return Duration.ofMillis(saturatedAdd(total, saturatedMultiply(maxMs, remaining)));
            }
            total = saturatedAdd(total, delayMs);
        }
        return Duration.ofMillis(total);
    }

    public BackoffSchedule getSchedule() {
        return schedule;
    }

    private Duration delayFor(int attempt) {
        long initialMs = schedule.initialInterval().toMillis();
        long maxMs = schedule.maxInterval().toMillis();
        int exponent = Math.max(attempt - 1, 0);

        double raw = initialMs * Math.pow(schedule.multiplier(), exponent);
        if (Double.isNaN(raw) || raw >= maxMs) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis((long) raw);
    }

    private static long saturatedAdd(long a, long b) {
        long result = a + b;
        return ((a ^ result) & (b ^ result)) < 0 ? Long.MAX_VALUE : result;
    }

    private static long saturatedMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        return (high == 0 && low >= 0) ? low : Long.MAX_VALUE;
    }
}
