package com.aporkolab.redelivery.core;

import java.time.Instant;

/**
 * Failure history of one in-flight message. A new value is produced on every failure.
 *
 * @param messageId          {@code topic-partition@offset}
 * @param attemptCount       failed handler invocations so far
 * @param firstFailureAt     when the first failure was recorded
 * @param lastError          the most recent failure
 * @param lastClassification how the most recent failure was classified
 */
public record RetryState(
        String messageId,
        int attemptCount,
        Instant firstFailureAt,
        Throwable lastError,
        Classification lastClassification
) {

    RetryState next(Throwable error, Classification classification) {
        return new RetryState(messageId, attemptCount + 1, firstFailureAt, error, classification);
    }
}
