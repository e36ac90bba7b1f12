package com.aporkolab.redelivery.core;

import java.time.Duration;

import com.aporkolab.redelivery.exception.DeliveryException;

/**
 * Lifecycle callbacks from the {@link RecoveryCoordinator}. Called on the partition worker thread.
 * A listener that throws is logged and otherwise ignored.
 */
public interface RecoveryListener {

    default void onReceived(Message message) {
    }

    default void onSuccess(Message message, int attempts) {
    }

    default void onRetryScheduled(Message message, RetryState state, Duration delay) {
    }

    default void onDeadLettered(DeadLetterRecord record) {
    }

    default void onDeliveryFailure(DeadLetterRecord record, DeliveryException error, int deliveryAttempt) {
    }

    default void onAbandoned(Message message, int attempts) {
    }
}
