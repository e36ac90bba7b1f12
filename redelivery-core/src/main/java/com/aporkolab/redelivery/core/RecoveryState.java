package com.aporkolab.redelivery.core;

/**
 * Lifecycle of one message inside the {@link RecoveryCoordinator}.
 *
 * <pre>
 * RECEIVED -> PROCESSING -> SUCCEEDED
 *                        -> FAILED -> AWAITING_RETRY -> PROCESSING
 *                                  -> DEAD_LETTERING -> DEAD_LETTERED
 * </pre>
 *
 * ABANDONED is entered only when shutdown interrupts a retry or delivery wait.
 */
public enum RecoveryState {
    RECEIVED,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    AWAITING_RETRY,
    DEAD_LETTERING,
    DEAD_LETTERED,
    ABANDONED;

    /**
     * Only terminal messages may have their offset committed.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == DEAD_LETTERED;
    }
}
