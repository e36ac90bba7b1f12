package com.aporkolab.redelivery.core;

/**
 * Categorizes why a message was sent to the dead-letter topic.
 */
public enum DeadLetterReason {

    /** Pre-handler validation rejected the message */
    VALIDATION_FAILED,

    /** The handler failed with an error kind configured as non-retryable */
    NON_RETRYABLE,

    /** Exceeded retry limit for transient errors */
    RETRIES_EXHAUSTED
}
