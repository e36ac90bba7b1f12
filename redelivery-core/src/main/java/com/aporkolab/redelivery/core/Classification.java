package com.aporkolab.redelivery.core;

/**
 * Outcome of {@link ErrorClassifier#classify(Throwable)}.
 */
public enum Classification {

    /** May succeed on a later attempt */
    RETRYABLE,

    /** Retrying cannot help; route to the dead-letter topic now */
    TERMINAL
}
