package com.aporkolab.redelivery.exception;

/**
 * Publishing a record to its dead-letter destination failed.
 *
 * This is a delivery-layer failure, not an application failure: it is retried
 * independently of the original message's retry budget and never turns into
 * message loss.
 */
public class DeliveryException extends RedeliveryException {

    /** Context key set when an unacknowledged write may still land, so a retry can leave a duplicate. */
    public static final String POSSIBLE_DUPLICATE = "possibleDuplicate";

    private final boolean destinationMissing;

    public DeliveryException(String destination, Throwable cause) {
        this(destination, cause, false);
    }

    public DeliveryException(String destination, Throwable cause, boolean destinationMissing) {
        super(
            "DEAD_LETTER_DELIVERY_ERROR",
            String.format("Publishing to '%s' failed: %s", destination,
                    cause != null ? cause.getMessage() : "unknown cause"),
            cause
        );
        this.destinationMissing = destinationMissing;
        with("destination", destination);
    }

    /**
     * True when the broker reported that the destination topic or partition does not exist.
     * Retrying alone will not help; an operator has to create the topic.
     */
    public boolean isDestinationMissing() {
        return destinationMissing;
    }

    public boolean isPossibleDuplicate() {
        return Boolean.TRUE.equals(getContext().get(POSSIBLE_DUPLICATE));
    }
}
