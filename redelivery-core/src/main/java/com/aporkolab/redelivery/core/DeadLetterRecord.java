package com.aporkolab.redelivery.core;

import java.util.List;
import java.util.Objects;

/**
 * A failed message addressed to its dead-letter destination.
 * Immutable; the same instance is re-sent if the first publish is not acknowledged.
 */
public final class DeadLetterRecord {

    private final Message original;
    private final List<MessageHeader> headers;
    private final String destinationTopic;
    private final Integer destinationPartition;
    private final DeadLetterReason reason;
    private final int attemptCount;

    DeadLetterRecord(Message original, List<MessageHeader> headers, String destinationTopic,
                     Integer destinationPartition, DeadLetterReason reason, int attemptCount) {
        this.original = Objects.requireNonNull(original, "original must not be null");
        this.headers = List.copyOf(headers);
        this.destinationTopic = Objects.requireNonNull(destinationTopic, "destinationTopic must not be null");
        this.destinationPartition = destinationPartition;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.attemptCount = attemptCount;
    }

    public Message original() {
        return original;
    }

    /**
     * Original headers, unchanged and in order, followed by the provenance headers.
     */
    public List<MessageHeader> headers() {
        return headers;
    }

    public String destinationTopic() {
        return destinationTopic;
    }

    /**
     * Target partition, or null to let the producer's partitioner choose.
     */
    public Integer destinationPartition() {
        return destinationPartition;
    }

    public DeadLetterReason reason() {
        return reason;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public byte[] key() {
        return original.key();
    }

    public byte[] value() {
        return original.value();
    }

    public String headerValue(String key) {
        for (int i = headers.size() - 1; i >= 0; i--) {
            if (headers.get(i).key().equals(key)) {
                return headers.get(i).valueAsString();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("DeadLetterRecord{%s -> %s[%s], reason=%s, attempts=%d}",
                original.messageId(), destinationTopic,
                destinationPartition == null ? "any" : destinationPartition, reason, attemptCount);
    }
}
