package com.aporkolab.redelivery.core;

import java.util.concurrent.CompletableFuture;

import org.apache.kafka.clients.producer.RecordMetadata;

/**
 * Sends dead-letter records to the broker.
 * Implementations must be safe to share between partition workers.
 */
public interface DeadLetterPublisher {

    /**
     * Publishes the record. The future completes when the broker acknowledged the write,
     * or exceptionally with a {@link com.aporkolab.redelivery.exception.DeliveryException}.
     */
    CompletableFuture<RecordMetadata> publish(DeadLetterRecord record);
}
