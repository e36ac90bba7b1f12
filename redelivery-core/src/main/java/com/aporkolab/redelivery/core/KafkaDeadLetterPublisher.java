package com.aporkolab.redelivery.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import com.aporkolab.redelivery.exception.DeliveryException;

/**
 * {@link DeadLetterPublisher} backed by a Spring Kafka {@link KafkaTemplate}.
 *
 * Design decisions:
 * - Raw byte[] key and value, so the payload reaches the dead-letter topic byte for byte
 * - Every header is written in order, duplicates included
 * - Missing topics are reported as such, so the caller can raise an operator alert
 */
public class KafkaDeadLetterPublisher implements DeadLetterPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

    private final KafkaTemplate<byte[], byte[]> kafkaTemplate;

    public KafkaDeadLetterPublisher(KafkaTemplate<byte[], byte[]> kafkaTemplate) {
        this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    }

    @Override
    public CompletableFuture<RecordMetadata> publish(DeadLetterRecord record) {
        ProducerRecord<byte[], byte[]> producerRecord = toProducerRecord(record);
        String destination = record.destinationTopic();

        CompletableFuture<RecordMetadata> result = new CompletableFuture<>();
        try {
            kafkaTemplate.send(producerRecord).whenComplete((sendResult, ex) -> {
                if (ex != null) {
                    result.completeExceptionally(toDeliveryException(destination, ex));
                } else {
                    RecordMetadata metadata = sendResult.getRecordMetadata();
                    log.debug("Dead-letter record written: topic={}, partition={}, offset={}",
                            destination, metadata.partition(), metadata.offset());
                    result.complete(metadata);
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(toDeliveryException(destination, e));
        }
        return result;
    }

    static ProducerRecord<byte[], byte[]> toProducerRecord(DeadLetterRecord record) {
        RecordHeaders headers = new RecordHeaders();
        for (MessageHeader header : record.headers()) {
            headers.add(header.key(), header.value());
        }
        return new ProducerRecord<>(
                record.destinationTopic(),
                record.destinationPartition(),
                record.key(),
                record.value(),
                headers
        );
    }

    static DeliveryException toDeliveryException(String destination, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof DeliveryException delivery) {
            return delivery;
        }
        return new DeliveryException(destination, cause, isDestinationMissing(cause));
    }

    /**
     * The producer either reports the topic as unknown, or times out waiting for metadata
     * of a topic the broker never created.
     */
    static boolean isDestinationMissing(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (current instanceof UnknownTopicOrPartitionException) {
                return true;
            }
            if (current instanceof TimeoutException
                    && current.getMessage() != null
                    && current.getMessage().contains("not present in metadata")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
