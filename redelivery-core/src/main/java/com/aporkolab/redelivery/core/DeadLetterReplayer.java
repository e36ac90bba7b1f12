package com.aporkolab.redelivery.core;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import com.aporkolab.redelivery.exception.DeliveryException;
import com.aporkolab.redelivery.exception.ValidationException;

/**
 * Sends dead-lettered records back to the topic they came from, after an operator fixed the cause.
 *
 * Key and value are replayed byte for byte. The provenance headers appended on dead-lettering are
 * stripped so a second failure gets fresh ones; application headers are kept in order, including
 * ones that happen to share a provenance header name. The partition is left to the producer,
 * which for keyed records lands on the original partition again.
 */
public class DeadLetterReplayer {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterReplayer.class);

    private final KafkaTemplate<byte[], byte[]> kafkaTemplate;
    private final Duration timeout;

    public DeadLetterReplayer(KafkaTemplate<byte[], byte[]> kafkaTemplate, Duration timeout) {
        this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Builds the replay record for a record read back from a dead-letter topic.
     *
     * @throws ValidationException if the record carries no {@code original-topic} header
     */
    public static ProducerRecord<byte[], byte[]> toReplayRecord(ConsumerRecord<byte[], byte[]> deadLetter) {
        Header originalTopic = deadLetter.headers().lastHeader(DeadLetterHeaders.ORIGINAL_TOPIC);
        if (originalTopic == null || originalTopic.value() == null) {
            throw new ValidationException(DeadLetterHeaders.ORIGINAL_TOPIC,
                    "missing on " + deadLetter.topic() + "-" + deadLetter.partition() + "@" + deadLetter.offset());
        }

        return new ProducerRecord<>(new String(originalTopic.value(), StandardCharsets.UTF_8), null,
                deadLetter.key(), deadLetter.value(), withoutProvenance(deadLetter.headers()));
    }

    /**
     * Drops the last occurrence of each provenance header; earlier ones belong to the application.
     */
    static RecordHeaders withoutProvenance(Iterable<Header> source) {
        List<Header> all = new ArrayList<>();
        source.forEach(all::add);

        Set<String> stripped = new HashSet<>();
        boolean[] drop = new boolean[all.size()];
        for (int i = all.size() - 1; i >= 0; i--) {
            String key = all.get(i).key();
            if (DeadLetterHeaders.PROVENANCE.contains(key) && stripped.add(key)) {
                drop[i] = true;
            }
        }

        RecordHeaders headers = new RecordHeaders();
        for (int i = 0; i < all.size(); i++) {
            if (!drop[i]) {
                headers.add(all.get(i).key(), all.get(i).value());
            }
        }
        return headers;
    }

    /**
     * Same as {@link #toReplayRecord(ConsumerRecord)} for a record still held in memory.
     */
    public static ProducerRecord<byte[], byte[]> toReplayRecord(DeadLetterRecord deadLetter) {
        RecordHeaders headers = new RecordHeaders();
        for (MessageHeader header : deadLetter.original().headers()) {
            headers.add(header.key(), header.value());
        }
        return new ProducerRecord<>(deadLetter.original().sourceTopic(), null,
                deadLetter.key(), deadLetter.value(), headers);
    }

    /**
     * Replays one record and waits for the broker acknowledgment.
     *
     * @throws DeliveryException if the write is not acknowledged in time
     */
    public RecordMetadata replay(ConsumerRecord<byte[], byte[]> deadLetter) {
        ProducerRecord<byte[], byte[]> record = toReplayRecord(deadLetter);
        try {
            RecordMetadata metadata = kafkaTemplate.send(record)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            log.info("Replayed {}-{}@{} to {}-{}@{}", deadLetter.topic(), deadLetter.partition(), deadLetter.offset(),
                    metadata.topic(), metadata.partition(), metadata.offset());
            return metadata;
        } catch (ExecutionException e) {
            throw new DeliveryException(record.topic(), e.getCause());
        } catch (TimeoutException e) {
            throw new DeliveryException(record.topic(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(record.topic(), e);
        }
    }
}
