package com.aporkolab.redelivery.integration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

/**
 * Reads partition 0 of a dead-letter topic from the beginning and keeps everything it has seen.
 * Only call it from one thread at a time.
 */
class DeadLetterTopicReader implements AutoCloseable {

    private final KafkaConsumer<byte[], byte[]> consumer;
    private final List<ConsumerRecord<byte[], byte[]>> seen = new ArrayList<>();

    DeadLetterTopicReader(String bootstrapServers, String topic) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        this.consumer = new KafkaConsumer<>(props);
        // dead letters go to partition 0; assigning skips the group join
        this.consumer.assign(List.of(new TopicPartition(topic, 0)));
    }

    /**
     * Polls once, then returns every record seen so far with the given key.
     */
    List<ConsumerRecord<byte[], byte[]>> recordsWithKey(String key) {
        consumer.poll(Duration.ofMillis(200)).forEach(seen::add);
        List<ConsumerRecord<byte[], byte[]>> matching = new ArrayList<>();
        for (ConsumerRecord<byte[], byte[]> record : seen) {
            if (record.key() != null && key.equals(new String(record.key(), StandardCharsets.UTF_8))) {
                matching.add(record);
            }
        }
        return matching;
    }

    static String header(ConsumerRecord<byte[], byte[]> record, String key) {
        Header header = record.headers().lastHeader(key);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        consumer.close();
    }
}
