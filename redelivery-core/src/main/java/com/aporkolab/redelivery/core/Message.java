package com.aporkolab.redelivery.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

/**
 * Immutable envelope for one consumed record.
 *
 * Headers are an ordered list rather than a map: Kafka allows repeated keys and
 * every one of them has to survive a trip through the dead-letter topic.
 */
public final class Message {

    private final byte[] key;
    private final byte[] value;
    private final String sourceTopic;
    private final int sourcePartition;
    private final long offset;
    private final Instant timestamp;
    private final List<MessageHeader> headers;

    private Message(Builder builder) {
        this.key = builder.key == null ? null : builder.key.clone();
        this.value = builder.value == null ? null : builder.value.clone();
        this.sourceTopic = Objects.requireNonNull(builder.sourceTopic, "sourceTopic must not be null");
        this.sourcePartition = builder.sourcePartition;
        this.offset = builder.offset;
        this.timestamp = builder.timestamp;
        this.headers = List.copyOf(builder.headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Message from(ConsumerRecord<byte[], byte[]> record) {
        Builder builder = builder()
                .key(record.key())
                .value(record.value())
                .sourceTopic(record.topic())
                .sourcePartition(record.partition())
                .offset(record.offset())
                .timestamp(record.timestamp() >= 0 ? Instant.ofEpochMilli(record.timestamp()) : null);
        for (Header header : record.headers()) {
            builder.header(header.key(), header.value());
        }
        return builder.build();
    }

    /**
     * Stable identity of this delivery: {@code topic-partition@offset}.
     */
    public String messageId() {
        return sourceTopic + "-" + sourcePartition + "@" + offset;
    }

    public byte[] key() {
        return key == null ? null : key.clone();
    }

    public byte[] value() {
        return value == null ? null : value.clone();
    }

    public String sourceTopic() {
        return sourceTopic;
    }

    public int sourcePartition() {
        return sourcePartition;
    }

    public long offset() {
        return offset;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public List<MessageHeader> headers() {
        return headers;
    }

    /**
     * The last header with the given key, or null.
     */
    public MessageHeader lastHeader(String headerKey) {
        for (int i = headers.size() - 1; i >= 0; i--) {
            if (headers.get(i).key().equals(headerKey)) {
                return headers.get(i);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Message{" + messageId() + ", headers=" + headers.size() + "}";
    }

    public static class Builder {
        private byte[] key;
        private byte[] value;
        private String sourceTopic;
        private int sourcePartition;
        private long offset;
        private Instant timestamp;
        private final List<MessageHeader> headers = new ArrayList<>();

        public Builder key(byte[] key) {
            this.key = key;
            return this;
        }

        public Builder value(byte[] value) {
            this.value = value;
            return this;
        }

        public Builder sourceTopic(String sourceTopic) {
            this.sourceTopic = sourceTopic;
            return this;
        }

        public Builder sourcePartition(int sourcePartition) {
            if (sourcePartition < 0) {
                throw new IllegalArgumentException("sourcePartition must be >= 0");
            }
            this.sourcePartition = sourcePartition;
            return this;
        }

        public Builder offset(long offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be >= 0");
            }
            this.offset = offset;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder header(String headerKey, byte[] headerValue) {
            headers.add(new MessageHeader(headerKey, headerValue));
            return this;
        }

        public Builder header(String headerKey, String headerValue) {
            headers.add(MessageHeader.ofString(headerKey, headerValue));
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
