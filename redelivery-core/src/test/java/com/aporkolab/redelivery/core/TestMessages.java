package com.aporkolab.redelivery.core;

import java.nio.charset.StandardCharsets;

final class TestMessages {

    private TestMessages() {}

    static Message message(String topic, int partition, long offset, String value) {
        return Message.builder()
                .key(("key-" + offset).getBytes(StandardCharsets.UTF_8))
                .value(value.getBytes(StandardCharsets.UTF_8))
                .sourceTopic(topic)
                .sourcePartition(partition)
                .offset(offset)
                .build();
    }

    static Message order(long offset, String value) {
        return message("orders", 0, offset, value);
    }

    static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
