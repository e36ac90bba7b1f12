package com.aporkolab.redelivery.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One header of a {@link Message}. The value is kept as raw bytes and copied on the way in and out.
 */
public final class MessageHeader {

    private final String key;
    private final byte[] value;

    public MessageHeader(String key, byte[] value) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = value == null ? null : value.clone();
    }

    public static MessageHeader ofString(String key, String value) {
        return new MessageHeader(key, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }

    public String key() {
        return key;
    }

    public byte[] value() {
        return value == null ? null : value.clone();
    }

    public String valueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageHeader other)) return false;
        return key.equals(other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return key + "=" + valueAsString();
    }
}
