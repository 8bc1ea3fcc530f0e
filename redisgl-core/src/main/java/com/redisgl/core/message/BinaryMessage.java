package com.redisgl.core.message;

import java.util.Objects;

/**
 * Opaque bytes sent as a binary frame. The array is not copied.
 */
public class BinaryMessage extends Message {

    private final byte[] data;

    public BinaryMessage(byte[] data) {
        super(MessageType.BINARY);
        this.data = Objects.requireNonNull(data, "data");
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public String toString() {
        return "BinaryMessage[length=" + data.length + "]";
    }
}
