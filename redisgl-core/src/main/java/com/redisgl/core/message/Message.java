package com.redisgl.core.message;

import java.nio.charset.StandardCharsets;

import lombok.Getter;

/**
 * An outbound application message. Concrete kinds are {@link TextMessage},
 * {@link BinaryMessage} and {@link DeltaMessage}; the frame encoder switches on
 * {@link #getType()} rather than inspecting payload classes at runtime.
 */
@Getter
public abstract class Message {

    private final MessageType type;

    protected Message(MessageType type) {
        this.type = type;
    }

    public static TextMessage text(String text) {
        return new TextMessage(text);
    }

    public static BinaryMessage binary(byte[] data) {
        return new BinaryMessage(data);
    }

    public static BinaryMessage binary(String data) {
        return new BinaryMessage(data.getBytes(StandardCharsets.UTF_8));
    }

    public static DeltaMessage.DeltaMessageBuilder delta() {
        return DeltaMessage.builder();
    }
}
