package com.redisgl.core.message;

import java.util.Objects;

import lombok.Getter;

@Getter
public class TextMessage extends Message {

    private final String text;

    public TextMessage(String text) {
        super(MessageType.TEXT);
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return "TextMessage[length=" + text.length() + "]";
    }
}
