package com.redisgl.core.codec;

/**
 * Thrown when inbound bytes cannot be parsed as a complete frame.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }
}
