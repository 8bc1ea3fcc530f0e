package com.redisgl.core.message;

/**
 * Kinds of application messages the server can push to a client.
 */
public enum MessageType {
    TEXT,
    BINARY,
    DELTA
}
