package com.redisgl.server.handler;

/**
 * User events fired by {@link HandshakeHandler} once the upgrade request has been answered.
 */
public enum HandshakeEvent {
    COMPLETED,
    REJECTED
}
