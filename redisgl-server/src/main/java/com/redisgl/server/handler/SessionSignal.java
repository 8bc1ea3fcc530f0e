package com.redisgl.server.handler;

/**
 * Non-data messages emitted by {@link WebSocketFrameDecoder}.
 */
public enum SessionSignal {
    /** The client sent the normal-closure sentinel; the session must end. */
    CLOSE_REQUESTED
}
