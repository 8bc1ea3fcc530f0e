package com.redisgl.server.connection;

/**
 * Lifecycle of one client session. Transitions only move forward; {@link #CLOSED} is terminal.
 */
public enum SessionState {
    /** Socket accepted, pipeline not yet active. */
    CONNECTING,
    /** Waiting for the upgrade request. */
    HANDSHAKING,
    /** Upgrade accepted, connection registered, frames flowing. */
    ACTIVE,
    /** Close requested or a terminal failure occurred. */
    CLOSING,
    CLOSED
}
