package com.redisgl.server.callback;

import com.redisgl.server.WebSocketServer;
import com.redisgl.server.connection.ClientConnection;

/**
 * Invoked once per decoded client frame, in arrival order for that client.
 */
@FunctionalInterface
public interface MessageCallback {

    /**
     * @param message the unmasked payload, or {@code null} once when the session ends, whether
     *                the client sent the close sentinel or the connection dropped
     */
    void onMessage(WebSocketServer server, ClientConnection connection, byte[] message);
}
