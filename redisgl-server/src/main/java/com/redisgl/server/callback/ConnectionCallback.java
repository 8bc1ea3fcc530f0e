package com.redisgl.server.callback;

import com.redisgl.server.WebSocketServer;
import com.redisgl.server.connection.ClientConnection;

/**
 * Invoked once per client, after the handshake succeeded and the client was registered,
 * before any of its frames are delivered. May write to the connection, e.g. to send an
 * initial state snapshot.
 */
@FunctionalInterface
public interface ConnectionCallback {

    void onConnect(WebSocketServer server, ClientConnection connection);
}
