package com.redisgl.core.handshake;

import lombok.Getter;

/**
 * Outcome of processing an upgrade request: whether it was accepted and the exact
 * bytes to write back to the client in either case.
 */
@Getter
public class HandshakeResult {

    private final boolean accepted;
    private final String acceptKey;
    private final byte[] response;

    private HandshakeResult(boolean accepted, String acceptKey, byte[] response) {
        this.accepted = accepted;
        this.acceptKey = acceptKey;
        this.response = response;
    }

    static HandshakeResult accepted(String acceptKey, byte[] response) {
        return new HandshakeResult(true, acceptKey, response);
    }

    static HandshakeResult rejected(byte[] response) {
        return new HandshakeResult(false, null, response);
    }
}
