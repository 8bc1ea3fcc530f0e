package com.redisgl.core.handshake;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Server side of the HTTP/1.1 upgrade handshake. Only the {@code Sec-WebSocket-Key}
 * header is inspected; method, path and all other headers are ignored.
 */
@Slf4j
public final class HandshakeProcessor {

    /** Fixed GUID appended to the client key before hashing. */
    public static final String WEBSOCKET_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    public static final String KEY_HEADER = "Sec-WebSocket-Key";

    private static final String RESPONSE_TEMPLATE = "HTTP/1.1 101 Web Socket Protocol Handshake\r\n"
            + "Upgrade: websocket\r\n"
            + "Connection: Upgrade\r\n"
            + "Sec-WebSocket-Accept: %s\r\n\r\n";

    private static final byte[] REJECT_RESPONSE = "HTTP/1.1 400 Bad Request\r\n\r\n"
            .getBytes(StandardCharsets.US_ASCII);

    private HandshakeProcessor() {
    }

    /**
     * Processes the raw bytes of an upgrade request.
     *
     * @return an accepted result carrying the 101 response, or a rejected result carrying
     *         the 400 response when no key header is present
     */
    public static HandshakeResult process(byte[] request) {
        Optional<String> clientKey = extractKey(new String(request, StandardCharsets.ISO_8859_1));
        if (clientKey.isEmpty()) {
            log.warn("HandshakeProcessor: {} header not found in {} byte request", KEY_HEADER, request.length);
            return HandshakeResult.rejected(rejectResponse());
        }
        String acceptKey = computeAcceptKey(clientKey.get());
        byte[] response = String.format(RESPONSE_TEMPLATE, acceptKey).getBytes(StandardCharsets.US_ASCII);
        return HandshakeResult.accepted(acceptKey, response);
    }

    /**
     * Finds the first header line named {@code Sec-WebSocket-Key} (case-insensitive) and
     * returns its trimmed value.
     */
    public static Optional<String> extractKey(String request) {
        for (String line : request.split("\r?\n")) {
            if (line.regionMatches(true, 0, KEY_HEADER, 0, KEY_HEADER.length())) {
                int colon = line.indexOf(':');
                if (colon < 0) {
                    continue;
                }
                String value = line.substring(colon + 1).trim();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * base64(SHA-1(key + GUID)).
     */
    public static String computeAcceptKey(String clientKey) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest((clientKey + WEBSOCKET_GUID).getBytes(StandardCharsets.US_ASCII));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public static byte[] rejectResponse() {
        return REJECT_RESPONSE.clone();
    }
}
