package com.redisgl.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Listener and session settings. Field names map to the snake_case keys of
 * {@code redisgl-server.json}.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
public class ServerConfig {

    public static final int DEFAULT_PORT = 8001;

    @JsonProperty("port")
    private int port = DEFAULT_PORT;

    @JsonProperty("host")
    private String host = "0.0.0.0";

    @JsonProperty("so_backlog")
    private int soBacklog = 128;

    @JsonProperty("reuse_address")
    private boolean reuseAddress = true;

    /**
     * I/O threads for accepted connections; 0 lets Netty pick.
     */
    @JsonProperty("worker_threads")
    private int workerThreads;

    /**
     * Threads that run connect/message callbacks. Each session stays pinned to one thread,
     * so its callbacks remain ordered. 0 runs callbacks on the I/O threads.
     */
    @JsonProperty("callback_threads")
    private int callbackThreads = 16;

    @JsonProperty("max_handshake_bytes")
    private int maxHandshakeBytes = 8192;

    @JsonProperty("max_frame_payload_length")
    private long maxFramePayloadLength = 16L * 1024 * 1024;

    @JsonProperty("max_transient_read_failures")
    private int maxTransientReadFailures = 3;

    public static ServerConfig defaults() {
        return new ServerConfig();
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public ServerConfig validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (workerThreads < 0 || callbackThreads < 0) {
            throw new IllegalArgumentException("thread counts must not be negative");
        }
        if (maxHandshakeBytes <= 0) {
            throw new IllegalArgumentException("max_handshake_bytes must be positive: " + maxHandshakeBytes);
        }
        if (maxFramePayloadLength <= 0 || maxFramePayloadLength > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("max_frame_payload_length out of range: " + maxFramePayloadLength);
        }
        if (maxTransientReadFailures < 0) {
            throw new IllegalArgumentException(
                    "max_transient_read_failures must not be negative: " + maxTransientReadFailures);
        }
        return this;
    }
}
