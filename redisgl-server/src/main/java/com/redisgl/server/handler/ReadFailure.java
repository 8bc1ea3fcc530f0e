package com.redisgl.server.handler;

import java.io.InterruptedIOException;

import io.netty.handler.codec.DecoderException;

/**
 * Classification of errors raised while reading from a client.
 *
 * <p>On the NIO transport a failed socket read never surfaces as {@link #TRANSIENT}: Netty
 * closes the channel right after firing {@code exceptionCaught}. Transient failures come from
 * handlers in the pipeline, or from a blocking transport configured with a read timeout.
 */
public enum ReadFailure {
    /** Interrupted or timed-out I/O; the session may keep reading a bounded number of times. */
    TRANSIENT,
    /** Malformed input, a broken transport or an application failure; the session ends. */
    TERMINAL;

    public static ReadFailure classify(Throwable cause) {
        if (cause instanceof DecoderException) {
            return TERMINAL;
        }
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof InterruptedIOException) {
                return TRANSIENT;
            }
        }
        return TERMINAL;
    }
}
