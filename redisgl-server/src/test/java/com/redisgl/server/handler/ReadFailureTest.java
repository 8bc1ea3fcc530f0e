package com.redisgl.server.handler;

import java.io.IOException;
import java.net.SocketTimeoutException;

import com.redisgl.core.codec.MalformedFrameException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReadFailureTest {

    @Test
    void testInterruptedReadsAreTransient() {
        assertEquals(ReadFailure.TRANSIENT, ReadFailure.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ReadFailure.TRANSIENT,
                ReadFailure.classify(new IOException("wrapped", new SocketTimeoutException())));
    }

    @Test
    void testDecodingAndTransportErrorsAreTerminal() {
        assertEquals(ReadFailure.TERMINAL, ReadFailure.classify(new TooLongFrameException("too long")));
        assertEquals(ReadFailure.TERMINAL,
                ReadFailure.classify(new DecoderException(new MalformedFrameException("truncated"))));
        assertEquals(ReadFailure.TERMINAL, ReadFailure.classify(new IOException("Connection reset by peer")));
        assertEquals(ReadFailure.TERMINAL, ReadFailure.classify(new IllegalStateException("callback failed")));
    }
}
