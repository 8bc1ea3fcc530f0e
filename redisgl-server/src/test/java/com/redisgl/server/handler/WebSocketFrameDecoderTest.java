package com.redisgl.server.handler;

import java.nio.charset.StandardCharsets;

import com.redisgl.core.codec.FrameOpcode;
import com.redisgl.core.codec.InboundFrame;
import com.redisgl.server.ClientFrames;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketFrameDecoderTest {

    @Test
    void testDecodesWholeFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new WebSocketFrameDecoder(1024));

        channel.writeInbound(Unpooled.wrappedBuffer(ClientFrames.binary((byte) 1, (byte) 2, (byte) 3)));

        InboundFrame frame = channel.readInbound();
        assertEquals(FrameOpcode.BINARY, frame.getOpcode());
        assertArrayEquals(new byte[]{1, 2, 3}, frame.getPayload());
        assertNull(channel.readInbound());
    }

    @Test
    void testFrameArrivingByteByByte() {
        EmbeddedChannel channel = new EmbeddedChannel(new WebSocketFrameDecoder(1024));
        byte[] raw = ClientFrames.text("x".repeat(200));

        for (int i = 0; i < raw.length - 1; i++) {
            channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{raw[i]}));
        }
        assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{raw[raw.length - 1]}));
        InboundFrame frame = channel.readInbound();
        assertTrue(frame.isText());
        assertEquals("x".repeat(200), new String(frame.getPayload(), StandardCharsets.UTF_8));
    }

    @Test
    void testSeveralFramesInOneRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new WebSocketFrameDecoder(1024));

        channel.writeInbound(Unpooled.wrappedBuffer(ClientFrames.concat(
                ClientFrames.text("one"), ClientFrames.text("two"))));

        assertEquals("one", new String(((InboundFrame) channel.readInbound()).getPayload(), StandardCharsets.UTF_8));
        assertEquals("two", new String(((InboundFrame) channel.readInbound()).getPayload(), StandardCharsets.UTF_8));
    }

    @Test
    void testCloseSentinelEndsDecoding() {
        EmbeddedChannel channel = new EmbeddedChannel(new WebSocketFrameDecoder(1024));

        channel.writeInbound(Unpooled.wrappedBuffer(ClientFrames.concat(
                ClientFrames.text("last"), ClientFrames.close(), ClientFrames.text("ignored"))));

        assertTrue(channel.readInbound() instanceof InboundFrame);
        assertSame(SessionSignal.CLOSE_REQUESTED, channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    void testOversizedFrameIsRejected() {
        EmbeddedChannel channel = new EmbeddedChannel(new WebSocketFrameDecoder(10));

        assertThrows(TooLongFrameException.class,
                () -> channel.writeInbound(Unpooled.wrappedBuffer(ClientFrames.binary(new byte[11]))));
        assertNull(channel.readInbound());
    }
}
