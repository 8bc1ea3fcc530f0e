package com.redisgl.server.handler;

import java.util.List;

import com.redisgl.core.handshake.HandshakeProcessor;
import com.redisgl.core.handshake.HandshakeResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;

/**
 * First handler of every client pipeline. Buffers the upgrade request up to the blank line,
 * answers it, and on success removes itself so that any bytes already received after the
 * request reach the frame decoder. Fires {@link HandshakeEvent#COMPLETED} before removal.
 */
@Slf4j
public class HandshakeHandler extends ByteToMessageDecoder {

    private static final int TERMINATOR_LENGTH = 4;

    private final int maxHandshakeBytes;
    private boolean rejected;

    public HandshakeHandler(int maxHandshakeBytes) {
        this.maxHandshakeBytes = maxHandshakeBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (rejected) {
            in.skipBytes(in.readableBytes());
            return;
        }
        int terminator = indexOfTerminator(in);
        if (terminator < 0) {
            if (in.readableBytes() > maxHandshakeBytes) {
                log.warn("HandshakeHandler: no end of request within {} bytes from {}", maxHandshakeBytes,
                        ctx.channel().remoteAddress());
                in.skipBytes(in.readableBytes());
                reject(ctx);
            }
            return;
        }

        int requestLength = terminator - in.readerIndex() + TERMINATOR_LENGTH;
        byte[] request = new byte[requestLength];
        in.readBytes(request);

        HandshakeResult result = HandshakeProcessor.process(request);
        if (!result.isAccepted()) {
            reject(ctx);
            return;
        }
        ctx.writeAndFlush(Unpooled.wrappedBuffer(result.getResponse()));
        log.debug("HandshakeHandler: upgrade accepted for {}, accept key {}", ctx.channel().remoteAddress(),
                result.getAcceptKey());
        ctx.fireUserEventTriggered(HandshakeEvent.COMPLETED);
        ctx.pipeline().remove(this);
    }

    private void reject(ChannelHandlerContext ctx) {
        rejected = true;
        ctx.fireUserEventTriggered(HandshakeEvent.REJECTED);
        ctx.writeAndFlush(Unpooled.wrappedBuffer(HandshakeProcessor.rejectResponse()))
                .addListener(ChannelFutureListener.CLOSE);
    }

    private static int indexOfTerminator(ByteBuf in) {
        int last = in.writerIndex() - TERMINATOR_LENGTH;
        for (int i = in.readerIndex(); i <= last; i++) {
            if (in.getByte(i) == '\r' && in.getByte(i + 1) == '\n'
                    && in.getByte(i + 2) == '\r' && in.getByte(i + 3) == '\n') {
                return i;
            }
        }
        return -1;
    }
}
