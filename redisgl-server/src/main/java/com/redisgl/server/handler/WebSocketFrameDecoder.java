package com.redisgl.server.handler;

import java.util.List;
import java.util.Optional;

import com.redisgl.core.codec.FrameCodec;
import com.redisgl.core.codec.FrameOpcode;
import com.redisgl.core.codec.InboundFrame;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import lombok.extern.slf4j.Slf4j;

/**
 * Cuts the inbound byte stream into whole client frames and decodes each one with
 * {@link FrameCodec#decode(byte[])}. Emits {@link InboundFrame}s, or
 * {@link SessionSignal#CLOSE_REQUESTED} for the close sentinel, after which input is discarded.
 *
 * <p>Continuation frames are not reassembled: every frame is delivered on its own.
 */
@Slf4j
public class WebSocketFrameDecoder extends ByteToMessageDecoder {

    private static final int BASE_HEADER_LENGTH = 2;

    private final long maxFramePayloadLength;
    private boolean closeRequested;

    public WebSocketFrameDecoder(long maxFramePayloadLength) {
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (closeRequested) {
            in.skipBytes(in.readableBytes());
            return;
        }
        if (in.readableBytes() < BASE_HEADER_LENGTH) {
            return;
        }
        int start = in.readerIndex();
        int indicator = in.getUnsignedByte(start + 1) & FrameOpcode.LENGTH_MASK;
        int extendedLength = FrameCodec.extendedLengthSize(indicator);
        if (in.readableBytes() < BASE_HEADER_LENGTH + extendedLength) {
            return;
        }

        long payloadLength;
        if (extendedLength == 2) {
            payloadLength = in.getUnsignedShort(start + BASE_HEADER_LENGTH);
        } else if (extendedLength == 8) {
            payloadLength = in.getLong(start + BASE_HEADER_LENGTH);
        } else {
            payloadLength = indicator;
        }
        if (payloadLength < 0 || payloadLength > maxFramePayloadLength) {
            in.skipBytes(in.readableBytes());
            throw new TooLongFrameException("Frame payload of " + payloadLength + " bytes exceeds limit of "
                    + maxFramePayloadLength);
        }

        long frameLength = BASE_HEADER_LENGTH + extendedLength + FrameCodec.MASK_LENGTH + payloadLength;
        if (in.readableBytes() < frameLength) {
            return;
        }
        byte[] raw = new byte[(int) frameLength];
        in.readBytes(raw);

        Optional<InboundFrame> frame = FrameCodec.decode(raw);
        if (frame.isPresent()) {
            log.debug("WebSocketFrameDecoder: {} from {}", frame.get(), ctx.channel().remoteAddress());
            out.add(frame.get());
        } else {
            closeRequested = true;
            out.add(SessionSignal.CLOSE_REQUESTED);
        }
    }
}
