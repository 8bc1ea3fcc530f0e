package com.redisgl.server.handler;

import com.redisgl.core.codec.FrameCodec;
import com.redisgl.core.message.Message;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;

/**
 * Encodes outbound {@link Message}s into unmasked frames. Raw {@link ByteBuf} writes, which
 * carry pre-encoded frames, pass through untouched.
 */
@Slf4j
public class WebSocketFrameEncoder extends MessageToByteEncoder<Message> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, ByteBuf out) {
        byte[] frame = FrameCodec.encode(msg);
        out.writeBytes(frame);
        log.debug("WebSocketFrameEncoder: encoded {} into {} byte(s)", msg, frame.length);
    }
}
