package com.redisgl.server.connection;

import java.net.SocketAddress;

import com.redisgl.core.message.Message;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.AttributeKey;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle for one connected client, wrapping its Netty channel. Writes may be issued from any
 * thread; Netty queues them onto the channel's event loop in call order.
 */
@Slf4j
public class ClientConnection {

    public static final AttributeKey<ClientConnection> CONNECTION_ATTRIBUTE_KEY = AttributeKey
            .valueOf("redisgl.ClientConnection");

    @Getter
    private final String connectionId;
    @Getter
    private final Channel channel;
    private volatile SessionState state = SessionState.CONNECTING;

    public ClientConnection(Channel channel) {
        this.channel = channel;
        this.connectionId = channel.id().asShortText();
    }

    /**
     * Connection bound to {@code channel}, or {@code null} before the session handler attached one.
     */
    public static ClientConnection of(Channel channel) {
        return channel.attr(CONNECTION_ATTRIBUTE_KEY).get();
    }

    /**
     * Encodes and sends one message as a single frame.
     */
    public ChannelFuture send(Message message) {
        if (!channel.isActive()) {
            log.warn("ClientConnection {}: channel inactive, dropping {}", connectionId, message);
        }
        return channel.writeAndFlush(message);
    }

    /**
     * Sends bytes that are already a complete frame, e.g. from
     * {@link com.redisgl.core.codec.FrameCodec#encode(Message)}.
     */
    public ChannelFuture sendEncoded(byte[] frame) {
        if (!channel.isActive()) {
            log.warn("ClientConnection {}: channel inactive, dropping {} encoded byte(s)", connectionId,
                    frame.length);
        }
        return channel.writeAndFlush(Unpooled.wrappedBuffer(frame));
    }

    public ChannelFuture close() {
        return channel.close();
    }

    public boolean isActive() {
        return channel.isActive();
    }

    public SocketAddress getRemoteAddress() {
        return channel.remoteAddress();
    }

    public SessionState getState() {
        return state;
    }

    void setState(SessionState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "ClientConnection[" + connectionId + ", " + state + "]";
    }
}
