package com.redisgl.server;

import com.redisgl.server.config.ServerConfig;
import com.redisgl.server.connection.ConnectionHandler;
import com.redisgl.server.handler.HandshakeHandler;
import com.redisgl.server.handler.WebSocketFrameDecoder;
import com.redisgl.server.handler.WebSocketFrameEncoder;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Builds the pipeline of an accepted client channel:
 * handshake, frame decoder, frame encoder, session handler.
 */
public class WebSocketServerInitializer extends ChannelInitializer<Channel> {

    public static final String HANDSHAKE_HANDLER = "handshake";
    public static final String FRAME_DECODER = "frameDecoder";
    public static final String FRAME_ENCODER = "frameEncoder";
    public static final String SESSION_HANDLER = "session";

    private final WebSocketServer server;
    private final EventExecutorGroup callbackGroup;

    /**
     * @param callbackGroup executors for the session handler, or {@code null} to run it on the
     *                      channel's I/O thread
     */
    public WebSocketServerInitializer(WebSocketServer server, EventExecutorGroup callbackGroup) {
        this.server = server;
        this.callbackGroup = callbackGroup;
    }

    @Override
    protected void initChannel(Channel ch) {
        ServerConfig config = server.getConfig();
        ChannelPipeline p = ch.pipeline();
        p.addLast(HANDSHAKE_HANDLER, new HandshakeHandler(config.getMaxHandshakeBytes()));
        p.addLast(FRAME_DECODER, new WebSocketFrameDecoder(config.getMaxFramePayloadLength()));
        p.addLast(FRAME_ENCODER, new WebSocketFrameEncoder());
        p.addLast(callbackGroup, SESSION_HANDLER, new ConnectionHandler(server));
    }
}
