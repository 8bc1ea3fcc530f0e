package com.redisgl.server.connection;

import com.redisgl.core.codec.InboundFrame;
import com.redisgl.core.registry.ClientRegistry;
import com.redisgl.server.WebSocketServer;
import com.redisgl.server.callback.ConnectionCallback;
import com.redisgl.server.callback.MessageCallback;
import com.redisgl.server.handler.HandshakeEvent;
import com.redisgl.server.handler.ReadFailure;
import com.redisgl.server.handler.SessionSignal;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-client session: drives {@link SessionState} from handshake to close, keeps the
 * {@link ClientRegistry} membership in step with it, and delivers callbacks.
 *
 * <p>All methods run on the single executor this handler was added with, so callbacks for
 * one client never overlap.
 */
@Slf4j
public class ConnectionHandler extends SimpleChannelInboundHandler<Object> {

    private final WebSocketServer server;
    private final ClientRegistry<ClientConnection> registry;
    private final ConnectionCallback connectionCallback;
    private final MessageCallback messageCallback;
    private final int maxTransientReadFailures;

    private ClientConnection connection;
    private boolean registered;
    private boolean closeNotified;
    private int transientReadFailures;

    public ConnectionHandler(WebSocketServer server) {
        this.server = server;
        this.registry = server.getClients();
        this.connectionCallback = server.getConnectionCallback();
        this.messageCallback = server.getMessageCallback();
        this.maxTransientReadFailures = server.getConfig().getMaxTransientReadFailures();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connection = new ClientConnection(ctx.channel());
        ctx.channel().attr(ClientConnection.CONNECTION_ATTRIBUTE_KEY).set(connection);
        connection.setState(SessionState.HANDSHAKING);
        log.debug("ConnectionHandler: accepted {} from {}", connection.getConnectionId(), ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == HandshakeEvent.COMPLETED) {
            activate();
        } else if (evt == HandshakeEvent.REJECTED) {
            connection.setState(SessionState.CLOSING);
            log.warn("ConnectionHandler: handshake rejected for {}", ctx.channel().remoteAddress());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    private void activate() {
        connection.setState(SessionState.ACTIVE);
        registered = registry.add(connection);
        log.info("Client {} connected from {} ({} connected)", connection.getConnectionId(),
                connection.getRemoteAddress(), registry.size());
        if (connectionCallback != null) {
            connectionCallback.onConnect(server, connection);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof InboundFrame) {
            transientReadFailures = 0;
            if (messageCallback != null) {
                messageCallback.onMessage(server, connection, ((InboundFrame) msg).getPayload());
            }
        } else if (msg == SessionSignal.CLOSE_REQUESTED) {
            connection.setState(SessionState.CLOSING);
            log.debug("ConnectionHandler: client {} requested close", connection.getConnectionId());
            try {
                notifyClosed();
            } finally {
                ctx.close();
            }
        } else {
            log.warn("ConnectionHandler: unexpected inbound object {} on {}", msg.getClass().getName(),
                    connection.getConnectionId());
        }
    }

    /**
     * Delivers the final {@code null} message at most once per session.
     */
    private void notifyClosed() {
        if (closeNotified) {
            return;
        }
        closeNotified = true;
        if (messageCallback != null) {
            messageCallback.onMessage(server, connection, null);
        }
    }

    /**
     * Only transient errors raised inside the pipeline reach the tolerance below: Netty's NIO
     * transport closes the channel itself right after reporting a socket read failure.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (ReadFailure.classify(cause) == ReadFailure.TRANSIENT
                && ++transientReadFailures <= maxTransientReadFailures) {
            log.warn("ConnectionHandler: transient read failure {}/{} on {}: {}", transientReadFailures,
                    maxTransientReadFailures, connection.getConnectionId(), cause.toString());
            return;
        }
        log.error("ConnectionHandler: closing {} after failure", connection.getConnectionId(), cause);
        connection.setState(SessionState.CLOSING);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (registered) {
            try {
                notifyClosed();
            } catch (RuntimeException e) {
                log.error("ConnectionHandler: message callback failed on disconnect of {}",
                        connection.getConnectionId(), e);
            }
            registry.remove(connection);
            registered = false;
            log.info("Client {} disconnected ({} connected)", connection.getConnectionId(), registry.size());
        }
        connection.setState(SessionState.CLOSED);
        super.channelInactive(ctx);
    }
}
