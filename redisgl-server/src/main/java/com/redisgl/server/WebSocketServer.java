package com.redisgl.server;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.redisgl.core.codec.FrameCodec;
import com.redisgl.core.message.Message;
import com.redisgl.core.registry.ClientRegistry;
import com.redisgl.server.callback.ConnectionCallback;
import com.redisgl.server.callback.MessageCallback;
import com.redisgl.server.config.ServerConfig;
import com.redisgl.server.connection.ClientConnection;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * WebSocket server: accepts clients, performs the upgrade handshake, keeps the registry of
 * connected clients and hands decoded frames to the application callbacks.
 *
 * <pre>
 * WebSocketServer server = new WebSocketServer(8001,
 *         (srv, client) -&gt; client.send(Message.text("Welcome!")),
 *         (srv, client, message) -&gt; handle(message));
 * server.serveForever();
 * </pre>
 */
@Slf4j
public class WebSocketServer {

    @Getter
    private final ServerConfig config;
    @Getter
    private final ConnectionCallback connectionCallback;
    @Getter
    private final MessageCallback messageCallback;
    @Getter
    private final ClientRegistry<ClientConnection> clients = new ClientRegistry<>();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup callbackGroup;
    private volatile Channel serverChannel;
    private volatile int boundPort = -1;
    private CompletableFuture<Void> shutdownFuture;

    /**
     * @param connectionCallback may be {@code null}
     * @param messageCallback    may be {@code null}
     */
    public WebSocketServer(ServerConfig config, ConnectionCallback connectionCallback,
            MessageCallback messageCallback) {
        this.config = config.validate();
        this.connectionCallback = connectionCallback;
        this.messageCallback = messageCallback;
    }

    public WebSocketServer(int port, ConnectionCallback connectionCallback, MessageCallback messageCallback) {
        this(ServerConfig.defaults().setPort(port), connectionCallback, messageCallback);
    }

    /**
     * Binds the listening socket. The returned future completes once the server accepts
     * connections, or exceptionally if binding failed.
     */
    public synchronized CompletableFuture<Void> start() {
        if (bossGroup != null) {
            throw new IllegalStateException("WebSocketServer already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());
        callbackGroup = config.getCallbackThreads() > 0
                ? new DefaultEventExecutorGroup(config.getCallbackThreads())
                : null;

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new WebSocketServerInitializer(this, callbackGroup))
                .option(ChannelOption.SO_BACKLOG, config.getSoBacklog())
                .option(ChannelOption.SO_REUSEADDR, config.isReuseAddress())
                .childOption(ChannelOption.TCP_NODELAY, true);

        CompletableFuture<Void> startFuture = new CompletableFuture<>();
        b.bind(config.getHost(), config.getPort()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
                boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
                log.info("WebSocketServer listening on {}:{}", config.getHost(), boundPort);
                startFuture.complete(null);
            } else {
                log.error("WebSocketServer failed to bind {}:{}", config.getHost(), config.getPort(),
                        future.cause());
                releaseExecutors();
                startFuture.completeExceptionally(future.cause());
            }
        });
        return startFuture;
    }

    /**
     * Starts the server and blocks until its listening channel is closed.
     */
    public void serveForever() throws InterruptedException {
        start().join();
        try {
            serverChannel.closeFuture().sync();
        } finally {
            shutdown().join();
        }
    }

    /**
     * Closes the listener and every connected client, then releases the thread pools.
     * Calling it again returns the same future.
     */
    public synchronized CompletableFuture<Void> shutdown() {
        if (shutdownFuture != null) {
            return shutdownFuture;
        }
        log.info("WebSocketServer shutting down ({} connected)", clients.size());
        shutdownFuture = new CompletableFuture<>();
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        for (ClientConnection client : clients.snapshot()) {
            client.close().syncUninterruptibly();
        }
        CompletableFuture.allOf(toCompletable(bossGroup), toCompletable(workerGroup), toCompletable(callbackGroup))
                .whenComplete((v, e) -> {
                    if (e == null) {
                        log.info("WebSocketServer stopped");
                        shutdownFuture.complete(null);
                    } else {
                        log.error("WebSocketServer shutdown encountered errors", e);
                        shutdownFuture.completeExceptionally(e);
                    }
                });
        return shutdownFuture;
    }

    /**
     * Encodes {@code message} once and writes it to every connected client while holding the
     * registry lock.
     *
     * @return number of clients written to
     */
    public int broadcast(Message message) {
        byte[] frame = FrameCodec.encode(message);
        int[] count = {0};
        clients.forEach(client -> {
            client.sendEncoded(frame);
            count[0]++;
        });
        log.debug("WebSocketServer: broadcast {} to {} client(s)", message, count[0]);
        return count[0];
    }

    public List<ClientConnection> getConnectedClients() {
        return clients.snapshot();
    }

    /**
     * Port actually bound, which differs from the configured one when that was 0; -1 before start.
     */
    public int getBoundPort() {
        return boundPort;
    }

    public static byte[] encodeMessage(Message message) {
        return FrameCodec.encode(message);
    }

    private void releaseExecutors() {
        toCompletable(bossGroup);
        toCompletable(workerGroup);
        toCompletable(callbackGroup);
    }

    private static CompletableFuture<Void> toCompletable(EventExecutorGroup group) {
        CompletableFuture<Void> completable = new CompletableFuture<>();
        if (group == null) {
            completable.complete(null);
            return completable;
        }
        Future<?> termination = group.shutdownGracefully();
        termination.addListener(f -> {
            if (f.isSuccess()) {
                completable.complete(null);
            } else {
                completable.completeExceptionally(f.cause());
            }
        });
        return completable;
    }
}
