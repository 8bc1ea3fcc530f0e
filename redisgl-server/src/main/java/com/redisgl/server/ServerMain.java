package com.redisgl.server;

import java.nio.file.Path;

import com.redisgl.core.message.Message;
import com.redisgl.server.config.ServerConfig;
import com.redisgl.server.config.ServerConfigLoader;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a server that greets each client and logs what it receives.
 *
 * <p>Usage: {@code ServerMain [port | config.json]}
 */
@Slf4j
public class ServerMain {

    public static void main(String[] args) throws Exception {
        ServerConfig config = resolveConfig(args);

        WebSocketServer server = new WebSocketServer(config,
                (srv, client) -> client.send(Message.text("Welcome!")),
                (srv, client, message) -> {
                    if (message == null) {
                        log.info("Client {} is closing", client.getConnectionId());
                    } else {
                        log.info("Received {} byte(s) from {}", message.length, client.getConnectionId());
                    }
                });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> server.shutdown().join(), "redisgl-shutdown"));
        server.serveForever();
    }

    static ServerConfig resolveConfig(String[] args) {
        if (args.length == 0) {
            return ServerConfigLoader.loadDefault();
        }
        String arg = args[0];
        if (!arg.isEmpty() && arg.chars().allMatch(Character::isDigit)) {
            return ServerConfigLoader.loadDefault().setPort(Integer.parseInt(arg)).validate();
        }
        return ServerConfigLoader.load(Path.of(arg));
    }
}
