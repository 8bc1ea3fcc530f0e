package com.redisgl.server;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.redisgl.server.config.ServerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ServerMainTest {

    @TempDir
    Path tempDir;

    @Test
    void testNoArgumentsUsesBundledConfig() {
        assertEquals(ServerConfig.DEFAULT_PORT, ServerMain.resolveConfig(new String[0]).getPort());
    }

    @Test
    void testNumericArgumentOverridesPort() {
        assertEquals(9001, ServerMain.resolveConfig(new String[]{"9001"}).getPort());
        assertThrows(IllegalArgumentException.class, () -> ServerMain.resolveConfig(new String[]{"99999"}));
    }

    @Test
    void testPathArgumentLoadsFile() throws IOException {
        Path file = tempDir.resolve("custom.json");
        Files.writeString(file, "{\"port\": 9200, \"host\": \"127.0.0.1\"}");

        ServerConfig config = ServerMain.resolveConfig(new String[]{file.toString()});

        assertEquals(9200, config.getPort());
        assertEquals("127.0.0.1", config.getHost());
    }
}
