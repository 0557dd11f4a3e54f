package io.invsync.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults_without_flags() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals(8080, cfg.httpPort());
        assertEquals(600, cfg.dedupeTtlSeconds());
        assertEquals(2, cfg.eventThreads());
    }

    @Test
    void flags_override_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-p", "9090", "--dedupe-ttl-seconds", "30", "--event-threads", "4"});

        assertEquals(new ServerConfig(9090, 30, 4), cfg);
    }

    @Test
    void bad_flags_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port", "x"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--event-threads", "0"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--wal", "/tmp"}));
    }
}
