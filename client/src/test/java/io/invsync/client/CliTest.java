package io.invsync.client;

import io.invsync.server.DocumentService;
import io.invsync.server.WebServer;
import io.invsync.storage.MemoryDocumentStore;
import io.invsync.storage.TtlOpIdDeduper;
import io.invsync.sync.inventory.InventorySchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    private static final int PORT = 18283; // test-only port
    private static final String BASE = "http://localhost:" + PORT;

    private MemoryDocumentStore backend;
    private WebServer server;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void start() {
        backend = new MemoryDocumentStore(new TtlOpIdDeduper(Duration.ofMinutes(10)), Runnable::run, Clock.systemUTC());
        server = new WebServer(PORT, "localhost", new DocumentService(backend));
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    private int cli(String... args) {
        out.reset();
        err.reset();
        String[] full = new String[args.length + 2];
        full[0] = "--base-url";
        full[1] = BASE;
        System.arraycopy(args, 0, full, 2, args.length);
        return Cli.run(full,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void personal_items_are_saved_and_listed() {
        assertEquals(0, cli("items", "alice"));
        assertEquals("(none)", stdout().trim());

        assertEquals(0, cli("save-item", "alice", "Hammer", "2", "claw"));
        String id = stdout().trim();
        assertFalse(id.isEmpty());

        assertEquals(0, cli("items", "alice"));
        assertEquals(id + "\tHammer\t2\tclaw", stdout().trim());
    }

    @Test
    void group_lifecycle_over_http() {
        assertEquals(0, cli("create-group", "owner", "Workshop"));
        assertEquals("owner", stdout().trim());

        assertEquals(0, cli("add-member", "owner", "bob", "Bob@Example.com"));
        assertEquals("OK", stdout().trim());
        assertEquals(0, cli("set-role", "owner", "bob", "admin"));

        assertEquals(0, cli("members", "owner"));
        String members = stdout();
        assertTrue(members.contains("bob\tbob@example.com\tadmin"), members);
        assertTrue(members.contains("owner\t\towner"), members);

        assertEquals(0, cli("groups", "bob"));
        assertEquals("owner\tWorkshop\tadmin", stdout().trim());

        assertEquals(0, cli("delete-group", "owner"));
        assertTrue(stdout().startsWith("deleted 5 documents in 1 commits"), stdout());

        assertEquals(0, cli("delete-group", "owner"));
        assertEquals("already deleted", stdout().trim());
        assertEquals(0, backend.count(InventorySchema.members("owner")));
    }

    @Test
    void usage_errors_exit_with_one() {
        assertEquals(1, cli());
        assertTrue(stderr().contains("missing command"));

        assertEquals(1, cli("explode"));
        assertTrue(stderr().contains("unknown command: explode"));

        assertEquals(1, cli("save-item", "alice", "Hammer", "many"));
        assertTrue(stderr().contains("quantity must be a number"));

        assertEquals(1, cli("set-role", "g", "u", "overlord"));
        assertTrue(stderr().contains("unknown role"));
    }

    @Test
    void store_failures_exit_with_two() {
        assertEquals(2, cli("remove-member", "nosuchgroup", "bob"));
        assertFalse(stderr().isBlank());
    }

    @Test
    void unknown_option_is_rejected() {
        int code = Cli.run(new String[]{"--verbose", "items", "alice"},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(1, code);
        assertTrue(stderr().contains("unknown option: --verbose"));
    }
}
