package io.invsync.server;

import io.invsync.storage.MemoryDocumentStore;
import io.invsync.storage.TtlOpIdDeduper;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a document store server.
 *
 * Wires the in-memory document store, its commit deduplication and event
 * threads, the {@link DocumentService} and the HTTP layer.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        var dedupe = new TtlOpIdDeduper(Duration.ofSeconds(cfg.dedupeTtlSeconds()));
        ExecutorService events = Executors.newFixedThreadPool(cfg.eventThreads(), daemonThreads("store-events"));
        var store = new MemoryDocumentStore(dedupe, events, Clock.systemUTC());

        var web = new WebServer(cfg.httpPort(), new DocumentService(store));
        web.start();
        System.out.printf("Document store listening on http://localhost:%d%n", cfg.httpPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error stopping HTTP server", e);
            }
            events.shutdown();
        }));
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
