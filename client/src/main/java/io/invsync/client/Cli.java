package io.invsync.client;

import io.invsync.core.GroupRole;
import io.invsync.sync.Futures;
import io.invsync.sync.SyncConfig;
import io.invsync.sync.delete.CascadingDeleter;
import io.invsync.sync.delete.DeletionResult;
import io.invsync.sync.index.FanoutIndexMaintainer;
import io.invsync.sync.inventory.GroupService;
import io.invsync.sync.inventory.InventorySchema;
import io.invsync.sync.inventory.InventoryViews;
import io.invsync.sync.inventory.ItemService;
import io.invsync.sync.view.PageOutcome;
import io.invsync.sync.view.PagedSession;

import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * CLI for an inventory kept on a running document server.
 *
 * Usage:
 *   invsync-cli [--base-url http://host:port] [--config sync.json] <command> [args]
 *
 * Commands:
 *   items <uid>                                   list personal items
 *   save-item <uid> <name> <quantity> [description]
 *   group-items <groupId>                         list group items
 *   groups <uid>                                  list groups uid belongs to
 *   members <groupId>                             list members
 *   create-group <ownerUid> <name> [description]
 *   add-member <groupId> <userId> <email>
 *   set-role <groupId> <userId> <admin|member>
 *   remove-member <groupId> <userId>
 *   delete-group <groupId>
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final PrintStream out;
    private final HttpDocumentStore store;
    private final ExecutorService deletions;
    private final InventoryViews views;
    private final GroupService groups;
    private final ItemService items;

    Cli(String baseUrl, SyncConfig config, PrintStream out) {
        this.out = out;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.store = new HttpDocumentStore(URI.create(base), config.pollInterval());
        this.deletions = Executors.newSingleThreadExecutor();
        var index = new FanoutIndexMaintainer(store, InventorySchema.GROUP_INDEX);
        this.views = new InventoryViews(store, config, index);
        this.groups = new GroupService(store, new CascadingDeleter(store, config, deletions), index);
        this.items = new ItemService(store);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Run one command; returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String baseUrl = DEFAULT_BASE_URL;
        SyncConfig config = SyncConfig.defaults();
        int i = 0;
        try {
            while (i < args.length && args[i].startsWith("--")) {
                switch (args[i]) {
                    case "--base-url" -> baseUrl = value(args, i++);
                    case "--config" -> config = SyncConfig.fromJsonFile(Path.of(value(args, i++)));
                    default -> throw new CliException("unknown option: " + args[i]);
                }
                i++;
            }
            if (i >= args.length) {
                throw new CliException("missing command");
            }
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        } catch (RuntimeException e) {
            err.println("error: " + e.getMessage());
            return 1;
        }

        String[] rest = Arrays.copyOfRange(args, i, args.length);
        Cli cli = new Cli(baseUrl, config, out);
        try {
            cli.execute(rest);
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        } catch (RuntimeException e) {
            RuntimeException cause = Futures.unwrap(e);
            err.println("error: " + cause.getMessage());
            return 2;
        } finally {
            cli.close();
        }
    }

    private void execute(String[] rest) {
        String cmd = rest[0];
        switch (cmd) {
            case "items" -> {
                arity(rest, 2, "items <uid>");
                printAll(views.userItems(rest[1], rows -> { }), item ->
                        item.id() + "\t" + item.name() + "\t" + item.quantity()
                                + (item.description() == null ? "" : "\t" + item.description()));
            }
            case "save-item" -> {
                if (rest.length < 4 || rest.length > 5) {
                    throw new CliException("save-item requires <uid> <name> <quantity> [description]");
                }
                long quantity = parseQuantity(rest[3]);
                var ref = Futures.await(items.saveUserItem(rest[1], null, rest[2], rest.length == 5 ? rest[4] : null, quantity));
                out.println(ref.id());
            }
            case "group-items" -> {
                arity(rest, 2, "group-items <groupId>");
                printAll(views.groupItems(rest[1], rows -> { }), item ->
                        item.id() + "\t" + item.name() + "\t" + item.quantity());
            }
            case "groups" -> {
                arity(rest, 2, "groups <uid>");
                printAll(views.groupList(rest[1], rows -> { }), g -> g.groupId() + "\t" + g.name() + "\t" + g.role().storedName());
            }
            case "members" -> {
                arity(rest, 2, "members <groupId>");
                printAll(views.members(rest[1], rows -> { }), m ->
                        m.userId() + "\t" + m.email() + "\t" + m.role().storedName());
            }
            case "create-group" -> {
                if (rest.length < 3 || rest.length > 4) {
                    throw new CliException("create-group requires <ownerUid> <name> [description]");
                }
                var ref = Futures.await(groups.createGroup(rest[1], null, rest[2], rest.length == 4 ? rest[3] : null));
                out.println(ref.id());
            }
            case "add-member" -> {
                arity(rest, 4, "add-member <groupId> <userId> <email>");
                boolean indexed = Futures.await(groups.addMember(rest[1], rest[2], rest[3]));
                out.println(indexed ? "OK" : "OK (group index not updated)");
            }
            case "set-role" -> {
                arity(rest, 4, "set-role <groupId> <userId> <admin|member>");
                GroupRole role = GroupRole.parse(rest[3])
                        .orElseThrow(() -> new CliException("unknown role: " + rest[3]));
                Futures.await(groups.changeRole(rest[1], rest[2], role));
                out.println("OK");
            }
            case "remove-member" -> {
                arity(rest, 3, "remove-member <groupId> <userId>");
                Futures.await(groups.removeMember(rest[1], rest[2]));
                out.println("OK");
            }
            case "delete-group" -> {
                arity(rest, 2, "delete-group <groupId>");
                DeletionResult result = Futures.await(groups.deleteGroup(rest[1]));
                if (result instanceof DeletionResult.Failed failed) {
                    throw new IllegalStateException("delete failed after " + failed.commitsApplied()
                            + " commits: " + failed.cause().getMessage(), failed.cause());
                }
                out.println(result instanceof DeletionResult.Deleted d
                        ? "deleted " + d.operations() + " documents in " + d.commits() + " commits"
                        : "already deleted");
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    /** Page a session to the end, print its rows, then end it. */
    private <T> void printAll(PagedSession<T> session, Function<T, String> format) {
        try {
            PageOutcome outcome = Futures.await(session.startSession());
            while (outcome == PageOutcome.LOADED) {
                outcome = Futures.await(session.onNextPageNeeded());
            }
            List<String> lines = new ArrayList<>();
            for (T row : session.currentSnapshot()) {
                lines.add(format.apply(row));
            }
            if (lines.isEmpty()) {
                out.println("(none)");
            } else {
                lines.forEach(out::println);
            }
        } finally {
            session.endSession();
        }
    }

    private void close() {
        deletions.shutdown();
        store.close();
    }

    private static long parseQuantity(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CliException("quantity must be a number: " + raw);
        }
    }

    private static void arity(String[] rest, int expected, String usage) {
        if (rest.length != expected) {
            throw new CliException(rest[0] + " requires " + usage.substring(usage.indexOf(' ') + 1));
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException(args[i] + " requires a value");
        }
        return args[i + 1];
    }

    private static String usage() {
        return """
                Usage:
                  invsync-cli [--base-url http://host:port] [--config sync.json] <command> [args]

                Commands:
                  items <uid>
                  save-item <uid> <name> <quantity> [description]
                  group-items <groupId>
                  groups <uid>
                  members <groupId>
                  create-group <ownerUid> <name> [description]
                  add-member <groupId> <userId> <email>
                  set-role <groupId> <userId> <admin|member>
                  remove-member <groupId> <userId>
                  delete-group <groupId>
                """;
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
