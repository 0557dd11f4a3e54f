package io.invsync.server;

/**
 * Server configuration parsed from CLI args.
 *
 *  - httpPort:         HTTP API port
 *  - dedupeTtlSeconds: how long commit opIds are remembered for retries
 *  - eventThreads:     threads delivering subscription events
 */
public record ServerConfig(
        int httpPort,
        long dedupeTtlSeconds,
        int eventThreads
) {

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("invalid port: " + httpPort);
        }
        if (dedupeTtlSeconds <= 0) {
            throw new IllegalArgumentException("dedupe TTL must be > 0");
        }
        if (eventThreads <= 0) {
            throw new IllegalArgumentException("event threads must be > 0");
        }
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --port, -p <port>
     *   --dedupe-ttl-seconds <seconds>
     *   --event-threads <n>
     *   --help, -h
     *
     * All flags are optional.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        long dedupeTtlSeconds = 600;
        int eventThreads = 2;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[++i], "port");
                }

                case "--dedupe-ttl-seconds" -> {
                    ensureValue(args, i);
                    dedupeTtlSeconds = parseInt(args[++i], "dedupe-ttl-seconds");
                }

                case "--event-threads" -> {
                    ensureValue(args, i);
                    eventThreads = parseInt(args[++i], "event-threads");
                }

                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }
        return new ServerConfig(httpPort, dedupeTtlSeconds, eventThreads);
    }

    private static int parseInt(String raw, String option) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + option + ": " + raw, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for option: " + args[i]);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --port,           -p   HTTP port (default: 8080)
              --dedupe-ttl-seconds    TTL for commit opId deduplication (default: 600)
              --event-threads         Subscription event threads (default: 2)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
