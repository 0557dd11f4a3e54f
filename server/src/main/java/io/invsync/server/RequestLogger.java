package io.invsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging hook.
 *
 * One line per request with method, path, status and latency; 5xx responses
 * are logged at WARNING with their cause.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param storeMillis latency of the document store call, or -1 if none was made
     * @param error       failure behind the response, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storeMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storeMillis >= 0 ? ", store=" + storeMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.FINE, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
