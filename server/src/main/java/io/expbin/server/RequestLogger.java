// file: server/src/main/java/io/expbin/server/RequestLogger.java
package io.expbin.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging hook.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - 5xx answers are logged at WARNING with their cause; everything else at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method (GET, PUT, POST, DELETE)
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param engineMillis  time spent in ExpireBinService, or -1 if it was not reached
     * @param error         exception behind an error answer, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                engineMillis >= 0 ? ", engine=" + engineMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null && log.isLoggable(Level.FINE)) {
            log.log(Level.FINE, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
