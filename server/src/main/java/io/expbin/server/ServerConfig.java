// file: server/src/main/java/io/expbin/server/ServerConfig.java
package io.expbin.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:            HTTP API port
 *  - walDir:              directory for WAL segments
 *  - snapDir:             directory for snapshots
 *  - snapshotEvery:       committed writes between two checkpoints
 *  - walRotateBytes:      WAL segment size that triggers rotation
 *  - sweepThreads:        worker threads running clean passes
 *  - sweepTimeoutSeconds: default budget of a clean pass
 */
public record ServerConfig(
        int httpPort,
        String walDir,
        String snapDir,
        int snapshotEvery,
        long walRotateBytes,
        int sweepThreads,
        long sweepTimeoutSeconds
) {

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65_535) throw new IllegalArgumentException("http-port out of range: " + httpPort);
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("wal-rotate-bytes must be > 0");
        if (sweepThreads <= 0) throw new IllegalArgumentException("sweep-threads must be > 0");
        if (sweepTimeoutSeconds <= 0) throw new IllegalArgumentException("sweep-timeout-seconds must be > 0");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, "./data/wal", "./data/snap", 50_000, 64L * 1024 * 1024, 2, 3_600);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --wal,       -w   <path>
     *   --snap,      -s   <path>
     *   --snapshot-every  <writes>
     *   --wal-rotate-bytes <bytes>
     *   --sweep-threads   <n>
     *   --sweep-timeout-seconds <seconds>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     * Bad input raises IllegalArgumentException; Main turns it into exit code 1.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        String wal = d.walDir();
        String snap = d.snapDir();
        int snapshotEvery = d.snapshotEvery();
        long walRotateBytes = d.walRotateBytes();
        int sweepThreads = d.sweepThreads();
        long sweepTimeoutSeconds = d.sweepTimeoutSeconds();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> throw new HelpRequested();
                case "--http-port", "-p" -> httpPort = parseInt(args, ++i, "http-port");
                case "--wal", "-w" -> wal = value(args, ++i);
                case "--snap", "-s" -> snap = value(args, ++i);
                case "--snapshot-every" -> snapshotEvery = parseInt(args, ++i, "snapshot-every");
                case "--wal-rotate-bytes" -> walRotateBytes = parseLong(args, ++i, "wal-rotate-bytes");
                case "--sweep-threads" -> sweepThreads = parseInt(args, ++i, "sweep-threads");
                case "--sweep-timeout-seconds" -> sweepTimeoutSeconds = parseLong(args, ++i, "sweep-timeout-seconds");
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(httpPort, wal, snap, snapshotEvery, walRotateBytes, sweepThreads, sweepTimeoutSeconds);
    }

    public static String usage() {
        return """
            Usage: expbin-server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --wal,            -w   WAL directory (default: ./data/wal)
              --snap,           -s   Snapshot directory (default: ./data/snap)
              --snapshot-every       Writes between checkpoints (default: 50000)
              --wal-rotate-bytes     WAL segment size in bytes (default: 67108864)
              --sweep-threads        Clean pass worker threads (default: 2)
              --sweep-timeout-seconds Default clean pass budget (default: 3600)
              --help,           -h   Show this help message
            """;
    }

    /** Raised by fromArgs when --help is given. */
    public static final class HelpRequested extends RuntimeException {
        public HelpRequested() {
            super("help requested");
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i - 1]);
        }
        return args[i];
    }

    private static int parseInt(String[] args, int i, String name) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + v, e);
        }
    }

    private static long parseLong(String[] args, int i, String name) {
        String v = value(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + v, e);
        }
    }
}
