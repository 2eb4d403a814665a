// file: server/src/main/java/io/expbin/server/Main.java
package io.expbin.server;

import io.expbin.server.sweep.SweepCoordinator;
import io.expbin.storage.DurableRecordStore;
import io.expbin.storage.FileSnapshotter;
import io.expbin.storage.FileWal;
import io.expbin.storage.SnapshotPolicy;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for an expiring-bin server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire together storage components (WAL, snapshots, DurableRecordStore).
 *  - Create FieldAccessor, SweepCoordinator and ExpireBinService.
 *  - Start the HTTP server and register a shutdown hook.
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
        } catch (ServerConfig.HelpRequested help) {
            System.out.println(ServerConfig.usage());
            return;
        } catch (IllegalArgumentException bad) {
            System.err.println(bad.getMessage());
            System.err.println(ServerConfig.usage());
            System.exit(1);
            return;
        }

        Clock clock = Clock.systemUTC();

        // ------ Storage Layer -------
        var wal = new FileWal(Path.of(cfg.walDir()), cfg.walRotateBytes());
        var snaps = new FileSnapshotter(Path.of(cfg.snapDir()));
        var store = new DurableRecordStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()), clock);

        // ------ Engine ------
        var fields = new FieldAccessor(store, clock);
        var sweeps = new SweepCoordinator(store, clock, cfg.sweepThreads(),
                Duration.ofSeconds(cfg.sweepTimeoutSeconds()));
        var service = new ExpireBinService(store, fields, sweeps);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service);
        web.start();

        System.out.printf("ExpireBin listening on http://%s:%d (wal=%s, snap=%s)%n",
                "localhost", web.port(), cfg.walDir(), cfg.snapDir());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                sweeps.close();
                store.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }, "expbin-shutdown"));
    }
}
