package de.bsommerfeld.artifactsync.launcher;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.artifactsync.core.util.StorageUtils;
import de.bsommerfeld.artifactsync.engine.CycleReport;
import de.bsommerfeld.artifactsync.engine.JobOutcome;
import de.bsommerfeld.artifactsync.engine.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point.
 *
 * <h3>Modes</h3>
 * <ul>
 * <li>default: poll until the process is stopped; a shutdown hook drains
 * running jobs within the configured grace period</li>
 * <li>{@code --once}: run a single cycle, exit non-zero if the catalog was
 * unavailable or a job failed</li>
 * <li>{@code --status}: print the ledger</li>
 * </ul>
 */
public final class SyncLauncher {

    static final String LOG_DIR_PROPERTY = "artifactsync.log.dir";

    static {
        // logback.xml reads this, so it must be set before the first logger
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, StorageUtils.getLogsDir(StorageUtils.APP_NAME).toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SyncLauncher.class);

    private SyncLauncher() {
    }

    public static void main(String[] args) {
        LaunchOptions options;
        try {
            options = LaunchOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(LaunchOptions.USAGE);
            System.exit(2);
            return;
        }

        Path appDataDir = StorageUtils.getAppDataDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(appDataDir);
        } catch (IOException e) {
            LOG.error("Cannot create application directory {}", appDataDir, e);
            System.exit(1);
            return;
        }
        Path configFile = options.configFile().orElse(appDataDir.resolve("config.toml"));

        Injector injector;
        try {
            injector = Guice.createInjector(new SyncModule(configFile, appDataDir));
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            System.exit(1);
            return;
        }

        int exitCode = run(options.mode(), injector);
        if (options.mode() != LaunchOptions.Mode.DAEMON) {
            System.exit(exitCode);
        }
        // the non-daemon scheduler thread keeps the process alive
    }

    static int run(LaunchOptions.Mode mode, Injector injector) {
        switch (mode) {
            case STATUS -> {
                injector.getInstance(StatusReport.class).render().forEach(System.out::println);
                return 0;
            }
            case ONCE -> {
                SyncScheduler scheduler = injector.getInstance(SyncScheduler.class);
                try {
                    CycleReport report = scheduler.runCycle();
                    return report.deferred() || report.count(JobOutcome.FAILED) > 0 ? 1 : 0;
                } finally {
                    scheduler.shutdown();
                }
            }
            default -> {
                SyncScheduler scheduler = injector.getInstance(SyncScheduler.class);
                Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown, "sync-shutdown"));
                scheduler.start();
                return 0;
            }
        }
    }
}
