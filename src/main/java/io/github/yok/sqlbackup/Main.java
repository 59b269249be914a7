package io.github.yok.sqlbackup;

import io.github.yok.sqlbackup.config.BackupConfig;
import io.github.yok.sqlbackup.config.ConnectionConfig;
import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.core.BackupResult;
import io.github.yok.sqlbackup.core.CancellationToken;
import io.github.yok.sqlbackup.core.DatabaseBackup;
import io.github.yok.sqlbackup.core.RestoreEngine;
import io.github.yok.sqlbackup.core.RestoreResult;
import io.github.yok.sqlbackup.db.ConnectionProvider;
import io.github.yok.sqlbackup.exception.SqlBackupException;
import io.github.yok.sqlbackup.util.ErrorHandler;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and invokes {@link DatabaseBackup} or {@link RestoreEngine}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --backup} or {@code -b} enables <em>backup</em> mode.</li>
 * <li>{@code --restore}, {@code --push} or {@code -r} enables <em>restore</em> mode.</li>
 * <li>{@code --config <id>} or {@code -c <id>} selects the connection entry of
 * {@code application.yml}. It may be omitted when exactly one entry is configured.</li>
 * <li>{@code --path <file>} or {@code -p <file>} is the dump file (required).</li>
 * <li>{@code --incremental <N>} or {@code -i <N>} writes a timestamped backup and keeps the
 * {@code N} newest ones (backup mode only).</li>
 * <li>{@code --batch-size <n>} overrides {@code backup.batch-size}.</li>
 * </ul>
 *
 * <p>
 * The process exits with {@code 0} on success and {@code 1} on any failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see BackupConfig
 * @see ConnectionConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, BackupConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConnectionConfig connectionConfig;
    private final BackupConfig backupConfig;
    private final ConnectionProvider connectionProvider;

    private int exitCode;

    /**
     * Bootstraps the application and ends the JVM with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String connectionId = null;
        String path = null;
        String incremental = null;
        String batchSize = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--backup":
                case "-b":
                    mode = "backup";
                    break;
                case "--restore":
                case "--push":
                case "-r":
                    mode = "restore";
                    break;
                case "--config":
                case "-c":
                    connectionId = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--path":
                case "-p":
                    path = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--incremental":
                case "-i":
                    incremental = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--batch-size":
                    batchSize = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        // Validate
        if (mode == null) {
            fail("Either --backup or --restore must be specified.");
            return;
        }
        if (StringUtils.isBlank(path)) {
            fail("--path is required.");
            return;
        }
        if (incremental != null && "restore".equals(mode)) {
            fail("--incremental can only be used with --backup.");
            return;
        }
        Integer keep = null;
        if (incremental != null) {
            keep = parsePositive(incremental, "--incremental");
            if (keep == null) {
                return;
            }
        }
        if (batchSize != null) {
            Integer size = parsePositive(batchSize, "--batch-size");
            if (size == null) {
                return;
            }
            backupConfig.setBatchSize(size);
        }
        if (connectionId == null) {
            List<ConnectionConfig.Entry> entries = connectionConfig.getConnections();
            if (entries == null || entries.size() != 1) {
                fail("--config is required when zero or several connections are configured.");
                return;
            }
            connectionId = entries.get(0).getId();
        }

        log.info("Mode: {}, Connection: {}, Path: {}, Incremental: {}", mode, connectionId, path,
                keep);

        // Execute
        try {
            DatabaseEndpoint endpoint =
                    DatabaseEndpoint.from(connectionConfig.getEntry(connectionId));
            if ("backup".equals(mode)) {
                BackupResult result = new DatabaseBackup(connectionProvider, backupConfig,
                        Clock.systemUTC()).backup(connectionId, endpoint, Path.of(path), keep,
                                CancellationToken.NONE);
                log.info("Backup written: {} (tables={})", result.getBackupFile().getPath(),
                        result.getRowCounts().size());
                if (result.getRetention() != null && result.getRetention().hasFailures()) {
                    log.warn("Retention finished with {} failures",
                            result.getRetention().getFailures().size());
                }
            } else {
                BackupConfig.Restore restore = backupConfig.getRestore();
                RestoreResult result = new RestoreEngine(connectionProvider,
                        restore.getTransactionScope(), restore.isAllowTruncated())
                                .restore(connectionId, endpoint, Path.of(path),
                                        CancellationToken.NONE);
                log.info("Restore finished: tables={}", result.getTableCount());
            }
            exitCode = 0;
        } catch (SqlBackupException e) {
            exitCode = 1;
            log.error("Fatal error occurred (mode={}, kind={}): {}", mode, e.getKind(),
                    e.getMessage());
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Integer parsePositive(String value, String option) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= 1) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            log.debug("Invalid number for {}: {}", option, value);
        }
        fail(option + " requires a positive integer: " + value);
        return null;
    }

    private void fail(String message) {
        exitCode = 1;
        ErrorHandler.errorAndExit(message);
    }
}
