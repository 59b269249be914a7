package io.github.yok.sqlbackup.core;

import io.github.yok.sqlbackup.config.BackupConfig;
import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.db.ConnectionProvider;
import io.github.yok.sqlbackup.db.Session;
import io.github.yok.sqlbackup.exception.ConfigurationException;
import io.github.yok.sqlbackup.exception.DumpException;
import io.github.yok.sqlbackup.exception.SqlBackupException;
import io.github.yok.sqlbackup.schema.DdlEmitter;
import io.github.yok.sqlbackup.schema.SchemaIntrospector;
import io.github.yok.sqlbackup.schema.TableSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Writes a complete dump of one database.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Resolve the output path (timestamped sibling for incremental backups) and refuse to overwrite
 * an existing file.</li>
 * <li>Open a session, introspect the schema and order the tables parent-first.</li>
 * <li>Write the header, then per table its drop and create statements followed by its data.</li>
 * <li>Write the epilogue, then prune older incremental backups.</li>
 * </ol>
 *
 * <p>
 * A failure leaves the partially written file on disk for inspection; every complete table
 * section in it is replayable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DatabaseBackup {

    private final ConnectionProvider connectionProvider;
    private final BackupConfig backupConfig;
    private final SchemaIntrospector introspector;
    private final DdlEmitter ddlEmitter;
    private final DataDumper dataDumper;
    private final RetentionManager retentionManager;
    private final Clock clock;

    /**
     * Creates a backup runner from the backup settings.
     *
     * @param connectionProvider session factory
     * @param backupConfig backup settings
     * @param clock clock used for timestamps
     */
    public DatabaseBackup(ConnectionProvider connectionProvider, BackupConfig backupConfig,
            Clock clock) {
        this(connectionProvider, backupConfig,
                new SchemaIntrospector(backupConfig.getExcludeTables()), new DdlEmitter(),
                new DataDumper(backupConfig.getBatchSize()),
                new RetentionManager(backupConfig.getTimestampPattern(), clock), clock);
    }

    DatabaseBackup(ConnectionProvider connectionProvider, BackupConfig backupConfig,
            SchemaIntrospector introspector, DdlEmitter ddlEmitter, DataDumper dataDumper,
            RetentionManager retentionManager, Clock clock) {
        this.connectionProvider = connectionProvider;
        this.backupConfig = backupConfig;
        this.introspector = introspector;
        this.ddlEmitter = ddlEmitter;
        this.dataDumper = dataDumper;
        this.retentionManager = retentionManager;
        this.clock = clock;
    }

    /**
     * Backs up a database.
     *
     * @param connectionId logical ID of the source connection (for logs and the result)
     * @param endpoint source database
     * @param outputPath dump file, or the base name of incremental backups
     * @param keep number of incremental backups to keep; {@code null} for a plain backup
     * @param token cancellation token checked before each table
     * @return written file, per-table row counts and pruning outcome
     * @throws SqlBackupException on configuration, connection, introspection or dump failure, or
     *         on cancellation
     */
    public BackupResult backup(String connectionId, DatabaseEndpoint endpoint, Path outputPath,
            Integer keep, CancellationToken token) throws SqlBackupException {
        if (keep != null && keep < 1) {
            throw new ConfigurationException("Incremental keep count must be >= 1: " + keep);
        }
        Path target = keep == null ? outputPath
                : retentionManager.resolveIncrementalPath(outputPath);
        prepareTarget(target);
        log.info("[{}] === Backup started: {} -> {} ===", connectionId, endpoint.describe(),
                FilenameUtils.separatorsToUnix(target.toString()));

        Instant startedAt = clock.instant();
        Map<String, Long> summary = new LinkedHashMap<>();
        try (Session session = connectionProvider.open(endpoint)) {
            List<TableSchema> tables = introspector.introspect(session);
            writeDump(connectionId, session, tables, target, startedAt, summary, token);
        } catch (SQLException e) {
            // Only Session.close() throws SQLException here; the dump itself is complete.
            log.warn("[{}] Failed to close session: {}", connectionId, e.getMessage(), e);
        }
        logTableSummary(connectionId, summary);

        RetentionResult retention = null;
        if (keep != null) {
            retention = retentionManager.prune(outputPath, keep);
        }
        log.info("[{}] === Backup completed: {} ===", connectionId,
                FilenameUtils.separatorsToUnix(target.toString()));
        return new BackupResult(new BackupFile(target, connectionId, startedAt), summary,
                retention);
    }

    private void writeDump(String connectionId, Session session, List<TableSchema> tables,
            Path target, Instant startedAt, Map<String, Long> summary, CancellationToken token)
            throws SqlBackupException {
        String currentTable = null;
        long rowsInTable = 0;
        try (DumpWriter writer = new DumpWriter(target)) {
            writer.writeHeader(session.getDatabase(), startedAt);
            for (TableSchema table : tables) {
                token.throwIfCancelled(summary.size());
                currentTable = table.getName();
                rowsInTable = 0;

                // --- 1) DDL ---
                writer.beginTable(table.getName());
                if (backupConfig.isDropTableBeforeCreate()) {
                    writer.accept(DumpStatement.of(StatementKind.DDL, table.getName(),
                            ddlEmitter.emitDrop(table)));
                }
                writer.accept(DumpStatement.of(StatementKind.DDL, table.getName(),
                        ddlEmitter.emit(table)));

                // --- 2) Data ---
                TableDumpResult result = dataDumper.dump(session, table, writer);
                rowsInTable = result.getRowCount();
                writer.endTable();

                summary.put(table.getName(), result.getRowCount());
                log.info("[{}] Table[{}] dumped-records={}, statements={}", connectionId,
                        table.getName(), result.getRowCount(), result.getBatchCount());
            }
            writer.writeFooter(clock.instant());
        } catch (IOException e) {
            // Writer failures outside DataDumper (DDL, markers, footer).
            throw new DumpException(currentTable == null ? "<header>" : currentTable,
                    rowsInTable, e);
        }
    }

    private void prepareTarget(Path target) throws ConfigurationException {
        if (Files.exists(target)) {
            throw new ConfigurationException("Backup file already exists: " + target);
        }
        Path parent = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "Failed to create backup directory: " + parent + " (" + e.getMessage() + ")");
        }
    }

    /**
     * Logs the per-table row counts as an aligned table.
     *
     * @param connectionId logical connection ID
     * @param tableCountMap rows per table, in dump order
     */
    private void logTableSummary(String connectionId, Map<String, Long> tableCountMap) {
        log.info("===== Summary =====");
        log.info("DB[{}]:", connectionId);
        int maxNameLen = tableCountMap.keySet().stream().mapToInt(String::length).max().orElse(0);
        int maxCountDigits = tableCountMap.values().stream()
                .mapToInt(count -> String.valueOf(count).length()).max().orElse(0);
        if (tableCountMap.isEmpty()) {
            return;
        }
        String fmt = "  Table[%-" + maxNameLen + "s] Total=%" + maxCountDigits + "d";
        tableCountMap.forEach((table, count) -> log.info(String.format(fmt, table, count)));
    }
}
