package io.github.yok.sqlbackup.core;

import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.config.TransactionScope;
import io.github.yok.sqlbackup.db.ConnectionProvider;
import io.github.yok.sqlbackup.db.Session;
import io.github.yok.sqlbackup.db.Transaction;
import io.github.yok.sqlbackup.exception.RestoreException;
import io.github.yok.sqlbackup.exception.SqlBackupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Replays a dump file against a target database.
 *
 * <p>
 * <strong>Transaction handling:</strong>
 * </p>
 * <ul>
 * <li>Session statements ({@code SET ...}) run outside table transactions.</li>
 * <li>{@link TransactionScope#TABLE}: each table section runs in its own transaction, committed
 * when the next section (or the end of the file) is reached.</li>
 * <li>{@link TransactionScope#FILE}: one transaction spans every table section and is committed at
 * the end of the file.</li>
 * <li>The first failing statement rolls back the open transaction and aborts the restore; later
 * tables are not attempted.</li>
 * </ul>
 *
 * <p>
 * MySQL commits {@code DROP TABLE} and {@code CREATE TABLE} implicitly, so after a rollback the
 * failed table exists with whatever rows were inserted before its last DDL statement, which for a
 * dump written by this tool means none.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RestoreEngine {

    private final ConnectionProvider connectionProvider;
    private final TransactionScope transactionScope;
    private final boolean allowTruncated;

    /**
     * Creates a restore engine.
     *
     * @param connectionProvider session factory
     * @param transactionScope transaction boundary
     * @param allowTruncated whether dumps without the completion trailer may be replayed
     */
    public RestoreEngine(ConnectionProvider connectionProvider, TransactionScope transactionScope,
            boolean allowTruncated) {
        this.connectionProvider = connectionProvider;
        this.transactionScope = transactionScope;
        this.allowTruncated = allowTruncated;
    }

    /**
     * Restores a dump file.
     *
     * @param connectionId logical ID of the target connection (for logs)
     * @param endpoint target database
     * @param path dump file
     * @param token cancellation token checked before each table section
     * @return executed statement counts
     * @throws SqlBackupException if the file is missing or truncated, the connection fails, a
     *         statement fails or the restore is cancelled
     */
    public RestoreResult restore(String connectionId, DatabaseEndpoint endpoint, Path path,
            CancellationToken token) throws SqlBackupException {
        String displayPath = FilenameUtils.separatorsToUnix(path.toString());
        if (!Files.isRegularFile(path)) {
            throw new RestoreException("Backup file not found: " + displayPath);
        }
        boolean complete;
        try {
            complete = DumpReader.isComplete(path);
        } catch (IOException e) {
            throw new RestoreException("Failed to read backup file: " + displayPath, e);
        }
        if (!complete) {
            if (!allowTruncated) {
                throw new RestoreException("Backup file is truncated (no completion trailer): "
                        + displayPath);
            }
            log.warn("[{}] Backup file is truncated; restoring complete statements only: {}",
                    connectionId, displayPath);
        }

        log.info("[{}] === Restore started: {} -> {} (scope={}) ===", connectionId, displayPath,
                endpoint.describe(), transactionScope);
        RestoreResult result;
        try (Session session = connectionProvider.open(endpoint);
                DumpReader reader = DumpReader.open(path)) {
            result = replay(connectionId, session, reader, token, !complete);
        } catch (IOException e) {
            throw new RestoreException("Failed to read backup file: " + displayPath, e);
        } catch (SQLException e) {
            throw new RestoreException("Failed to close session: " + e.getMessage(), e);
        }
        log.info("[{}] === Restore completed: tables={}, statements={} ===", connectionId,
                result.getTableCount(),
                result.getStatementCounts().values().stream().mapToInt(Integer::intValue).sum()
                        + result.getSessionStatements());
        return result;
    }

    private RestoreResult replay(String connectionId, Session session, DumpReader reader,
            CancellationToken token, boolean truncated) throws SqlBackupException, IOException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int sessionStatements = 0;
        int completedTables = 0;
        String currentTable = null;
        Transaction tx = null;
        try {
            DumpStatement st;
            while ((st = reader.next()) != null) {
                if (st.getTable() == null) {
                    // --- Statement outside a table section ---
                    if (tx != null && transactionScope == TransactionScope.TABLE) {
                        commit(tx, currentTable, counts.get(currentTable));
                        tx = null;
                        completedTables++;
                        log.info("[{}] Table[{}] restored (statements={})", connectionId,
                                currentTable, counts.get(currentTable));
                        currentTable = null;
                    }
                    execute(session, st, null);
                    sessionStatements++;
                    continue;
                }

                if (!st.getTable().equals(currentTable)) {
                    // --- Table boundary ---
                    if (tx != null && transactionScope == TransactionScope.TABLE) {
                        commit(tx, currentTable, counts.get(currentTable));
                        tx = null;
                        log.info("[{}] Table[{}] restored (statements={})", connectionId,
                                currentTable, counts.get(currentTable));
                    }
                    if (currentTable != null) {
                        completedTables++;
                    }
                    token.throwIfCancelled(completedTables);
                    if (tx == null) {
                        tx = begin(session, st.getTable());
                    }
                    currentTable = st.getTable();
                    counts.putIfAbsent(currentTable, 0);
                }
                execute(session, st, currentTable);
                counts.merge(currentTable, 1, Integer::sum);
            }

            if (tx != null) {
                commit(tx, currentTable, counts.getOrDefault(currentTable, 0));
                tx = null;
                if (transactionScope == TransactionScope.TABLE) {
                    log.info("[{}] Table[{}] restored (statements={})", connectionId,
                            currentTable, counts.get(currentTable));
                } else {
                    log.info("[{}] Transaction committed (tables={})", connectionId,
                            counts.size());
                }
            }
        } finally {
            if (tx != null) {
                log.warn("[{}] Rolling back table [{}]", connectionId, currentTable);
                tx.close();
            }
        }
        return new RestoreResult(counts, sessionStatements, truncated || reader.isTruncated());
    }

    private Transaction begin(Session session, String table) throws RestoreException {
        try {
            return session.beginTransaction();
        } catch (SQLException e) {
            throw new RestoreException(table, 0, e);
        }
    }

    private void commit(Transaction tx, String table, int statements) throws RestoreException {
        try {
            tx.commit();
        } catch (SQLException e) {
            throw new RestoreException(table, statements, e);
        } finally {
            if (tx.isCommitted()) {
                tx.close();
            }
        }
    }

    private void execute(Session session, DumpStatement st, String table)
            throws RestoreException {
        try {
            session.execute(st.getSql());
        } catch (SQLException e) {
            log.error("Statement #{} of table [{}] failed at line {}: {}", st.getIndex(), table,
                    st.getLineNumber(), e.getMessage());
            throw new RestoreException(table, st.getIndex(), e);
        }
    }
}
