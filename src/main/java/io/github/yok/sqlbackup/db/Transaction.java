package io.github.yok.sqlbackup.db;

import java.sql.Connection;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * Scoped transaction on a {@link Session}.
 *
 * <p>
 * Use with try-with-resources: {@link #commit()} makes the work durable; closing without a commit
 * rolls it back. Auto-commit is restored on every path.
 * </p>
 *
 * <p>
 * MySQL commits DDL statements implicitly, so a rollback only undoes data changes made after the
 * last DDL statement of the transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Transaction implements AutoCloseable {

    private final Connection connection;
    private final boolean previousAutoCommit;
    private boolean completed;

    Transaction(Connection connection) throws SQLException {
        this.connection = connection;
        this.previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
    }

    /**
     * Commits the transaction.
     *
     * @throws SQLException if the commit fails (the transaction is then rolled back on close)
     */
    public void commit() throws SQLException {
        if (completed) {
            throw new IllegalStateException("Transaction already completed.");
        }
        connection.commit();
        completed = true;
    }

    /**
     * Returns whether {@link #commit()} succeeded.
     *
     * @return {@code true} once committed
     */
    public boolean isCommitted() {
        return completed;
    }

    /**
     * Rolls back uncommitted work and restores auto-commit.
     *
     * <p>
     * Rollback failures are logged at warn level so the original failure of the transaction body
     * stays the one that propagates.
     * </p>
     */
    @Override
    public void close() {
        try {
            if (!completed) {
                try {
                    connection.rollback();
                    log.warn("Transaction rolled back.");
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
                }
            }
        } finally {
            try {
                connection.setAutoCommit(previousAutoCommit);
            } catch (SQLException e) {
                log.warn("Failed to restore auto-commit: {}", e.getMessage(), e);
            }
        }
    }
}
