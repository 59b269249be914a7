package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Raised when replaying a dump fails.
 *
 * <p>
 * {@link #getTable()} is {@code null} for failures outside any table section (missing file,
 * truncated file, session statements). {@link #getStatementIndex()} is the 1-based index of the
 * failing statement inside its section, or {@code 0} when no statement was involved.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RestoreException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final int statementIndex;

    /**
     * Creates an exception not tied to a statement.
     *
     * @param message detail message
     */
    public RestoreException(String message) {
        super(ErrorKind.RESTORE, message);
        this.table = null;
        this.statementIndex = 0;
    }

    /**
     * Creates an exception not tied to a statement.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public RestoreException(String message, Throwable cause) {
        super(ErrorKind.RESTORE, message, cause);
        this.table = null;
        this.statementIndex = 0;
    }

    /**
     * Creates an exception for a failing statement.
     *
     * @param table table section, or {@code null} for session statements
     * @param statementIndex 1-based index of the statement inside its section
     * @param cause underlying cause
     */
    public RestoreException(String table, int statementIndex, Throwable cause) {
        super(ErrorKind.RESTORE, "Restore failed at table [" + table + "] statement #"
                + statementIndex + ": " + cause.getMessage(), cause);
        this.table = table;
        this.statementIndex = statementIndex;
    }
}
