package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Raised when a backup or restore observes a cancellation request at a table boundary.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class OperationCancelledException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    // Number of tables fully processed before cancellation
    private final int completedTables;

    /**
     * Creates an exception.
     *
     * @param completedTables tables fully processed before the request was observed
     */
    public OperationCancelledException(int completedTables) {
        super(ErrorKind.CANCELLED,
                "Operation cancelled after " + completedTables + " completed tables");
        this.completedTables = completedTables;
    }
}
