package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Raised when streaming a table into the dump fails part way.
 *
 * <p>
 * {@link #getRowsEmitted()} is the number of rows of {@link #getTable()} that were already written
 * as complete insert statements before the failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DumpException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final long rowsEmitted;

    /**
     * Creates an exception for the given table.
     *
     * @param table table being dumped
     * @param rowsEmitted rows already emitted for the table
     * @param cause underlying cause
     */
    public DumpException(String table, long rowsEmitted, Throwable cause) {
        super(ErrorKind.DUMP, "Dump failed at table [" + table + "] after " + rowsEmitted
                + " rows: " + cause.getMessage(), cause);
        this.table = table;
        this.rowsEmitted = rowsEmitted;
    }
}
