package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Raised when schema metadata cannot be read or references an unknown table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class IntrospectionException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    // Table being introspected, or null when the failure concerns the whole catalog
    private final String table;

    /**
     * Creates an exception about an inconsistent table definition.
     *
     * @param table table name
     * @param message detail message
     */
    public IntrospectionException(String table, String message) {
        super(ErrorKind.INTROSPECTION, message);
        this.table = table;
    }

    /**
     * Creates an exception wrapping a metadata read failure.
     *
     * @param table table name, or {@code null}
     * @param message detail message
     * @param cause underlying cause
     */
    public IntrospectionException(String table, String message, Throwable cause) {
        super(ErrorKind.INTROSPECTION, message, cause);
        this.table = table;
    }
}
