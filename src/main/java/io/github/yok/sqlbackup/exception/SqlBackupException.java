package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Base type of every failure raised by the backup and restore engine.
 *
 * <p>
 * The {@link ErrorKind} tag lets callers branch on the failure category without inspecting the
 * concrete subclass.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class SqlBackupException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /**
     * Creates an exception with the given kind and message.
     *
     * @param kind failure category
     * @param message detail message
     */
    protected SqlBackupException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates an exception with the given kind, message and cause.
     *
     * @param kind failure category
     * @param message detail message
     * @param cause underlying cause
     */
    protected SqlBackupException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
