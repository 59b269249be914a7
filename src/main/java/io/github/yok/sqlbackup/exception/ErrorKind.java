package io.github.yok.sqlbackup.exception;

/**
 * Closed set of failure categories reported by the engine.
 *
 * <p>
 * {@link #RETENTION} is the only non-fatal kind: it is collected into the retention result and
 * logged, while every other kind aborts the running operation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {

    /** Missing or invalid configuration, detected before any network call. */
    CONFIGURATION(true),

    /** Network or authentication failure while opening a session. */
    CONNECTION(true),

    /** Catalog metadata could not be read or is inconsistent. */
    INTROSPECTION(true),

    /** Reading rows or writing the dump failed mid-table. */
    DUMP(true),

    /** Replaying a dump statement failed. */
    RESTORE(true),

    /** Deleting an expired backup file failed. */
    RETENTION(false),

    /** The caller cancelled the operation at a table boundary. */
    CANCELLED(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * Returns whether this kind aborts the running operation.
     *
     * @return {@code true} for fatal kinds
     */
    public boolean isFatal() {
        return fatal;
    }
}
