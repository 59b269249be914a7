package io.github.yok.sqlbackup.util;

import io.github.yok.sqlbackup.exception.DumpException;
import io.github.yok.sqlbackup.exception.RestoreException;
import io.github.yok.sqlbackup.exception.SqlBackupException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Used by the command line where a failed backup or restore must end the run with a readable
 * reason.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error with its stack trace using SLF4J.</li>
 * <li>Writes a concise message to {@code System.err}; engine failures are prefixed with their
 * error kind and carry the failing table.</li>
 * <li>Does not terminate the JVM by itself (callers decide how to end the process).</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of ending the process" for the current thread (useful for
     * tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead (useful
     * for tests).
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead (useful
     * for tests).
     * </p>
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Builds the one-line description printed for a cause.
     *
     * @param cause failure
     * @return {@code [KIND] message (table=..)} for engine failures, the plain message otherwise
     */
    static String describe(Throwable cause) {
        if (!(cause instanceof SqlBackupException)) {
            return String.valueOf(cause.getMessage());
        }
        SqlBackupException e = (SqlBackupException) cause;
        StringBuilder sb = new StringBuilder("[").append(e.getKind()).append("] ")
                .append(e.getMessage());
        if (e instanceof DumpException) {
            DumpException de = (DumpException) e;
            sb.append(" (table=").append(de.getTable()).append(", rowsEmitted=")
                    .append(de.getRowsEmitted()).append(')');
        } else if (e instanceof RestoreException && ((RestoreException) e).getTable() != null) {
            RestoreException re = (RestoreException) e;
            sb.append(" (table=").append(re.getTable()).append(", statement=")
                    .append(re.getStatementIndex()).append(')');
        }
        return sb.toString();
    }
}
