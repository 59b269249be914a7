package io.github.yok.sqlbackup.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Reports a backup file that could not be deleted during pruning.
 *
 * <p>
 * This kind is not fatal: instances are collected in the retention result instead of being thrown
 * out of a backup.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RetentionException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    /**
     * Creates an exception for the given file.
     *
     * @param path file that could not be deleted
     * @param cause underlying I/O failure
     */
    public RetentionException(Path path, Throwable cause) {
        super(ErrorKind.RETENTION, "Failed to delete expired backup " + path + ": "
                + cause.getMessage(), cause);
        this.path = path;
    }
}
