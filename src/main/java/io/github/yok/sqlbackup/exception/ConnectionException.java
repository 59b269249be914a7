package io.github.yok.sqlbackup.exception;

import lombok.Getter;

/**
 * Raised when a session to the database server cannot be established.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConnectionException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    // host:port/database of the endpoint, never the credentials
    private final String target;

    /**
     * Creates an exception for the given endpoint.
     *
     * @param target endpoint description without credentials
     * @param cause underlying driver failure
     */
    public ConnectionException(String target, Throwable cause) {
        super(ErrorKind.CONNECTION, "Failed to connect to " + target + ": " + cause.getMessage(),
                cause);
        this.target = target;
    }
}
