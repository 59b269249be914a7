package io.github.yok.sqlbackup.exception;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Raised when a connection entry or an invocation argument is missing or invalid.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConfigurationException extends SqlBackupException {

    private static final long serialVersionUID = 1L;

    // Missing configuration keys, sorted; empty when the failure is not about missing keys
    private final List<String> missingKeys;

    /**
     * Creates an exception for an invalid setting.
     *
     * @param message detail message
     */
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
        this.missingKeys = ImmutableList.of();
    }

    /**
     * Creates an exception listing missing configuration keys.
     *
     * @param message detail message
     * @param missingKeys keys that were absent or blank
     */
    public ConfigurationException(String message, List<String> missingKeys) {
        super(ErrorKind.CONFIGURATION, message);
        this.missingKeys = ImmutableList.copyOf(missingKeys);
    }
}
