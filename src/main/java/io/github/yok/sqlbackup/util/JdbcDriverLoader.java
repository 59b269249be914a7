package io.github.yok.sqlbackup.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads a JDBC driver class named in a connection entry.
 *
 * <p>
 * Connector/J registers itself through JDBC 4 service loading, so the driver class is optional:
 * a blank value leaves registration to {@link java.sql.DriverManager}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class JdbcDriverLoader {

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the driver class only when a name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @return {@code true} if a class was loaded
     * @throws ClassNotFoundException when the named class is not on the class path
     */
    public static boolean loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return false;
        }
        Class.forName(driverClass.trim());
        log.debug("JDBC driver loaded: {}", driverClass);
        return true;
    }
}
