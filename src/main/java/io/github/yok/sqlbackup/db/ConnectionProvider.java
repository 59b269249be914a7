package io.github.yok.sqlbackup.db;

import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.exception.ConnectionException;
import io.github.yok.sqlbackup.util.JdbcDriverLoader;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens {@link Session}s against a MySQL/MariaDB endpoint.
 *
 * <p>
 * The optional driver class of the endpoint is loaded first; then a connection is opened through
 * {@link DriverManager} and prepared with {@link MySqlDialect#prepareSession(Connection)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ConnectionProvider {

    /**
     * Opens a session.
     *
     * @param endpoint target database
     * @return open session; the caller closes it
     * @throws ConnectionException if the driver is missing or the server rejects the connection
     */
    public Session open(DatabaseEndpoint endpoint) throws ConnectionException {
        try {
            JdbcDriverLoader.loadIfConfigured(endpoint.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new ConnectionException(endpoint.describe(), e);
        }
        Connection conn;
        try {
            conn = DriverManager.getConnection(endpoint.toJdbcUrl(), endpoint.getUser(),
                    endpoint.getPassword());
        } catch (SQLException e) {
            throw new ConnectionException(endpoint.describe(), e);
        }
        try {
            MySqlDialect.prepareSession(conn);
        } catch (SQLException e) {
            closeQuietly(conn);
            throw new ConnectionException(endpoint.describe(), e);
        }
        log.info("Connected to [{}] as [{}]", endpoint.describe(), endpoint.getUser());
        return new Session(conn, endpoint.getDatabase());
    }

    private void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage(), e);
        }
    }
}
