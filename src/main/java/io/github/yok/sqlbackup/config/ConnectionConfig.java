package io.github.yok.sqlbackup.config;

import io.github.yok.sqlbackup.exception.ConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages DB connection settings loaded from {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: db1
 *     host: localhost
 *     port: 3306
 *     user: backup
 *     password: secret
 *     database: appdb
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * Returns the entry registered under the given logical ID.
     *
     * @param id logical connection ID
     * @return matching entry
     * @throws ConfigurationException when no entry has the ID
     */
    public Entry getEntry(String id) throws ConfigurationException {
        if (connections == null || connections.isEmpty()) {
            throw new ConfigurationException("No connections are configured.");
        }
        for (Entry entry : connections) {
            if (entry != null && id != null && id.equals(entry.getId())) {
                return entry;
            }
        }
        String known = connections.stream().map(Entry::getId).collect(Collectors.joining(", "));
        throw new ConfigurationException(
                "Unknown connection id [" + id + "]. Configured: [" + known + "]");
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "db1")
        private String id;
        // Server host name
        private String host;
        // Server port (3306 when omitted)
        private Integer port;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Database (schema) to back up or restore into
        private String database;
        // Fully qualified JDBC driver class name; JDBC 4 auto-loading is used when blank
        private String driverClass;
        // Extra JDBC URL parameters appended to the connection URL
        private Map<String, String> properties;
    }
}
