package io.github.yok.sqlbackup.config;

import com.google.common.collect.ImmutableMap;
import io.github.yok.sqlbackup.exception.ConfigurationException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable description of the database a backup reads from or a restore writes to.
 *
 * <p>
 * Instances are created from a validated {@link ConnectionConfig.Entry} and handed to the engine
 * explicitly. {@link #toString()} never includes the password.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DatabaseEndpoint {

    /** Port used when an entry omits it. */
    public static final int DEFAULT_PORT = 3306;

    private static final String BASE_PARAMETERS =
            "?useUnicode=true&characterEncoding=UTF-8&tinyInt1isBit=false&yearIsDateType=false";

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String database;
    private final String driverClass;
    private final Map<String, String> properties;

    /**
     * Validates a connection entry and converts it to an endpoint.
     *
     * <p>
     * {@code host}, {@code user}, {@code password} and {@code database} are required. An empty
     * password is accepted; only an absent one is reported. All missing keys are reported at once,
     * sorted by name.
     * </p>
     *
     * @param entry connection entry
     * @return endpoint
     * @throws ConfigurationException when required keys are missing or the port is out of range
     */
    public static DatabaseEndpoint from(ConnectionConfig.Entry entry)
            throws ConfigurationException {
        if (entry == null) {
            throw new ConfigurationException("Connection entry is not configured.");
        }
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(entry.getDatabase())) {
            missing.add("database");
        }
        if (StringUtils.isBlank(entry.getHost())) {
            missing.add("host");
        }
        if (entry.getPassword() == null) {
            missing.add("password");
        }
        if (StringUtils.isBlank(entry.getUser())) {
            missing.add("user");
        }
        if (!missing.isEmpty()) {
            Collections.sort(missing);
            throw new ConfigurationException("Missing required connection settings for ["
                    + entry.getId() + "]: " + String.join(", ", missing), missing);
        }
        int port = entry.getPort() == null ? DEFAULT_PORT : entry.getPort();
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(
                    "Invalid port for [" + entry.getId() + "]: " + entry.getPort());
        }
        Map<String, String> props = entry.getProperties() == null ? ImmutableMap.of()
                : ImmutableMap.copyOf(entry.getProperties());
        return new DatabaseEndpoint(entry.getHost().trim(), port, entry.getUser(),
                entry.getPassword(), entry.getDatabase().trim(), entry.getDriverClass(), props);
    }

    /**
     * Returns the JDBC URL of this endpoint.
     *
     * <p>
     * The connection always requests UTF-8, and {@code TINYINT(1)} and {@code YEAR} columns are
     * read as plain numbers so their text can be replayed as-is. Extra properties are appended in
     * configuration order, percent-encoded so that {@code &}, {@code =} or spaces in a value
     * cannot split the query string.
     * </p>
     *
     * @return JDBC URL
     */
    public String toJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:mysql://").append(host).append(':')
                .append(port).append('/').append(database)
                .append(BASE_PARAMETERS);
        properties.forEach((k, v) -> url.append('&').append(encode(k)).append('=')
                .append(encode(v)));
        return url.toString();
    }

    // Connector/J keeps '+' literally, so spaces are sent as %20.
    private static String encode(String value) {
        return URLEncoder.encode(StringUtils.defaultString(value), StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    /**
     * Returns {@code host:port/database} for logs and error messages.
     *
     * @return endpoint description without credentials
     */
    public String describe() {
        return host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "DatabaseEndpoint[" + user + "@" + describe() + "]";
    }
}
