package io.github.yok.sqlbackup.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A live connection to one database, used by one operation at a time.
 *
 * <p>
 * A session holds exactly one JDBC connection. {@link #close()} releases it unconditionally.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Session implements AutoCloseable {

    /**
     * Maps the current row of a result set to a value.
     *
     * @param <T> mapped type
     */
    @FunctionalInterface
    public interface RowMapper<T> {

        /**
         * Maps the current row.
         *
         * @param rs result set positioned on a row
         * @return mapped value
         * @throws SQLException if a column cannot be read
         */
        T map(ResultSet rs) throws SQLException;
    }

    private final Connection connection;

    @Getter
    private final String database;

    /**
     * Wraps an open connection.
     *
     * @param connection open JDBC connection
     * @param database database (schema) the connection works on
     */
    public Session(Connection connection, String database) {
        this.connection = connection;
        this.database = database;
    }

    /**
     * Executes one statement.
     *
     * @param sql statement text without terminator
     * @return affected row count, or {@code 0} for statements without one
     * @throws SQLException if execution fails
     */
    public int execute(String sql) throws SQLException {
        try (Statement st = connection.createStatement()) {
            boolean hasResultSet = st.execute(sql);
            if (hasResultSet) {
                return 0;
            }
            return Math.max(st.getUpdateCount(), 0);
        }
    }

    /**
     * Runs a parameterized query and maps every row.
     *
     * @param <T> mapped type
     * @param sql query text with {@code ?} placeholders
     * @param params placeholder values, bound as strings in order
     * @param mapper row mapper
     * @return mapped rows in result order
     * @throws SQLException if the query fails
     */
    public <T> List<T> query(String sql, List<String> params, RowMapper<T> mapper)
            throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setString(i + 1, params.get(i));
            }
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        }
    }

    /**
     * Opens a forward-only, read-only cursor that streams rows from the server.
     *
     * <p>
     * No other statement may be issued on this session until the cursor is closed.
     * </p>
     *
     * @param selectSql select statement
     * @param kinds value kind of each selected column, in select order
     * @return row cursor; the caller closes it
     * @throws SQLException if the query cannot be started
     */
    public RowCursor streamingCursor(String selectSql, List<ValueKind> kinds)
            throws SQLException {
        Statement st = connection.createStatement(ResultSet.TYPE_FORWARD_ONLY,
                ResultSet.CONCUR_READ_ONLY);
        try {
            st.setFetchSize(MySqlDialect.STREAMING_FETCH_SIZE);
            ResultSet rs = st.executeQuery(selectSql);
            return new JdbcRowCursor(st, rs, kinds);
        } catch (SQLException e) {
            st.close();
            throw e;
        }
    }

    /**
     * Starts a scoped transaction.
     *
     * @return transaction to be closed by the caller
     * @throws SQLException if auto-commit cannot be switched off
     */
    public Transaction beginTransaction() throws SQLException {
        return new Transaction(connection);
    }

    /**
     * Releases the connection.
     *
     * @throws SQLException if closing the connection fails
     */
    @Override
    public void close() throws SQLException {
        log.debug("Closing session for database [{}]", database);
        connection.close();
    }
}
