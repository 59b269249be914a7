package io.github.yok.sqlbackup.db;

import com.google.common.collect.ImmutableList;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RowCursor} over a streaming JDBC result set.
 *
 * <p>
 * Each column is read according to its {@link ValueKind}: {@code BINARY} through
 * {@link ResultSet#getBytes(int)}, everything else through {@link ResultSet#getString(int)} so
 * that temporal, decimal and floating-point values keep the server's exact text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JdbcRowCursor implements RowCursor {

    private final Statement statement;
    private final ResultSet resultSet;
    private final List<ValueKind> kinds;

    /**
     * Wraps an executed statement and its result set.
     *
     * @param statement statement owning the result set
     * @param resultSet result set positioned before the first row
     * @param kinds value kind of each selected column, in select order
     */
    public JdbcRowCursor(Statement statement, ResultSet resultSet, List<ValueKind> kinds) {
        this.statement = statement;
        this.resultSet = resultSet;
        this.kinds = ImmutableList.copyOf(kinds);
    }

    @Override
    public RowTuple next() throws SQLException {
        if (!resultSet.next()) {
            return null;
        }
        List<SqlValue> values = new ArrayList<>(kinds.size());
        for (int i = 0; i < kinds.size(); i++) {
            values.add(read(i + 1, kinds.get(i)));
        }
        return new RowTuple(values);
    }

    private SqlValue read(int columnIndex, ValueKind kind) throws SQLException {
        if (kind == ValueKind.BINARY) {
            byte[] bytes = resultSet.getBytes(columnIndex);
            return bytes == null ? SqlValue.nullValue() : SqlValue.ofBinary(bytes);
        }
        String text = resultSet.getString(columnIndex);
        if (text == null) {
            return SqlValue.nullValue();
        }
        return kind == ValueKind.NUMBER ? SqlValue.ofNumber(text) : SqlValue.ofString(text);
    }

    @Override
    public void close() throws SQLException {
        try {
            resultSet.close();
        } finally {
            statement.close();
        }
    }
}
