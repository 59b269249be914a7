package io.github.yok.sqlbackup.db;

import java.sql.SQLException;

/**
 * Forward-only, lazily fetched sequence of rows.
 *
 * <p>
 * Implementations hold at most the current row in memory. {@link #close()} releases the
 * underlying statement even when the sequence was not fully consumed.
 * </p>
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Advances to the next row.
     *
     * @return the next row, or {@code null} when the sequence is exhausted
     * @throws SQLException if the read fails
     */
    RowTuple next() throws SQLException;

    /**
     * Releases the cursor.
     *
     * @throws SQLException if releasing the statement fails
     */
    @Override
    void close() throws SQLException;
}
