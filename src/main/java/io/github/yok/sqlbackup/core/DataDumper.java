package io.github.yok.sqlbackup.core;

import com.google.common.base.Preconditions;
import io.github.yok.sqlbackup.db.MySqlDialect;
import io.github.yok.sqlbackup.db.RowCursor;
import io.github.yok.sqlbackup.db.RowTuple;
import io.github.yok.sqlbackup.db.Session;
import io.github.yok.sqlbackup.db.SqlValue;
import io.github.yok.sqlbackup.db.ValueKind;
import io.github.yok.sqlbackup.exception.DumpException;
import io.github.yok.sqlbackup.schema.Column;
import io.github.yok.sqlbackup.schema.TableSchema;
import java.io.IOException;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams the rows of a table into batched insert statements.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Read rows through a forward-only streaming cursor, so memory is bounded by one batch
 * whatever the table size.</li>
 * <li>Select the dumped columns explicitly in ordinal order, ordered by the primary key when the
 * table has one, so every value lands in its own column on replay.</li>
 * <li>Emit one {@code INSERT INTO t (cols) VALUES (...),(...)} per full batch and one for the final
 * partial batch: a table with {@code R} rows and batch size {@code B} yields {@code ceil(R/B)}
 * statements.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataDumper {

    private final int batchSize;

    /**
     * Creates a dumper.
     *
     * @param batchSize maximum rows per insert statement, at least 1
     */
    public DataDumper(int batchSize) {
        Preconditions.checkArgument(batchSize >= 1, "batch size must be >= 1: %s", batchSize);
        this.batchSize = batchSize;
    }

    /**
     * Dumps all rows of a table.
     *
     * @param session open session on the source database
     * @param table table definition
     * @param sink receiver of the insert statements
     * @return row and statement counts
     * @throws DumpException if reading or writing fails; the exception carries the number of rows
     *         already emitted
     */
    public TableDumpResult dump(Session session, TableSchema table, StatementSink sink)
            throws DumpException {
        List<Column> columns = table.getDumpColumns();
        if (columns.isEmpty()) {
            log.warn("Table[{}] has no insertable columns; data skipped", table.getName());
            return new TableDumpResult(0, 0);
        }
        List<ValueKind> kinds = columns.stream().map(c -> MySqlDialect.classify(c.getDataType()))
                .collect(Collectors.toList());
        String insertHead = insertHead(table.getName(), columns);

        long rowsEmitted = 0;
        int batches = 0;
        RowBatch batch = new RowBatch(batchSize);
        try (RowCursor cursor = session.streamingCursor(selectSql(table, columns), kinds)) {
            RowTuple row;
            while ((row = cursor.next()) != null) {
                batch.add(row);
                if (batch.isFull()) {
                    sink.accept(toStatement(table.getName(), insertHead, batch));
                    rowsEmitted += batch.size();
                    batches++;
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                sink.accept(toStatement(table.getName(), insertHead, batch));
                rowsEmitted += batch.size();
                batches++;
                batch.clear();
            }
        } catch (SQLException | IOException e) {
            throw new DumpException(table.getName(), rowsEmitted, e);
        }
        log.debug("Table[{}] rows={}, statements={}", table.getName(), rowsEmitted, batches);
        return new TableDumpResult(rowsEmitted, batches);
    }

    /**
     * Builds the select statement reading the dumped columns.
     *
     * @param table table definition
     * @param columns dumped columns in ordinal order
     * @return select statement
     */
    String selectSql(TableSchema table, List<Column> columns) {
        StringBuilder sb = new StringBuilder("SELECT ").append(columnList(columns))
                .append(" FROM ").append(MySqlDialect.quoteIdentifier(table.getName()));
        if (!table.getPrimaryKey().isEmpty()) {
            sb.append(" ORDER BY ").append(table.getPrimaryKey().stream()
                    .map(MySqlDialect::quoteIdentifier).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    private String insertHead(String table, List<Column> columns) {
        return "INSERT INTO " + MySqlDialect.quoteIdentifier(table) + " (" + columnList(columns)
                + ") VALUES\n";
    }

    private String columnList(List<Column> columns) {
        return columns.stream().map(c -> MySqlDialect.quoteIdentifier(c.getName()))
                .collect(Collectors.joining(", "));
    }

    private DumpStatement toStatement(String table, String insertHead, RowBatch batch) {
        StringBuilder sb = new StringBuilder(insertHead);
        List<RowTuple> rows = batch.getRows();
        for (int r = 0; r < rows.size(); r++) {
            if (r > 0) {
                sb.append(",\n");
            }
            sb.append('(');
            List<SqlValue> values = rows.get(r).getValues();
            for (int c = 0; c < values.size(); c++) {
                if (c > 0) {
                    sb.append(", ");
                }
                sb.append(MySqlDialect.toLiteral(values.get(c)));
            }
            sb.append(')');
        }
        return DumpStatement.of(StatementKind.DATA, table, sb.toString());
    }
}
