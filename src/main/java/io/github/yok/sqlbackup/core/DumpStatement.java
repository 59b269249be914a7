package io.github.yok.sqlbackup.core;

import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One statement of a dump, without its {@code ;} terminator.
 *
 * <p>
 * Statements written by the backup carry only kind, table and text. Statements read back from a
 * file additionally carry their 1-based index within the table section and the line they start
 * on.
 * </p>
 */
@Value
@AllArgsConstructor
public class DumpStatement {

    StatementKind kind;
    // Owning table; null outside table sections
    String table;
    String sql;
    int index;
    long lineNumber;

    /**
     * Creates a statement to be written.
     *
     * @param kind statement kind
     * @param table owning table, or {@code null} for session statements
     * @param sql statement text without terminator
     * @return statement
     */
    public static DumpStatement of(StatementKind kind, String table, String sql) {
        return new DumpStatement(kind, table, sql, 0, 0L);
    }

    /**
     * Classifies statement text by its leading keyword.
     *
     * @param sql statement text
     * @return {@link StatementKind#SESSION} for {@code SET}, {@link StatementKind#DATA} for
     *         {@code INSERT}, {@link StatementKind#DDL} otherwise
     */
    public static StatementKind classify(String sql) {
        String head = sql.stripLeading().toUpperCase(Locale.ROOT);
        if (head.startsWith("SET ") || head.startsWith("SET\n") || head.startsWith("SET\t")) {
            return StatementKind.SESSION;
        }
        if (head.startsWith("INSERT")) {
            return StatementKind.DATA;
        }
        return StatementKind.DDL;
    }
}
