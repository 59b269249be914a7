package io.github.yok.sqlbackup.schema;

import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * One column of a table, as described by {@code information_schema.COLUMNS}.
 *
 * <p>
 * {@link #getOrdinalPosition()} is the only ordering key of column lists and row values.
 * </p>
 */
@Value
@Builder
public class Column {

    // Column name
    String name;
    // Declared type, verbatim (COLUMN_TYPE, e.g. "varchar(50)", "int unsigned")
    String columnType;
    // Type keyword (DATA_TYPE, e.g. "varchar"), used to pick the literal encoding
    String dataType;
    boolean nullable;
    // Default expression as stored in the catalog; null when there is none
    String defaultValue;
    // 1-based position in the table
    int ordinalPosition;
    // EXTRA attributes (e.g. "auto_increment", "VIRTUAL GENERATED")
    String extra;
    // GENERATION_EXPRESSION for generated columns; null otherwise
    String generationExpression;

    /**
     * Returns whether the column value is computed by the server.
     *
     * <p>
     * Generated columns cannot be assigned by insert statements, so they are left out of the
     * dumped data.
     * </p>
     *
     * @return {@code true} for virtual or stored generated columns
     */
    public boolean isGenerated() {
        if (extra == null) {
            return false;
        }
        String upper = extra.toUpperCase(Locale.ROOT);
        return upper.contains("VIRTUAL GENERATED") || upper.contains("STORED GENERATED")
                || upper.contains("PERSISTENT GENERATED");
    }
}
