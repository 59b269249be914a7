package io.github.yok.sqlbackup.schema;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Foreign key constraint of a table.
 *
 * <p>
 * {@link #getColumns()} and {@link #getReferencedColumns()} are aligned position by position.
 * </p>
 */
@Value
@Builder
public class ForeignKeyDef {

    // Constraint name
    String name;
    @Singular("column")
    List<String> columns;
    // Schema of the referenced table
    String referencedSchema;
    String referencedTable;
    @Singular("referencedColumn")
    List<String> referencedColumns;
    // UPDATE_RULE (e.g. "CASCADE", "RESTRICT")
    String updateRule;
    // DELETE_RULE
    String deleteRule;
}
