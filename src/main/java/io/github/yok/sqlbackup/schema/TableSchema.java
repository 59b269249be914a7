package io.github.yok.sqlbackup.schema;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Definition of one table, produced once per backup run and read-only afterwards.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TableSchema {

    // Schema (database) the table belongs to
    String schema;
    String name;
    // Columns in ordinal order
    @Singular("column")
    List<Column> columns;
    // Primary key column names in key order; empty when the table has none
    @Singular("primaryKeyColumn")
    List<String> primaryKey;
    @Singular("index")
    List<IndexDef> indexes;
    @Singular("foreignKey")
    List<ForeignKeyDef> foreignKeys;
    // Text of SHOW CREATE TABLE; null when unavailable
    String createStatement;

    /**
     * Returns the columns whose values are dumped, in ordinal order.
     *
     * @return non-generated columns
     */
    public List<Column> getDumpColumns() {
        return columns.stream().filter(c -> !c.isGenerated()).collect(Collectors.toList());
    }
}
