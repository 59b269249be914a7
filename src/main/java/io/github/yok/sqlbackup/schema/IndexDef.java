package io.github.yok.sqlbackup.schema;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Secondary index of a table. The primary key is kept separately on {@link TableSchema}.
 */
@Value
@Builder
public class IndexDef {

    String name;
    boolean unique;
    @Singular("column")
    List<String> columns;
}
