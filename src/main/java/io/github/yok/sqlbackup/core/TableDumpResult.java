package io.github.yok.sqlbackup.core;

import lombok.Value;

/**
 * Counts produced while dumping the data of one table.
 */
@Value
public class TableDumpResult {

    // Number of rows written
    long rowCount;
    // Number of insert statements written
    int batchCount;
}
