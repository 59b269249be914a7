package io.github.yok.sqlbackup.db;

/**
 * Literal category of a column value, decided from the column's data type.
 */
public enum ValueKind {
    NULL, NUMBER, STRING, BINARY
}
