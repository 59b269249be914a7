package io.github.yok.sqlbackup.core;

/**
 * Category of a statement in a dump.
 */
public enum StatementKind {

    /** Session setting ({@code SET ...}) outside any table transaction. */
    SESSION,

    /** Table definition ({@code DROP TABLE}, {@code CREATE TABLE}). */
    DDL,

    /** Batched {@code INSERT}. */
    DATA
}
