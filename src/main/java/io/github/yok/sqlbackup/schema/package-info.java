/**
 * Schema introspection and DDL emission.
 *
 * <p>
 * Reads table, column, index and foreign key metadata from {@code information_schema}, orders the
 * tables parent-first and re-emits their definitions for the dump.
 * </p>
 */
package io.github.yok.sqlbackup.schema;
