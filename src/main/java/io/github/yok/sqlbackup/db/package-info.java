/**
 * Database access package.
 *
 * <p>
 * Opens sessions against MySQL/MariaDB, scopes transactions, streams rows through forward-only
 * cursors and encodes values as MySQL literals. Rows are carried as
 * {@link io.github.yok.sqlbackup.db.RowTuple}s of typed
 * {@link io.github.yok.sqlbackup.db.SqlValue}s aligned to the selected columns.
 * </p>
 */
package io.github.yok.sqlbackup.db;
