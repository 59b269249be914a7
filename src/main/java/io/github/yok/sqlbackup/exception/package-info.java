/**
 * Error types raised by the backup and restore engine.
 *
 * <p>
 * Every failure is a {@link io.github.yok.sqlbackup.exception.SqlBackupException} tagged with an
 * {@link io.github.yok.sqlbackup.exception.ErrorKind}. Subclasses carry the structured context of
 * the failing step (table name, rows emitted, statement index, file path).
 * </p>
 */
package io.github.yok.sqlbackup.exception;
