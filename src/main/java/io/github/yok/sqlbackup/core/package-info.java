/**
 * Core backup/restore workflow package.
 *
 * <p>
 * Streams table data into batched insert statements, writes and reads the plain-text dump,
 * replays a dump transactionally against a target database and rotates incremental backups.
 * </p>
 *
 * <p>
 * Connection handling and literal encoding are delegated to {@code db}; table definitions and
 * their order come from {@code schema}.
 * </p>
 */
package io.github.yok.sqlbackup.core;
