/**
 * Utility package for sqlbackup.
 *
 * <p>
 * Provides stateless helpers shared by the engine and the command line: foreign key dependency
 * ordering, optional JDBC driver loading and fail-fast error reporting.
 * </p>
 */
package io.github.yok.sqlbackup.util;
