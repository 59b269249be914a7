/**
 * Configuration package for sqlbackup.
 *
 * <p>
 * Binds the {@code connections} and {@code backup} sections of {@code application.yml} and turns a
 * validated connection entry into an immutable
 * {@link io.github.yok.sqlbackup.config.DatabaseEndpoint} that is passed explicitly to every engine
 * operation.
 * </p>
 */
package io.github.yok.sqlbackup.config;
