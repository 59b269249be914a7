package io.github.yok.sqlbackup.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings related to backup and restore operations.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code backup.batch-size}: maximum rows per batched insert statement (default 1000)</li>
 * <li>{@code backup.exclude-tables}: table names to leave out of the dump (case-insensitive)</li>
 * <li>{@code backup.drop-table-before-create}: emit {@code DROP TABLE IF EXISTS} before each
 * create statement (default {@code true})</li>
 * <li>{@code backup.timestamp-pattern}: prefix pattern of incremental backup names (default
 * {@code yyyyMMdd_HHmmss}, evaluated in UTC)</li>
 * <li>{@code backup.restore.transaction-scope}: {@code TABLE} or {@code FILE}</li>
 * <li>{@code backup.restore.allow-truncated}: replay dumps that lack the completion trailer</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "backup")
@Getter
@Setter
@NoArgsConstructor
public class BackupConfig {

    /**
     * Maximum number of rows per batched insert statement.
     */
    private int batchSize = 1000;

    /**
     * List of table names to exclude during backup.
     */
    private List<String> excludeTables = ImmutableList.of();

    /**
     * Whether each table section starts with {@code DROP TABLE IF EXISTS}.
     */
    private boolean dropTableBeforeCreate = true;

    /**
     * Fixed-width timestamp pattern used as the incremental file name prefix.
     */
    private String timestampPattern = "yyyyMMdd_HHmmss";

    /**
     * Restore-side settings.
     */
    private Restore restore = new Restore();

    /**
     * Settings applied while replaying a dump.
     */
    @Data
    public static class Restore {
        // Transaction boundary
        private TransactionScope transactionScope = TransactionScope.TABLE;
        // Replay dumps whose completion trailer is missing
        private boolean allowTruncated = false;
    }
}
