package io.github.yok.sqlbackup.core;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a successful backup.
 */
@Getter
@ToString
public class BackupResult {

    private final BackupFile backupFile;
    // Rows written per table, in dump order
    private final Map<String, Long> rowCounts;
    // Pruning outcome; null for non-incremental backups
    private final RetentionResult retention;

    /**
     * Creates a result.
     *
     * @param backupFile written dump
     * @param rowCounts rows written per table, in dump order
     * @param retention pruning outcome, or {@code null}
     */
    public BackupResult(BackupFile backupFile, Map<String, Long> rowCounts,
            RetentionResult retention) {
        this.backupFile = backupFile;
        this.rowCounts = ImmutableMap.copyOf(rowCounts);
        this.retention = retention;
    }
}
