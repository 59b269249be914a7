package io.github.yok.sqlbackup.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.sqlbackup.exception.RetentionException;
import java.nio.file.Path;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of pruning incremental backups.
 */
@Getter
@ToString
public class RetentionResult {

    // Surviving backups, oldest first
    private final List<Path> kept;
    private final List<Path> deleted;
    // Files that could not be deleted; reported, never thrown
    private final List<RetentionException> failures;

    /**
     * Creates a result.
     *
     * @param kept surviving backups, oldest first
     * @param deleted removed backups, oldest first
     * @param failures deletion failures
     */
    public RetentionResult(List<Path> kept, List<Path> deleted,
            List<RetentionException> failures) {
        this.kept = ImmutableList.copyOf(kept);
        this.deleted = ImmutableList.copyOf(deleted);
        this.failures = ImmutableList.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
