package io.github.yok.sqlbackup.core;

import io.github.yok.sqlbackup.exception.RetentionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Names incremental backups and keeps only the newest ones.
 *
 * <p>
 * An incremental backup of {@code dir/name.sql} is written to
 * {@code dir/<timestamp>_name.sql}. The timestamp is rendered in UTC with the configured pattern
 * (default {@code yyyyMMdd_HHmmss}). Backups are ordered by the instant parsed back from that
 * prefix, never by file name, so any pattern works including day-first and unpadded ones.
 * Time fields missing from the pattern default to midnight.
 * </p>
 *
 * <p>
 * Pruning only touches siblings whose name is exactly {@code <timestamp>_<basename>} with a
 * parseable timestamp; any other file in the directory is left alone.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RetentionManager {

    private final DateTimeFormatter formatter;
    private final Clock clock;

    /**
     * Creates a manager.
     *
     * @param timestampPattern {@link DateTimeFormatter} pattern of the name prefix
     * @param clock clock supplying the backup time
     */
    public RetentionManager(String timestampPattern, Clock clock) {
        Validate.notBlank(timestampPattern, "timestampPattern must not be blank.");
        this.formatter = new DateTimeFormatterBuilder().appendPattern(timestampPattern)
                .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0).toFormatter()
                .withZone(ZoneOffset.UTC);
        this.clock = clock;
    }

    /**
     * Returns the timestamped sibling path for a new incremental backup.
     *
     * @param base user-supplied backup path
     * @return {@code <parent>/<timestamp>_<basename>}
     */
    public Path resolveIncrementalPath(Path base) {
        String name = formatter.format(clock.instant()) + "_" + base.getFileName();
        return base.resolveSibling(name);
    }

    /**
     * Deletes all but the {@code keep} newest incremental backups of {@code base}.
     *
     * <p>
     * Deletion failures do not stop pruning: they are logged and returned in the result.
     * </p>
     *
     * @param base user-supplied backup path
     * @param keep number of backups to keep, at least 1
     * @return kept and deleted files plus failures
     * @throws IllegalArgumentException if {@code keep} is less than 1
     */
    public RetentionResult prune(Path base, int keep) {
        Validate.isTrue(keep >= 1, "keep must be >= 1: %d", keep);
        Path dir = base.toAbsolutePath().getParent();
        String suffix = "_" + base.getFileName();

        Map<Path, Instant> timestamps = new TreeMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(p -> {
                Instant at = timestampOf(p.getFileName().toString(), suffix);
                if (at != null) {
                    timestamps.put(p, at);
                }
            });
        } catch (IOException e) {
            RetentionException failure = new RetentionException(dir, e);
            log.warn("Retention skipped: {}", failure.getMessage(), e);
            return new RetentionResult(List.of(), List.of(), List.of(failure));
        }

        List<Path> candidates = timestamps.keySet().stream()
                .sorted(Comparator.comparing((Path p) -> timestamps.get(p)))
                .collect(Collectors.toList());
        int excess = Math.max(0, candidates.size() - keep);
        List<Path> expired = candidates.subList(0, excess);
        List<Path> kept = candidates.subList(excess, candidates.size());
        List<Path> deleted = new ArrayList<>();
        List<RetentionException> failures = new ArrayList<>();
        for (Path p : expired) {
            try {
                Files.delete(p);
                deleted.add(p);
                log.info("Expired backup deleted: {}", p.getFileName());
            } catch (IOException e) {
                RetentionException failure = new RetentionException(p, e);
                failures.add(failure);
                log.warn(failure.getMessage(), e);
            }
        }
        log.info("Retention: kept={}, deleted={}, failed={}", kept.size(), deleted.size(),
                failures.size());
        return new RetentionResult(kept, deleted, failures);
    }

    private Instant timestampOf(String fileName, String suffix) {
        if (fileName.length() <= suffix.length() || !fileName.endsWith(suffix)) {
            return null;
        }
        String prefix = fileName.substring(0, fileName.length() - suffix.length());
        try {
            return Instant.from(formatter.parse(prefix));
        } catch (DateTimeException e) {
            log.debug("Not an incremental backup name: {}", fileName);
            return null;
        }
    }
}
