package io.github.yok.sqlbackup.core;

import java.nio.file.Path;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A dump file written by a backup. Two instances are equal when they name the same path.
 */
@Getter
@ToString
@RequiredArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BackupFile {

    @EqualsAndHashCode.Include
    private final Path path;
    // Logical ID of the source connection
    private final String connectionId;
    private final Instant createdAt;
}
