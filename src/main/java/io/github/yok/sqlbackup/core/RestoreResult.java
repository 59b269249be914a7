package io.github.yok.sqlbackup.core;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a successful restore.
 */
@Getter
@ToString
public class RestoreResult {

    // Statements executed per table, in file order
    private final Map<String, Integer> statementCounts;
    // Session and out-of-section statements executed
    private final int sessionStatements;
    // Whether the dump lacked its completion trailer (only possible when truncation is allowed)
    private final boolean truncated;

    /**
     * Creates a result.
     *
     * @param statementCounts statements executed per table, in file order
     * @param sessionStatements statements executed outside table sections
     * @param truncated whether the dump was truncated
     */
    public RestoreResult(Map<String, Integer> statementCounts, int sessionStatements,
            boolean truncated) {
        this.statementCounts = ImmutableMap.copyOf(statementCounts);
        this.sessionStatements = sessionStatements;
        this.truncated = truncated;
    }

    public int getTableCount() {
        return statementCounts.size();
    }
}
