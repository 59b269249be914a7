package io.github.yok.sqlbackup.core;

import java.io.IOException;

/**
 * Receives statements in emission order.
 */
@FunctionalInterface
public interface StatementSink {

    /**
     * Accepts one statement.
     *
     * @param statement statement to append
     * @throws IOException if the statement cannot be written
     */
    void accept(DumpStatement statement) throws IOException;
}
