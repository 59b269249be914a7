package io.github.yok.sqlbackup.core;

import io.github.yok.sqlbackup.exception.OperationCancelledException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked at table boundaries.
 *
 * <p>
 * {@link #cancel()} may be called from any thread; the running backup or restore stops before its
 * next table.
 * </p>
 */
public class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Throws when cancellation was requested.
     *
     * @param completedTables tables fully processed so far
     * @throws OperationCancelledException if {@link #cancel()} was called
     */
    public void throwIfCancelled(int completedTables) throws OperationCancelledException {
        if (cancelled.get()) {
            throw new OperationCancelledException(completedTables);
        }
    }
}
