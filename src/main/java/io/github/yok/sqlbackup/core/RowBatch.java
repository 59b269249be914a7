package io.github.yok.sqlbackup.core;

import com.google.common.base.Preconditions;
import io.github.yok.sqlbackup.db.RowTuple;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows buffered for one batched insert, bounded by a fixed capacity.
 */
public class RowBatch {

    private final int capacity;
    private final List<RowTuple> rows;

    /**
     * Creates an empty batch.
     *
     * @param capacity maximum number of rows, at least 1
     */
    public RowBatch(int capacity) {
        Preconditions.checkArgument(capacity >= 1, "batch size must be >= 1: %s", capacity);
        this.capacity = capacity;
        this.rows = new ArrayList<>(Math.min(capacity, 1024));
    }

    /**
     * Appends a row.
     *
     * @param row row in cursor order
     * @throws IllegalStateException if the batch is full
     */
    public void add(RowTuple row) {
        Preconditions.checkState(!isFull(), "batch is full");
        rows.add(row);
    }

    public boolean isFull() {
        return rows.size() >= capacity;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<RowTuple> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Empties the batch so it can be reused for the next rows.
     */
    public void clear() {
        rows.clear();
    }
}
