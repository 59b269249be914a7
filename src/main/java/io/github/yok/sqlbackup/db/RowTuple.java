package io.github.yok.sqlbackup.db;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Ordered values of one row, aligned position by position to the selected column list.
 */
@EqualsAndHashCode
@ToString
public final class RowTuple {

    private final ImmutableList<SqlValue> values;

    /**
     * Creates a row.
     *
     * @param values values in column order
     */
    public RowTuple(List<SqlValue> values) {
        this.values = ImmutableList.copyOf(values);
    }

    /**
     * Returns the value at the given column position.
     *
     * @param index 0-based column position
     * @return value
     */
    public SqlValue get(int index) {
        return values.get(index);
    }

    /**
     * Returns the number of values.
     *
     * @return arity of the row
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns all values in column order.
     *
     * @return immutable value list
     */
    public List<SqlValue> getValues() {
        return values;
    }
}
