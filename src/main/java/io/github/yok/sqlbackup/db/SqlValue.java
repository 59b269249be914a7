package io.github.yok.sqlbackup.db;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One column value read from a row, tagged with its literal kind.
 *
 * <p>
 * {@code NUMBER} and {@code STRING} values keep the server's textual representation in
 * {@link #getText()}; {@code BINARY} values keep the raw bytes in {@link #getBytes()}.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SqlValue {

    private static final SqlValue NULL_VALUE = new SqlValue(ValueKind.NULL, null, null);

    ValueKind kind;
    String text;
    byte[] bytes;

    /**
     * Returns the SQL {@code NULL} value.
     *
     * @return shared null value
     */
    public static SqlValue nullValue() {
        return NULL_VALUE;
    }

    /**
     * Creates a numeric value from its textual form.
     *
     * @param text number as returned by the server
     * @return value
     */
    public static SqlValue ofNumber(String text) {
        Preconditions.checkNotNull(text, "text");
        return new SqlValue(ValueKind.NUMBER, text, null);
    }

    /**
     * Creates a character value.
     *
     * @param text string content
     * @return value
     */
    public static SqlValue ofString(String text) {
        Preconditions.checkNotNull(text, "text");
        return new SqlValue(ValueKind.STRING, text, null);
    }

    /**
     * Creates a binary value.
     *
     * @param bytes raw bytes
     * @return value
     */
    public static SqlValue ofBinary(byte[] bytes) {
        Preconditions.checkNotNull(bytes, "bytes");
        return new SqlValue(ValueKind.BINARY, null, bytes.clone());
    }

    /**
     * Returns a copy of the raw bytes of a {@code BINARY} value.
     *
     * @return copied bytes, or {@code null} for other kinds
     */
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    /**
     * Returns whether this is SQL {@code NULL}.
     *
     * @return {@code true} for {@code NULL}
     */
    public boolean isNull() {
        return kind == ValueKind.NULL;
    }
}
