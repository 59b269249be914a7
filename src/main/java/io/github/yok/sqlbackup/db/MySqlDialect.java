package io.github.yok.sqlbackup.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Generated;
import org.apache.commons.codec.binary.Hex;

/**
 * MySQL/MariaDB dialect rules used by both directions of the round trip.
 *
 * <ul>
 * <li>Identifier quoting with back quotes (embedded back quotes are doubled).</li>
 * <li>Literal encoding of {@link SqlValue}s: {@code NULL}, unquoted numbers, escaped
 * single-quoted strings, {@code X'..'} hexadecimal binaries.</li>
 * <li>Value kind classification from {@code information_schema.COLUMNS.DATA_TYPE}.</li>
 * <li>Session preparation ({@code time_zone} and character set) applied to every connection.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MySqlDialect {

    /**
     * Fetch size that makes Connector/J stream rows one by one instead of buffering the whole
     * result.
     */
    public static final int STREAMING_FETCH_SIZE = Integer.MIN_VALUE;

    /**
     * Statements run on every new session, in order.
     */
    public static final List<String> SESSION_SETUP =
            List.of("SET time_zone = '+00:00'", "SET NAMES utf8mb4");

    private static final Set<String> NUMERIC_TYPE_NAMES =
            Set.of("tinyint", "smallint", "mediumint", "int", "integer", "bigint", "decimal",
                    "numeric", "dec", "fixed", "float", "double", "real", "double precision");
    private static final Set<String> BINARY_TYPE_NAMES = Set.of("binary", "varbinary",
            "tinyblob", "blob", "mediumblob", "longblob", "bit", "geometry", "point", "linestring",
            "polygon", "multipoint", "multilinestring", "multipolygon", "geometrycollection",
            "geomcollection");

    /**
     * Prevents instantiation.
     */
    @Generated
    private MySqlDialect() {}

    /**
     * Quotes an identifier with back quotes.
     *
     * @param identifier table or column name
     * @return quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Decides how values of a column with the given data type are read and encoded.
     *
     * <p>
     * Numeric types are emitted unquoted, binary and spatial types as hexadecimal literals, and
     * everything else (character, temporal, enum, set, json) as quoted strings in the server's own
     * textual form.
     * </p>
     *
     * @param dataType {@code DATA_TYPE} of the column (case-insensitive)
     * @return {@link ValueKind#NUMBER}, {@link ValueKind#BINARY} or {@link ValueKind#STRING}
     */
    public static ValueKind classify(String dataType) {
        if (dataType == null) {
            return ValueKind.STRING;
        }
        String type = dataType.trim().toLowerCase(Locale.ROOT);
        if (NUMERIC_TYPE_NAMES.contains(type)) {
            return ValueKind.NUMBER;
        }
        if (BINARY_TYPE_NAMES.contains(type)) {
            return ValueKind.BINARY;
        }
        return ValueKind.STRING;
    }

    /**
     * Encodes a value as a MySQL literal.
     *
     * @param value value to encode
     * @return literal text
     */
    public static String toLiteral(SqlValue value) {
        switch (value.getKind()) {
            case NULL:
                return "NULL";
            case NUMBER:
                return value.getText();
            case BINARY:
                return "X'" + Hex.encodeHexString(value.getBytes(), false) + "'";
            default:
                return quoteString(value.getText());
        }
    }

    /**
     * Quotes a string with single quotes, escaping the characters MySQL interprets specially.
     *
     * @param text raw text
     * @return quoted literal
     */
    public static String quoteString(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\0':
                    sb.append("\\0");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\u001A':
                    sb.append("\\Z");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * Applies MySQL session settings for a stable round trip.
     *
     * <p>
     * Dump and restore both run with {@code time_zone = '+00:00'} so {@code TIMESTAMP} values are
     * read and written without conversion, and with {@code utf8mb4} so every character survives.
     * </p>
     *
     * @param connection JDBC connection
     * @throws SQLException if the statements fail
     */
    public static void prepareSession(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : SESSION_SETUP) {
                st.execute(sql);
            }
        }
    }
}
