package io.github.yok.sqlbackup.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a dump file back as a stream of {@link DumpStatement}s.
 *
 * <p>
 * The file is consumed character by character, so memory is bounded by the largest single
 * statement. Splitting rules:
 * </p>
 * <ul>
 * <li>A statement ends at a {@code ;} outside quoted text and comments.</li>
 * <li>Single-quoted, double-quoted and back-quoted text is kept verbatim; backslash escapes and
 * doubled quotes inside it never end the text early.</li>
 * <li>{@code -- } and {@code #} comments run to the end of the line and are dropped; block comments
 * are kept as part of the statement since MySQL may execute their content.</li>
 * <li>A comment line {@code -- Table: `name`} between statements opens the table section every
 * following statement belongs to.</li>
 * </ul>
 *
 * <p>
 * Text left after the last terminator marks the file as truncated; it is never returned as a
 * statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DumpReader implements Closeable {

    private static final Pattern TABLE_MARKER =
            Pattern.compile("^-- Table:\\s+`((?:[^`]|``)+)`\\s*$");

    // Bytes inspected at the end of a file when looking for the completion trailer
    private static final int TAIL_BYTES = 4096;

    private final PushbackReader in;
    private long line = 1;
    private String currentTable;
    private int tableIndex;
    private int sessionIndex;
    private boolean completionSeen;
    private boolean truncatedTail;

    /**
     * Wraps a character stream.
     *
     * @param reader dump text
     */
    public DumpReader(Reader reader) {
        this.in = new PushbackReader(reader, 2);
    }

    /**
     * Opens a dump file as UTF-8.
     *
     * @param path dump file
     * @return reader positioned at the first statement
     * @throws IOException if the file cannot be opened
     */
    public static DumpReader open(Path path) throws IOException {
        return new DumpReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    /**
     * Returns whether a dump file ends with the completion trailer.
     *
     * @param path dump file
     * @return {@code true} if the trailer is among the last lines of the file
     * @throws IOException if the file cannot be read
     */
    public static boolean isComplete(Path path) throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(path)) {
            long size = ch.size();
            int length = (int) Math.min(size, TAIL_BYTES);
            ByteBuffer buf = ByteBuffer.allocate(length);
            ch.position(size - length);
            while (buf.hasRemaining()) {
                if (ch.read(buf) < 0) {
                    break;
                }
            }
            String tail = new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8);
            return tail.startsWith(DumpWriter.COMPLETION_PREFIX)
                    || tail.contains("\n" + DumpWriter.COMPLETION_PREFIX);
        }
    }

    /**
     * Reads the next statement.
     *
     * @return next statement, or {@code null} at the end of the input
     * @throws IOException if reading fails
     */
    public DumpStatement next() throws IOException {
        StringBuilder sb = new StringBuilder();
        boolean started = false;
        long startLine = line;
        char quote = 0;
        boolean blockComment = false;
        while (true) {
            int c = read();
            if (c < 0) {
                if (started) {
                    truncatedTail = true;
                    log.warn("Dump ends with an unterminated statement starting at line {}",
                            startLine);
                }
                return null;
            }
            if (quote != 0) {
                sb.append((char) c);
                if (c == '\\' && quote != '`') {
                    int escaped = read();
                    if (escaped >= 0) {
                        sb.append((char) escaped);
                    }
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (blockComment) {
                sb.append((char) c);
                if (c == '*' && peek() == '/') {
                    sb.append((char) read());
                    blockComment = false;
                }
                continue;
            }
            if (c == '-' && peek() == '-') {
                read();
                int third = peek();
                if (third < 0 || third == ' ' || third == '\t' || third == '\r' || third == '\n') {
                    String comment = "--" + readLine();
                    if (started) {
                        sb.append('\n');
                    } else {
                        handleComment(comment);
                    }
                    continue;
                }
                if (!started) {
                    started = true;
                    startLine = line;
                }
                sb.append("--");
                continue;
            }
            if (c == '#') {
                readLine();
                if (started) {
                    sb.append('\n');
                }
                continue;
            }
            if (c == ';') {
                if (!started) {
                    continue;
                }
                return build(sb.toString().trim(), startLine);
            }
            if (!started) {
                if (Character.isWhitespace(c)) {
                    continue;
                }
                started = true;
                startLine = line;
            }
            sb.append((char) c);
            if (c == '/' && peek() == '*') {
                sb.append((char) read());
                blockComment = true;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = (char) c;
            }
        }
    }

    /**
     * Returns whether the completion trailer has been read. Meaningful once {@link #next()} has
     * returned {@code null}.
     *
     * @return {@code true} if the trailer was seen
     */
    public boolean isCompletionSeen() {
        return completionSeen;
    }

    /**
     * Returns whether the input ended inside a statement or without the completion trailer.
     * Meaningful once {@link #next()} has returned {@code null}.
     *
     * @return {@code true} for a truncated dump
     */
    public boolean isTruncated() {
        return truncatedTail || !completionSeen;
    }

    private DumpStatement build(String sql, long startLine) {
        StatementKind kind = DumpStatement.classify(sql);
        if (kind == StatementKind.SESSION || currentTable == null) {
            return new DumpStatement(kind, null, sql, ++sessionIndex, startLine);
        }
        return new DumpStatement(kind, currentTable, sql, ++tableIndex, startLine);
    }

    private void handleComment(String comment) {
        Matcher m = TABLE_MARKER.matcher(comment.trim());
        if (m.matches()) {
            currentTable = m.group(1).replace("``", "`");
            tableIndex = 0;
            log.debug("Table section [{}] starts at line {}", currentTable, line - 1);
        } else if (comment.startsWith(DumpWriter.COMPLETION_PREFIX)) {
            completionSeen = true;
        }
    }

    private int read() throws IOException {
        int c = in.read();
        if (c == '\n') {
            line++;
        }
        return c;
    }

    private int peek() throws IOException {
        int c = in.read();
        if (c >= 0) {
            in.unread(c);
        }
        return c;
    }

    private String readLine() throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = read()) >= 0 && c != '\n') {
            sb.append((char) c);
        }
        int end = sb.length();
        if (end > 0 && sb.charAt(end - 1) == '\r') {
            sb.setLength(end - 1);
        }
        return sb.toString();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
