package io.github.yok.sqlbackup.core;

import com.google.common.base.Preconditions;
import io.github.yok.sqlbackup.db.MySqlDialect;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Appends a dump to a UTF-8 text file.
 *
 * <p>
 * Layout of the file:
 * </p>
 * <ol>
 * <li>informational header comments,</li>
 * <li>session preamble ({@link #PREAMBLE}),</li>
 * <li>per table: the marker line {@code -- Table: `name`}, its DDL, then its batched inserts,</li>
 * <li>epilogue ({@link #EPILOGUE}) and the {@code -- Dump completed} trailer.</li>
 * </ol>
 *
 * <p>
 * The writer never seeks or rewrites: everything is appended in order and flushed at each table
 * boundary, so a crash leaves a file whose complete table sections are still replayable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DumpWriter implements StatementSink, Closeable {

    /** Prefix of the line that opens a table section. */
    public static final String TABLE_MARKER_PREFIX = "-- Table: ";

    /** Prefix of the trailer line written after the epilogue. */
    public static final String COMPLETION_PREFIX = "-- Dump completed: ";

    /** Session statements written before the first table. */
    public static final List<String> PREAMBLE = List.of("SET NAMES utf8mb4",
            "SET time_zone = '+00:00'", "SET SQL_MODE = 'NO_AUTO_VALUE_ON_ZERO'",
            "SET FOREIGN_KEY_CHECKS = 0");

    /** Session statements written after the last table. */
    public static final List<String> EPILOGUE = List.of("SET FOREIGN_KEY_CHECKS = 1");

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Writer writer;
    private String currentTable;

    /**
     * Creates the dump file. An existing file is never overwritten.
     *
     * @param path file to create
     * @throws IOException if the file exists or cannot be created
     */
    public DumpWriter(Path path) throws IOException {
        this(Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE));
    }

    DumpWriter(Writer writer) {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
    }

    /**
     * Writes the header comments and the session preamble.
     *
     * @param database source database name
     * @param generatedAt generation time
     * @throws IOException on write failure
     */
    public void writeHeader(String database, Instant generatedAt) throws IOException {
        writer.write("-- sqlbackup dump\n");
        writer.write("-- Database: " + MySqlDialect.quoteIdentifier(database) + "\n");
        writer.write("-- Generated: " + TIME_FORMAT.format(generatedAt) + "\n\n");
        for (String sql : PREAMBLE) {
            writeTerminated(sql);
        }
        writer.write('\n');
        writer.flush();
    }

    /**
     * Opens a table section.
     *
     * @param table table name
     * @throws IOException on write failure
     */
    public void beginTable(String table) throws IOException {
        Preconditions.checkState(currentTable == null, "table section [%s] is still open",
                currentTable);
        currentTable = table;
        writer.write(TABLE_MARKER_PREFIX + MySqlDialect.quoteIdentifier(table) + "\n");
    }

    /**
     * Appends a statement to the open table section.
     *
     * @param statement statement without terminator
     * @throws IOException on write failure
     */
    @Override
    public void accept(DumpStatement statement) throws IOException {
        Preconditions.checkState(currentTable != null, "no table section is open");
        writeTerminated(statement.getSql());
    }

    /**
     * Closes the open table section and flushes it to disk.
     *
     * @throws IOException on write failure
     */
    public void endTable() throws IOException {
        Preconditions.checkState(currentTable != null, "no table section is open");
        currentTable = null;
        writer.write('\n');
        writer.flush();
    }

    /**
     * Writes the epilogue and the completion trailer.
     *
     * @param completedAt completion time
     * @throws IOException on write failure
     */
    public void writeFooter(Instant completedAt) throws IOException {
        Preconditions.checkState(currentTable == null, "table section [%s] is still open",
                currentTable);
        for (String sql : EPILOGUE) {
            writeTerminated(sql);
        }
        writer.write(COMPLETION_PREFIX + TIME_FORMAT.format(completedAt) + "\n");
        writer.flush();
    }

    private void writeTerminated(String sql) throws IOException {
        writer.write(sql);
        writer.write(";\n");
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
