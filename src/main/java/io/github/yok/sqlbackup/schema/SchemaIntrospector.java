package io.github.yok.sqlbackup.schema;

import com.google.common.collect.ImmutableList;
import io.github.yok.sqlbackup.db.MySqlDialect;
import io.github.yok.sqlbackup.db.Session;
import io.github.yok.sqlbackup.exception.IntrospectionException;
import io.github.yok.sqlbackup.util.TableDependencyResolver;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the definition of every base table of a database and orders the tables parent-first.
 *
 * <p>
 * <strong>Sources:</strong>
 * </p>
 * <ul>
 * <li>{@code information_schema.TABLES}: base tables in catalog order (views are skipped).</li>
 * <li>{@code information_schema.COLUMNS}: columns in ordinal order.</li>
 * <li>{@code information_schema.STATISTICS}: primary key and secondary indexes.</li>
 * <li>{@code information_schema.KEY_COLUMN_USAGE} joined with
 * {@code REFERENTIAL_CONSTRAINTS}: foreign keys and their rules.</li>
 * <li>{@code SHOW CREATE TABLE}: the server's own create statement.</li>
 * </ul>
 *
 * <p>
 * <strong>Foreign key checks:</strong> a reference to a table of the same database that does not
 * exist fails the introspection. References to excluded tables and to other databases are logged
 * and ignored for ordering.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaIntrospector {

    static final String TABLES_SQL = "SELECT TABLE_NAME FROM information_schema.TABLES"
            + " WHERE TABLE_SCHEMA = ? AND TABLE_TYPE = 'BASE TABLE' ORDER BY TABLE_NAME";

    static final String COLUMNS_SQL = "SELECT TABLE_NAME, COLUMN_NAME, COLUMN_TYPE, DATA_TYPE,"
            + " IS_NULLABLE, COLUMN_DEFAULT, ORDINAL_POSITION, EXTRA, GENERATION_EXPRESSION"
            + " FROM information_schema.COLUMNS WHERE TABLE_SCHEMA = ?"
            + " ORDER BY TABLE_NAME, ORDINAL_POSITION";

    static final String INDEXES_SQL = "SELECT TABLE_NAME, INDEX_NAME, NON_UNIQUE, COLUMN_NAME"
            + " FROM information_schema.STATISTICS WHERE TABLE_SCHEMA = ?"
            + " ORDER BY TABLE_NAME, INDEX_NAME, SEQ_IN_INDEX";

    static final String FOREIGN_KEYS_SQL = "SELECT k.TABLE_NAME, k.CONSTRAINT_NAME, k.COLUMN_NAME,"
            + " k.REFERENCED_TABLE_SCHEMA, k.REFERENCED_TABLE_NAME, k.REFERENCED_COLUMN_NAME,"
            + " r.UPDATE_RULE, r.DELETE_RULE"
            + " FROM information_schema.KEY_COLUMN_USAGE k"
            + " JOIN information_schema.REFERENTIAL_CONSTRAINTS r"
            + " ON r.CONSTRAINT_SCHEMA = k.CONSTRAINT_SCHEMA"
            + " AND r.CONSTRAINT_NAME = k.CONSTRAINT_NAME AND r.TABLE_NAME = k.TABLE_NAME"
            + " WHERE k.TABLE_SCHEMA = ? AND k.REFERENCED_TABLE_NAME IS NOT NULL"
            + " ORDER BY k.TABLE_NAME, k.CONSTRAINT_NAME, k.ORDINAL_POSITION";

    private static final String PRIMARY_INDEX = "PRIMARY";

    private final List<String> excludeTables;

    /**
     * Creates an introspector.
     *
     * @param excludeTables table names left out of the result (case-insensitive); may be
     *        {@code null}
     */
    public SchemaIntrospector(List<String> excludeTables) {
        this.excludeTables = excludeTables == null ? ImmutableList.of()
                : ImmutableList.copyOf(excludeTables);
    }

    /**
     * Reads every non-excluded base table of the session's database.
     *
     * @param session open session
     * @return table definitions in parent-first order
     * @throws IntrospectionException if metadata cannot be read or a foreign key references a
     *         missing table
     */
    public List<TableSchema> introspect(Session session) throws IntrospectionException {
        String schema = session.getDatabase();
        log.info("[{}] Introspecting schema", schema);

        // --- 1) Table list ---
        List<String> allTables = queryOrFail(session, TABLES_SQL, schema, null,
                "Failed to list tables", rs -> rs.getString("TABLE_NAME"));
        List<String> tables = new ArrayList<>();
        for (String table : allTables) {
            if (isExcluded(table)) {
                log.info("[{}] Table[{}] is excluded; skipping", schema, table);
            } else {
                tables.add(table);
            }
        }
        if (tables.isEmpty()) {
            log.warn("[{}] No tables to back up", schema);
            return new ArrayList<>();
        }

        // --- 2) Columns, indexes, foreign keys ---
        Map<String, List<Column>> columns = readColumns(session, schema);
        Map<String, IndexRows> indexes = readIndexes(session, schema);
        Map<String, Map<String, ForeignKeyDef.ForeignKeyDefBuilder>> foreignKeys =
                readForeignKeys(session, schema);

        // --- 3) Assemble definitions ---
        Set<String> allLower = allTables.stream().map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Map<String, TableSchema> byName = new LinkedHashMap<>();
        Map<String, List<String>> parentsByChild = new LinkedHashMap<>();
        for (String table : tables) {
            List<Column> cols = columns.get(table);
            if (cols == null || cols.isEmpty()) {
                throw new IntrospectionException(table,
                        "No column metadata found for table [" + table + "]");
            }
            TableSchema.TableSchemaBuilder builder =
                    TableSchema.builder().schema(schema).name(table).columns(cols)
                            .createStatement(readCreateStatement(session, table));
            IndexRows idx = indexes.get(table);
            if (idx != null) {
                builder.primaryKey(idx.primaryKey);
                idx.secondary.values().forEach(b -> builder.index(b.build()));
            }
            Map<String, ForeignKeyDef.ForeignKeyDefBuilder> fks = foreignKeys.get(table);
            if (fks != null) {
                fks.values().forEach(b -> builder.foreignKey(b.build()));
            }
            TableSchema ts = builder.build();
            parentsByChild.put(table, checkReferences(ts, allLower));
            byName.put(table, ts);
        }

        // --- 4) Parent-first ordering ---
        List<String> order = TableDependencyResolver.resolveOrder(tables, parentsByChild);
        List<TableSchema> result =
                order.stream().map(byName::get).collect(Collectors.toList());
        log.info("[{}] Introspected {} tables", schema, result.size());
        return result;
    }

    /**
     * Validates the foreign keys of a table and returns the parents that take part in ordering.
     *
     * @param ts table definition
     * @param allLower every base table of the schema, lower-cased, including excluded ones
     * @return referenced, non-excluded tables of the same schema
     * @throws IntrospectionException if a same-schema reference points to a missing table
     */
    private List<String> checkReferences(TableSchema ts, Set<String> allLower)
            throws IntrospectionException {
        List<String> parents = new ArrayList<>();
        for (ForeignKeyDef fk : ts.getForeignKeys()) {
            String refSchema = fk.getReferencedSchema();
            String refTable = fk.getReferencedTable();
            if (refSchema != null && !refSchema.equalsIgnoreCase(ts.getSchema())) {
                log.warn("[{}] Table[{}] FK[{}] references another database [{}.{}]; "
                        + "ignored for ordering", ts.getSchema(), ts.getName(), fk.getName(),
                        refSchema, refTable);
                continue;
            }
            if (!allLower.contains(refTable.toLowerCase(Locale.ROOT))) {
                throw new IntrospectionException(ts.getName(),
                        "Foreign key [" + fk.getName() + "] of table [" + ts.getName()
                                + "] references missing table [" + refTable + "]");
            }
            if (isExcluded(refTable)) {
                log.warn("[{}] Table[{}] FK[{}] references excluded table [{}]; "
                        + "the restored data may violate it", ts.getSchema(), ts.getName(),
                        fk.getName(), refTable);
                continue;
            }
            parents.add(refTable);
        }
        return parents;
    }

    private boolean isExcluded(String table) {
        return excludeTables.stream().anyMatch(ex -> ex.equalsIgnoreCase(table));
    }

    private Map<String, List<Column>> readColumns(Session session, String schema)
            throws IntrospectionException {
        List<Object[]> rows = queryOrFail(session, COLUMNS_SQL, schema, null,
                "Failed to read column metadata", rs -> new Object[] {
                        rs.getString("TABLE_NAME"),
                        Column.builder().name(rs.getString("COLUMN_NAME"))
                                .columnType(rs.getString("COLUMN_TYPE"))
                                .dataType(rs.getString("DATA_TYPE"))
                                .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                                .defaultValue(rs.getString("COLUMN_DEFAULT"))
                                .ordinalPosition(rs.getInt("ORDINAL_POSITION"))
                                .extra(rs.getString("EXTRA"))
                                .generationExpression(rs.getString("GENERATION_EXPRESSION"))
                                .build()});
        Map<String, List<Column>> result = new LinkedHashMap<>();
        for (Object[] row : rows) {
            result.computeIfAbsent((String) row[0], k -> new ArrayList<>()).add((Column) row[1]);
        }
        return result;
    }

    private Map<String, IndexRows> readIndexes(Session session, String schema)
            throws IntrospectionException {
        List<String[]> rows = queryOrFail(session, INDEXES_SQL, schema, null,
                "Failed to read index metadata",
                rs -> new String[] {rs.getString("TABLE_NAME"), rs.getString("INDEX_NAME"),
                        rs.getString("NON_UNIQUE"), rs.getString("COLUMN_NAME")});
        Map<String, IndexRows> result = new LinkedHashMap<>();
        for (String[] row : rows) {
            IndexRows idx = result.computeIfAbsent(row[0], k -> new IndexRows());
            if (PRIMARY_INDEX.equals(row[1])) {
                idx.primaryKey.add(row[3]);
                continue;
            }
            // Functional key parts have no COLUMN_NAME; SHOW CREATE TABLE still carries them.
            if (row[3] == null) {
                continue;
            }
            idx.secondary.computeIfAbsent(row[1],
                    k -> IndexDef.builder().name(k).unique("0".equals(row[2]))).column(row[3]);
        }
        return result;
    }

    private Map<String, Map<String, ForeignKeyDef.ForeignKeyDefBuilder>> readForeignKeys(
            Session session, String schema) throws IntrospectionException {
        List<String[]> rows = queryOrFail(session, FOREIGN_KEYS_SQL, schema, null,
                "Failed to read foreign key metadata",
                rs -> new String[] {rs.getString("TABLE_NAME"), rs.getString("CONSTRAINT_NAME"),
                        rs.getString("COLUMN_NAME"), rs.getString("REFERENCED_TABLE_SCHEMA"),
                        rs.getString("REFERENCED_TABLE_NAME"),
                        rs.getString("REFERENCED_COLUMN_NAME"), rs.getString("UPDATE_RULE"),
                        rs.getString("DELETE_RULE")});
        Map<String, Map<String, ForeignKeyDef.ForeignKeyDefBuilder>> result =
                new LinkedHashMap<>();
        for (String[] row : rows) {
            result.computeIfAbsent(row[0], k -> new LinkedHashMap<>())
                    .computeIfAbsent(row[1],
                            k -> ForeignKeyDef.builder().name(k).referencedSchema(row[3])
                                    .referencedTable(row[4]).updateRule(row[6])
                                    .deleteRule(row[7]))
                    .column(row[2]).referencedColumn(row[5]);
        }
        return result;
    }

    private String readCreateStatement(Session session, String table)
            throws IntrospectionException {
        List<String> rows = queryOrFail(session,
                "SHOW CREATE TABLE " + MySqlDialect.quoteIdentifier(table), null, table,
                "Failed to read create statement of table [" + table + "]",
                rs -> rs.getString(2));
        return rows.isEmpty() ? null : rows.get(0);
    }

    private <T> List<T> queryOrFail(Session session, String sql, String schemaParam, String table,
            String message, Session.RowMapper<T> mapper) throws IntrospectionException {
        try {
            List<String> params = schemaParam == null ? ImmutableList.of()
                    : ImmutableList.of(schemaParam);
            return session.query(sql, params, mapper);
        } catch (SQLException e) {
            throw new IntrospectionException(table, message + ": " + e.getMessage(), e);
        }
    }

    /**
     * Index rows of one table grouped while reading {@code STATISTICS}.
     */
    @AllArgsConstructor
    private static final class IndexRows {
        private final List<String> primaryKey;
        private final Map<String, IndexDef.IndexDefBuilder> secondary;

        IndexRows() {
            this(new ArrayList<>(), new LinkedHashMap<>());
        }
    }
}
