package io.github.yok.sqlbackup.schema;

import io.github.yok.sqlbackup.db.MySqlDialect;
import io.github.yok.sqlbackup.db.ValueKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Emits the statements that recreate a table.
 *
 * <p>
 * When the server supplied its own create statement ({@code SHOW CREATE TABLE}) it is returned
 * verbatim: no normalization, no type translation. Otherwise the statement is rebuilt from the
 * introspected columns, primary key, indexes and foreign keys in the layout MySQL itself uses.
 * Emission is pure, so emitting the same definition twice yields identical text.
 * </p>
 *
 * <p>
 * Statements are returned without the trailing {@code ;}; terminators are the dump writer's job.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DdlEmitter {

    /**
     * Returns the create statement of a table.
     *
     * @param table table definition
     * @return create statement without terminator
     */
    public String emit(TableSchema table) {
        if (StringUtils.isNotBlank(table.getCreateStatement())) {
            return table.getCreateStatement();
        }
        return reconstruct(table);
    }

    /**
     * Returns the statement that removes an existing table before it is recreated.
     *
     * @param table table definition
     * @return drop statement without terminator
     */
    public String emitDrop(TableSchema table) {
        return "DROP TABLE IF EXISTS " + MySqlDialect.quoteIdentifier(table.getName());
    }

    private String reconstruct(TableSchema table) {
        List<String> lines = new ArrayList<>();
        for (Column column : table.getColumns()) {
            lines.add(columnDefinition(column));
        }
        if (!table.getPrimaryKey().isEmpty()) {
            lines.add("PRIMARY KEY " + columnList(table.getPrimaryKey()));
        }
        for (IndexDef index : table.getIndexes()) {
            lines.add((index.isUnique() ? "UNIQUE KEY " : "KEY ")
                    + MySqlDialect.quoteIdentifier(index.getName()) + " "
                    + columnList(index.getColumns()));
        }
        for (ForeignKeyDef fk : table.getForeignKeys()) {
            lines.add(foreignKeyDefinition(table, fk));
        }
        return "CREATE TABLE " + MySqlDialect.quoteIdentifier(table.getName()) + " (\n  "
                + String.join(",\n  ", lines) + "\n)";
    }

    private String columnDefinition(Column column) {
        StringBuilder sb = new StringBuilder(MySqlDialect.quoteIdentifier(column.getName()))
                .append(' ').append(column.getColumnType());
        if (column.isGenerated() && StringUtils.isNotBlank(column.getGenerationExpression())) {
            boolean stored = column.getExtra().toUpperCase(Locale.ROOT).contains("STORED")
                    || column.getExtra().toUpperCase(Locale.ROOT).contains("PERSISTENT");
            sb.append(" GENERATED ALWAYS AS (").append(column.getGenerationExpression())
                    .append(stored ? ") STORED" : ") VIRTUAL");
            if (!column.isNullable()) {
                sb.append(" NOT NULL");
            }
            return sb.toString();
        }
        sb.append(column.isNullable() ? "" : " NOT NULL");
        String defaultClause = defaultClause(column);
        if (defaultClause != null) {
            sb.append(' ').append(defaultClause);
        }
        String extra = extraAttributes(column.getExtra());
        if (!extra.isEmpty()) {
            sb.append(' ').append(extra);
        }
        return sb.toString();
    }

    private String defaultClause(Column column) {
        String value = column.getDefaultValue();
        if (value == null) {
            return column.isNullable() ? "DEFAULT NULL" : null;
        }
        String extra = StringUtils.defaultString(column.getExtra()).toUpperCase(Locale.ROOT);
        String upper = value.toUpperCase(Locale.ROOT);
        if (extra.contains("DEFAULT_GENERATED")) {
            if (upper.startsWith("CURRENT_TIMESTAMP") || upper.startsWith("NOW(")) {
                return "DEFAULT " + value;
            }
            return "DEFAULT (" + value + ")";
        }
        if (MySqlDialect.classify(column.getDataType()) == ValueKind.NUMBER
                || upper.equals("NULL") || upper.startsWith("B'")
                || upper.startsWith("CURRENT_TIMESTAMP")) {
            return "DEFAULT " + value;
        }
        // MariaDB stores character defaults already quoted.
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return "DEFAULT " + value;
        }
        return "DEFAULT " + MySqlDialect.quoteString(value);
    }

    private String extraAttributes(String extra) {
        if (StringUtils.isBlank(extra)) {
            return "";
        }
        return StringUtils.normalizeSpace(extra.replace("DEFAULT_GENERATED", ""))
                .toUpperCase(Locale.ROOT);
    }

    private String foreignKeyDefinition(TableSchema table, ForeignKeyDef fk) {
        String referenced = MySqlDialect.quoteIdentifier(fk.getReferencedTable());
        if (fk.getReferencedSchema() != null
                && !fk.getReferencedSchema().equalsIgnoreCase(table.getSchema())) {
            referenced = MySqlDialect.quoteIdentifier(fk.getReferencedSchema()) + "."
                    + referenced;
        }
        StringBuilder sb = new StringBuilder("CONSTRAINT ")
                .append(MySqlDialect.quoteIdentifier(fk.getName())).append(" FOREIGN KEY ")
                .append(columnList(fk.getColumns())).append(" REFERENCES ").append(referenced)
                .append(' ').append(columnList(fk.getReferencedColumns()));
        appendRule(sb, "ON DELETE", fk.getDeleteRule());
        appendRule(sb, "ON UPDATE", fk.getUpdateRule());
        return sb.toString();
    }

    private void appendRule(StringBuilder sb, String clause, String rule) {
        // RESTRICT and NO ACTION are the server default and are omitted like SHOW CREATE does.
        if (rule == null || "RESTRICT".equalsIgnoreCase(rule)
                || "NO ACTION".equalsIgnoreCase(rule)) {
            return;
        }
        sb.append(' ').append(clause).append(' ').append(rule.toUpperCase(Locale.ROOT));
    }

    private String columnList(List<String> columns) {
        return columns.stream().map(MySqlDialect::quoteIdentifier)
                .collect(Collectors.joining(",", "(", ")"));
    }
}
