package io.github.yok.sqlbackup.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class DdlEmitterTest {

    private final DdlEmitter emitter = new DdlEmitter();

    @Test
    void emit_正常ケース_サーバのCREATE文がある_そのまま返ること() {
        String create = "CREATE TABLE `users` (\n  `id` int NOT NULL,\n  PRIMARY KEY (`id`)\n)"
                + " ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
        TableSchema table = TableSchema.builder().schema("appdb").name("users")
                .column(Column.builder().name("id").columnType("int").dataType("int").build())
                .createStatement(create).build();

        assertEquals(create, emitter.emit(table));
        assertEquals(emitter.emit(table), emitter.emit(table));
    }

    @Test
    void emit_正常ケース_CREATE文がない_メタデータから再構成されること() {
        TableSchema table = TableSchema.builder().schema("appdb").name("posts")
                .column(Column.builder().name("id").columnType("bigint unsigned")
                        .dataType("bigint").extra("auto_increment").ordinalPosition(1).build())
                .column(Column.builder().name("user_id").columnType("int").dataType("int")
                        .nullable(true).ordinalPosition(2).build())
                .column(Column.builder().name("title").columnType("varchar(200)")
                        .dataType("varchar").defaultValue("untitled").ordinalPosition(3).build())
                .column(Column.builder().name("created_at").columnType("datetime")
                        .dataType("datetime").defaultValue("CURRENT_TIMESTAMP")
                        .extra("DEFAULT_GENERATED").ordinalPosition(4).build())
                .column(Column.builder().name("title_len").columnType("int").dataType("int")
                        .nullable(true).extra("STORED GENERATED")
                        .generationExpression("char_length(`title`)").ordinalPosition(5)
                        .build())
                .primaryKeyColumn("id")
                .index(IndexDef.builder().name("idx_user").column("user_id").build())
                .index(IndexDef.builder().name("uk_title").unique(true).column("title").build())
                .foreignKey(ForeignKeyDef.builder().name("fk_posts_user").column("user_id")
                        .referencedSchema("appdb").referencedTable("users")
                        .referencedColumn("id").updateRule("RESTRICT").deleteRule("CASCADE")
                        .build())
                .build();

        String expected = "CREATE TABLE `posts` (\n"
                + "  `id` bigint unsigned NOT NULL AUTO_INCREMENT,\n"
                + "  `user_id` int DEFAULT NULL,\n"
                + "  `title` varchar(200) NOT NULL DEFAULT 'untitled',\n"
                + "  `created_at` datetime NOT NULL DEFAULT CURRENT_TIMESTAMP,\n"
                + "  `title_len` int GENERATED ALWAYS AS (char_length(`title`)) STORED,\n"
                + "  PRIMARY KEY (`id`),\n"
                + "  KEY `idx_user` (`user_id`),\n"
                + "  UNIQUE KEY `uk_title` (`title`),\n"
                + "  CONSTRAINT `fk_posts_user` FOREIGN KEY (`user_id`) REFERENCES `users` (`id`)"
                + " ON DELETE CASCADE\n"
                + ")";
        assertEquals(expected, emitter.emit(table));
        assertEquals(emitter.emit(table), emitter.emit(table));
    }

    @Test
    void emit_正常ケース_他スキーマを参照するFKがある_スキーマ修飾されること() {
        TableSchema table = TableSchema.builder().schema("appdb").name("orders")
                .column(Column.builder().name("cid").columnType("int").dataType("int").build())
                .foreignKey(ForeignKeyDef.builder().name("fk_ext").column("cid")
                        .referencedSchema("crm").referencedTable("customers")
                        .referencedColumn("id").updateRule("NO ACTION").deleteRule("SET NULL")
                        .build())
                .build();

        assertEquals("CREATE TABLE `orders` (\n  `cid` int NOT NULL,\n"
                + "  CONSTRAINT `fk_ext` FOREIGN KEY (`cid`) REFERENCES `crm`.`customers` (`id`)"
                + " ON DELETE SET NULL\n)", emitter.emit(table));
    }

    @Test
    void emitDrop_正常ケース_テーブル名を指定する_DROP文が返ること() {
        TableSchema table = TableSchema.builder().schema("appdb").name("odd`name").build();
        assertEquals("DROP TABLE IF EXISTS `odd``name`", emitter.emitDrop(table));
    }
}
