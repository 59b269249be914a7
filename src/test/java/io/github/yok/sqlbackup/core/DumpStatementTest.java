package io.github.yok.sqlbackup.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class DumpStatementTest {

    @Test
    void classify_正常ケース_先頭キーワードで判定する_種別が返ること() {
        assertEquals(StatementKind.SESSION, DumpStatement.classify("SET NAMES utf8mb4"));
        assertEquals(StatementKind.SESSION, DumpStatement.classify("  set\ttime_zone = '+00:00'"));
        assertEquals(StatementKind.DATA, DumpStatement.classify("INSERT INTO `t` VALUES (1)"));
        assertEquals(StatementKind.DDL, DumpStatement.classify("CREATE TABLE `t` (id int)"));
        assertEquals(StatementKind.DDL, DumpStatement.classify("DROP TABLE IF EXISTS `t`"));
        assertEquals(StatementKind.DDL, DumpStatement.classify("SETTINGS_TABLE_LIKE x"));
    }
}
