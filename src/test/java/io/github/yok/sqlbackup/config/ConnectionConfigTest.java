package io.github.yok.sqlbackup.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.sqlbackup.exception.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

    @Test
    void getEntry_正常ケース_登録済みIDを指定する_該当エントリが返ること() throws Exception {
        ConnectionConfig config = new ConnectionConfig();
        ConnectionConfig.Entry db1 = DatabaseEndpointTest.entry("db1");
        ConnectionConfig.Entry db2 = DatabaseEndpointTest.entry("db2");
        config.setConnections(List.of(db1, db2));

        assertSame(db2, config.getEntry("db2"));
    }

    @Test
    void getEntry_異常ケース_未登録IDを指定する_登録済みIDを含む例外が送出されること() {
        ConnectionConfig config = new ConnectionConfig();
        config.setConnections(
                List.of(DatabaseEndpointTest.entry("db1"), DatabaseEndpointTest.entry("db2")));

        ConfigurationException ex =
                assertThrows(ConfigurationException.class, () -> config.getEntry("dbX"));
        assertEquals("Unknown connection id [dbX]. Configured: [db1, db2]", ex.getMessage());
    }

    @Test
    void getEntry_異常ケース_接続定義がない_ConfigurationExceptionが送出されること() {
        ConnectionConfig config = new ConnectionConfig();
        ConfigurationException ex =
                assertThrows(ConfigurationException.class, () -> config.getEntry("db1"));
        assertEquals("No connections are configured.", ex.getMessage());
    }
}
