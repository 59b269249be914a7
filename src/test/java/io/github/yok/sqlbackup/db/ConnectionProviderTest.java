package io.github.yok.sqlbackup.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sqlbackup.config.ConnectionConfig;
import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.exception.ConnectionException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

class ConnectionProviderTest {

    private DatabaseEndpoint endpoint;

    @BeforeEach
    void setup() throws Exception {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("db1");
        entry.setHost("db.local");
        entry.setUser("backup");
        entry.setPassword("pw");
        entry.setDatabase("appdb");
        endpoint = DatabaseEndpoint.from(entry);
    }

    @Test
    void open_正常ケース_接続に成功する_セッションが初期化されて返ること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            dm.when(() -> DriverManager.getConnection(endpoint.toJdbcUrl(), "backup", "pw"))
                    .thenReturn(conn);

            Session session = new ConnectionProvider().open(endpoint);

            assertEquals("appdb", session.getDatabase());
            verify(st).execute("SET time_zone = '+00:00'");
        }
    }

    @Test
    void open_異常ケース_認証に失敗する_接続先を含むConnectionExceptionが送出されること() {
        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            SQLException cause = new SQLException("Access denied for user 'backup'");
            dm.when(() -> DriverManager.getConnection(anyString(), anyString(), anyString()))
                    .thenThrow(cause);

            ConnectionException ex = assertThrows(ConnectionException.class,
                    () -> new ConnectionProvider().open(endpoint));
            assertEquals("db.local:3306/appdb", ex.getTarget());
            assertSame(cause, ex.getCause());
        }
    }

    @Test
    void open_異常ケース_セッション初期化に失敗する_接続が閉じられ例外が送出されること()
            throws Exception {
        Connection conn = mock(Connection.class);
        when(conn.createStatement()).thenThrow(new SQLException("server gone"));
        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            dm.when(() -> DriverManager.getConnection(anyString(), anyString(), anyString()))
                    .thenReturn(conn);

            assertThrows(ConnectionException.class, () -> new ConnectionProvider().open(endpoint));
            verify(conn).close();
        }
    }
}
