package io.github.yok.sqlbackup.db;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTest {

    private Connection conn;
    private Session session;

    @BeforeEach
    void setup() {
        conn = mock(Connection.class);
        session = new Session(conn, "appdb");
    }

    @Test
    void execute_正常ケース_更新文を実行する_更新件数が返ること() throws Exception {
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        when(st.execute("DELETE FROM `t`")).thenReturn(false);
        when(st.getUpdateCount()).thenReturn(4);

        assertEquals(4, session.execute("DELETE FROM `t`"));
        verify(st).close();
    }

    @Test
    void query_正常ケース_パラメータを指定する_バインドされ全行が変換されること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.prepareStatement("SELECT x")).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getString(1)).thenReturn("a", "b");

        List<String> rows = session.query("SELECT x", List.of("appdb"), r -> r.getString(1));

        assertEquals(List.of("a", "b"), rows);
        verify(ps).setString(1, "appdb");
        verify(rs).close();
        verify(ps).close();
    }

    @Test
    void streamingCursor_正常ケース_SELECTを実行する_ストリーミング設定で読み出せること()
            throws Exception {
        Statement st = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(conn.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY))
                .thenReturn(st);
        when(st.executeQuery("SELECT `id`, `name`, `data` FROM `t`")).thenReturn(rs);
        when(rs.next()).thenReturn(true, false);
        when(rs.getString(1)).thenReturn("7");
        when(rs.getString(2)).thenReturn(null);
        when(rs.getBytes(3)).thenReturn(new byte[] {0x0A});

        try (RowCursor cursor = session.streamingCursor("SELECT `id`, `name`, `data` FROM `t`",
                List.of(ValueKind.NUMBER, ValueKind.STRING, ValueKind.BINARY))) {
            RowTuple row = cursor.next();
            assertEquals(SqlValue.ofNumber("7"), row.get(0));
            assertTrue(row.get(1).isNull());
            assertArrayEquals(new byte[] {0x0A}, row.get(2).getBytes());
            assertNull(cursor.next());
        }
        verify(st).setFetchSize(Integer.MIN_VALUE);
        verify(rs).close();
        verify(st).close();
    }

    @Test
    void streamingCursor_異常ケース_SELECTが失敗する_Statementが閉じられ例外が伝播すること()
            throws Exception {
        Statement st = mock(Statement.class);
        when(conn.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY))
                .thenReturn(st);
        when(st.executeQuery("SELECT 1")).thenThrow(new SQLException("no such table"));

        assertThrows(SQLException.class,
                () -> session.streamingCursor("SELECT 1", List.of(ValueKind.NUMBER)));
        verify(st).close();
    }

    @Test
    void close_正常ケース_セッションを閉じる_接続が閉じられること() throws Exception {
        session.close();
        verify(conn).close();
        assertEquals("appdb", session.getDatabase());
    }
}
