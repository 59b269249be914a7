package io.github.yok.sqlbackup.db;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionTest {

    private Connection conn;

    @BeforeEach
    void setup() throws Exception {
        conn = mock(Connection.class);
        when(conn.getAutoCommit()).thenReturn(true);
    }

    @Test
    void commit_正常ケース_コミットしてcloseする_ロールバックされずautoCommitが復元されること()
            throws Exception {
        try (Transaction tx = new Transaction(conn)) {
            verify(conn).setAutoCommit(false);
            tx.commit();
            assertTrue(tx.isCommitted());
        }
        verify(conn).commit();
        verify(conn, never()).rollback();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void close_正常ケース_コミットせずcloseする_ロールバックされること() throws Exception {
        Transaction tx = new Transaction(conn);
        assertFalse(tx.isCommitted());
        tx.close();
        verify(conn).rollback();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void commit_異常ケース_二重にコミットする_IllegalStateExceptionが送出されること()
            throws Exception {
        try (Transaction tx = new Transaction(conn)) {
            tx.commit();
            assertThrows(IllegalStateException.class, tx::commit);
        }
    }

    @Test
    void close_異常ケース_ロールバックが失敗する_例外を送出せずautoCommitが復元されること()
            throws Exception {
        doThrow(new SQLException("connection lost")).when(conn).rollback();
        Transaction tx = new Transaction(conn);
        assertDoesNotThrow(tx::close);
        verify(conn).setAutoCommit(true);
    }
}
