package io.github.yok.sqlbackup.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sqlbackup.config.ConnectionConfig;
import io.github.yok.sqlbackup.config.DatabaseEndpoint;
import io.github.yok.sqlbackup.config.TransactionScope;
import io.github.yok.sqlbackup.db.ConnectionProvider;
import io.github.yok.sqlbackup.db.Session;
import io.github.yok.sqlbackup.db.Transaction;
import io.github.yok.sqlbackup.exception.OperationCancelledException;
import io.github.yok.sqlbackup.exception.RestoreException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class RestoreEngineTest {

    private static final String DUMP = "-- sqlbackup dump\n"
            + "-- Database: `appdb`\n\n"
            + "SET NAMES utf8mb4;\n"
            + "SET FOREIGN_KEY_CHECKS = 0;\n\n"
            + "-- Table: `users`\n"
            + "DROP TABLE IF EXISTS `users`;\n"
            + "CREATE TABLE `users` (`id` int);\n"
            + "INSERT INTO `users` (`id`) VALUES\n(1),\n(2);\n\n"
            + "-- Table: `posts`\n"
            + "DROP TABLE IF EXISTS `posts`;\n"
            + "CREATE TABLE `posts` (`id` int, `body` text);\n"
            + "INSERT INTO `posts` (`id`, `body`) VALUES\n(1, 'a;b');\n\n"
            + "SET FOREIGN_KEY_CHECKS = 1;\n"
            + "-- Dump completed: 2026-10-19 00:00:00 UTC\n";

    @TempDir
    Path tempDir;

    private ConnectionProvider provider;
    private Session session;
    private Transaction usersTx;
    private Transaction postsTx;
    private DatabaseEndpoint endpoint;
    private List<String> executed;

    @BeforeEach
    void setup() throws Exception {
        provider = mock(ConnectionProvider.class);
        session = mock(Session.class);
        usersTx = mock(Transaction.class);
        postsTx = mock(Transaction.class);
        executed = new ArrayList<>();
        when(provider.open(any())).thenReturn(session);
        when(session.beginTransaction()).thenReturn(usersTx, postsTx);
        when(session.execute(anyString())).thenAnswer(inv -> {
            executed.add(inv.getArgument(0));
            return 0;
        });

        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("db1");
        entry.setHost("localhost");
        entry.setUser("u");
        entry.setPassword("p");
        entry.setDatabase("restore_db");
        endpoint = DatabaseEndpoint.from(entry);
    }

    @Test
    void restore_正常ケース_テーブル単位トランザクション_テーブルごとにコミットされること()
            throws Exception {
        Path file = write("full.sql", DUMP);

        RestoreResult result = engine(TransactionScope.TABLE, false).restore("db1", endpoint,
                file, CancellationToken.NONE);

        assertEquals(2, result.getTableCount());
        assertEquals(3, result.getStatementCounts().get("users"));
        assertEquals(3, result.getStatementCounts().get("posts"));
        assertEquals(3, result.getSessionStatements());
        assertFalse(result.isTruncated());
        assertEquals(9, executed.size());
        assertEquals("INSERT INTO `posts` (`id`, `body`) VALUES\n(1, 'a;b')", executed.get(7));

        InOrder order = inOrder(session, usersTx, postsTx);
        order.verify(session).execute("SET FOREIGN_KEY_CHECKS = 0");
        order.verify(session).beginTransaction();
        order.verify(session).execute("INSERT INTO `users` (`id`) VALUES\n(1),\n(2)");
        order.verify(usersTx).commit();
        order.verify(session).beginTransaction();
        order.verify(postsTx).commit();
        order.verify(session).execute("SET FOREIGN_KEY_CHECKS = 1");
        verify(session).close();
    }

    @Test
    void restore_正常ケース_ファイル単位トランザクション_最後に一度だけコミットされること()
            throws Exception {
        Path file = write("full.sql", DUMP);

        RestoreResult result = engine(TransactionScope.FILE, false).restore("db1", endpoint,
                file, CancellationToken.NONE);

        assertEquals(2, result.getTableCount());
        verify(session, times(1)).beginTransaction();
        verify(usersTx, times(1)).commit();
        verify(postsTx, never()).commit();
    }

    @Test
    void restore_異常ケース_途中の文が失敗する_テーブルと文番号を持つ例外で停止しロールバックされること()
            throws Exception {
        Path file = write("full.sql", DUMP);
        when(session.execute("CREATE TABLE `posts` (`id` int, `body` text)"))
                .thenThrow(new SQLException("Table 'posts' already exists"));

        RestoreException ex = assertThrows(RestoreException.class,
                () -> engine(TransactionScope.TABLE, false).restore("db1", endpoint, file,
                        CancellationToken.NONE));

        assertEquals("posts", ex.getTable());
        assertEquals(2, ex.getStatementIndex());
        verify(usersTx).commit();
        verify(postsTx, never()).commit();
        verify(postsTx).close();
        verify(session, never()).execute("INSERT INTO `posts` (`id`, `body`) VALUES\n(1, 'a;b')");
        verify(session).close();
    }

    @Test
    void restore_異常ケース_テーブル境界で取消される_完了テーブル数を持つ例外が送出されること()
            throws Exception {
        Path file = write("full.sql", DUMP);
        CancellationToken token = new CancellationToken();
        when(session.execute("INSERT INTO `users` (`id`) VALUES\n(1),\n(2)")).thenAnswer(inv -> {
            token.cancel();
            return 2;
        });

        OperationCancelledException ex = assertThrows(OperationCancelledException.class,
                () -> engine(TransactionScope.TABLE, false).restore("db1", endpoint, file,
                        token));

        assertEquals(1, ex.getCompletedTables());
        verify(usersTx).commit();
        verify(session, times(1)).beginTransaction();
    }

    @Test
    void restore_異常ケース_ファイルが存在しない_RestoreExceptionが送出され接続しないこと()
            throws Exception {
        RestoreException ex = assertThrows(RestoreException.class,
                () -> engine(TransactionScope.TABLE, false).restore("db1", endpoint,
                        tempDir.resolve("missing.sql"), CancellationToken.NONE));
        assertTrue(ex.getMessage().startsWith("Backup file not found"));
        verify(provider, never()).open(any());
    }

    @Test
    void restore_異常ケース_完了トレーラーがない_既定では拒否されること() throws Exception {
        Path file = write("partial.sql",
                DUMP.substring(0, DUMP.indexOf("SET FOREIGN_KEY_CHECKS = 1")));

        RestoreException ex = assertThrows(RestoreException.class,
                () -> engine(TransactionScope.TABLE, false).restore("db1", endpoint, file,
                        CancellationToken.NONE));
        assertTrue(ex.getMessage().contains("truncated"));
        verify(provider, never()).open(any());
    }

    @Test
    void restore_正常ケース_切り詰めを許可する_完全な文のみ復元されること() throws Exception {
        String partial = DUMP.substring(0, DUMP.indexOf("(1, 'a;b');"));
        Path file = write("partial.sql", partial);

        RestoreResult result = engine(TransactionScope.TABLE, true).restore("db1", endpoint,
                file, CancellationToken.NONE);

        assertTrue(result.isTruncated());
        assertEquals(3, result.getStatementCounts().get("users"));
        assertEquals(2, result.getStatementCounts().get("posts"));
        verify(postsTx).commit();
    }

    private RestoreEngine engine(TransactionScope scope, boolean allowTruncated) {
        return new RestoreEngine(provider, scope, allowTruncated);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
