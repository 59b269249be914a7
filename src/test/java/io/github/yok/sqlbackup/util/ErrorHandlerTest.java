package io.github.yok.sqlbackup.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sqlbackup.exception.DumpException;
import io.github.yok.sqlbackup.exception.RestoreException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom2"));
            assertEquals("boom2", ex2.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_DumpExceptionを指定する_種別とテーブルが標準エラーへ出力されること() {
        String message = captureStdErr(() -> ErrorHandler.errorAndExit("Fatal error",
                new DumpException("users", 2000, new SQLException("lost connection"))));
        assertTrue(message.contains("ERROR: Fatal error"));
        assertTrue(message.contains("[DUMP]"));
        assertTrue(message.contains("table=users"));
        assertTrue(message.contains("rowsEmitted=2000"));
    }

    @Test
    void errorAndExit_正常ケース_メッセージのみを指定する_標準エラーへ出力されること() {
        String message = captureStdErr(() -> ErrorHandler.errorAndExit("boom3"));
        assertTrue(message.contains("ERROR: boom3"));
    }

    @Test
    void describe_正常ケース_RestoreExceptionを指定する_テーブルと文番号を含むこと() {
        String text = ErrorHandler.describe(
                new RestoreException("posts", 3, new SQLException("Duplicate entry")));
        assertTrue(text.startsWith("[RESTORE] "));
        assertTrue(text.contains("table=posts, statement=3"));
    }

    @Test
    void describe_正常ケース_テーブルなしRestoreExceptionを指定する_文脈が付与されないこと() {
        String text = ErrorHandler.describe(new RestoreException("Backup file not found: x.sql"));
        assertEquals("[RESTORE] Backup file not found: x.sql", text);
    }

    @Test
    void describe_正常ケース_一般例外を指定する_メッセージのみが返ること() {
        assertEquals("plain", ErrorHandler.describe(new IllegalArgumentException("plain")));
    }

    /**
     * 標準エラー出力を捕捉しながら処理を実行します。
     *
     * @param action 実行する処理
     * @return 標準エラーへ出力された文字列
     */
    private static String captureStdErr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString(StandardCharsets.UTF_8);
    }
}
