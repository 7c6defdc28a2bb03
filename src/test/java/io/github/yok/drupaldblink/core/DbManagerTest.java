package io.github.yok.drupaldblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.drupaldblink.config.ConfigIncompleteException;
import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.db.ConnectionFactory;
import io.github.yok.drupaldblink.db.ConnectionFailureException;
import io.github.yok.drupaldblink.db.DatabaseDriver;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.DbDialectHandlerFactory;
import io.github.yok.drupaldblink.db.NormalizedRow;
import io.github.yok.drupaldblink.db.UnsupportedDriverException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbManagerTest {

    private DbManager manager;

    @BeforeEach
    void setup() {
        manager = H2TestSupport.newManager(DatabaseDriver.MYSQL, "dr_");
        QueryResult created = manager.execute(
                "CREATE TABLE {t} (id INT PRIMARY KEY, name VARCHAR(50), value VARCHAR(50))",
                Collections.emptyList());
        assertFalse(created.isFailed());
    }

    @AfterEach
    void teardown() {
        manager.close();
    }

    @Test
    void constructor_正常ケース_有効な設定を指定する_接続済みでハンドラとテンプレートが設定されること() {
        assertTrue(manager.isConnected());
        assertEquals(DatabaseDriver.MYSQL, manager.getDialect().getDriver());
        assertEquals("dr_", manager.getTemplater().getPrefix());
        assertEquals("drupal", manager.getConfig().getDatabase());
    }

    @Test
    void constructor_異常ケース_必須項目が不足する_ConfigIncompleteExceptionが送出され接続しないこと()
            throws Exception {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        DatabaseConfig config = DatabaseConfig.builder().driver(DatabaseDriver.MYSQL)
                .host("localhost").port(3306).username("u").password("p").build();

        ConfigIncompleteException ex = assertThrows(ConfigIncompleteException.class,
                () -> new DbManager(config, new DbDialectHandlerFactory(), factory));

        assertEquals(List.of("database"), ex.getMissingFields());
        verify(factory, never()).open(any(), any());
    }

    @Test
    void constructor_異常ケース_ドライバが未設定_ConfigIncompleteExceptionが送出されること() {
        DatabaseConfig config = DatabaseConfig.builder().host("h").port(1).database("d")
                .username("u").password("p").build();
        ConfigIncompleteException ex = assertThrows(ConfigIncompleteException.class,
                () -> new DbManager(config, new DbDialectHandlerFactory(),
                        mock(ConnectionFactory.class)));
        assertEquals(List.of("driver"), ex.getMissingFields());
    }

    @Test
    void constructor_異常ケース_ハンドラ生成に失敗する_UnsupportedDriverExceptionが送出されること() {
        DbDialectHandlerFactory handlerFactory = mock(DbDialectHandlerFactory.class);
        when(handlerFactory.create(any())).thenThrow(new UnsupportedDriverException("mysql"));

        assertThrows(UnsupportedDriverException.class,
                () -> new DbManager(H2TestSupport.config(DatabaseDriver.MYSQL, ""), handlerFactory,
                        mock(ConnectionFactory.class)));
    }

    @Test
    void constructor_異常ケース_接続が拒否される_ConnectionFailureExceptionにドライバのメッセージが含まれること()
            throws Exception {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        SQLException refused = new SQLException("Access denied for user 'sa'", "28000", 1045);
        when(factory.open(any(), any())).thenThrow(refused);

        ConnectionFailureException ex = assertThrows(ConnectionFailureException.class,
                () -> new DbManager(H2TestSupport.config(DatabaseDriver.MYSQL, ""),
                        new DbDialectHandlerFactory(), factory));

        assertSame(refused, ex.getCause());
        assertTrue(ex.getMessage().contains("Access denied for user 'sa'"));
        assertTrue(ex.getMessage().contains("password=***"));
    }

    @Test
    void constructor_異常ケース_セッション初期化に失敗する_接続が閉じられConnectionFailureExceptionが送出されること()
            throws Exception {
        Connection conn = mock(Connection.class);
        DbDialectHandler dialect = mock(DbDialectHandler.class);
        when(dialect.getDriver()).thenReturn(DatabaseDriver.ORACLE);
        doThrow(new SQLException("ORA-12345")).when(dialect).prepareConnection(conn);
        DbDialectHandlerFactory handlerFactory = mock(DbDialectHandlerFactory.class);
        when(handlerFactory.create(any())).thenReturn(dialect);

        assertThrows(ConnectionFailureException.class,
                () -> new DbManager(H2TestSupport.config(DatabaseDriver.ORACLE, ""),
                        handlerFactory, (c, d) -> conn));

        verify(conn).close();
    }

    @Test
    void execute_正常ケース_INSERTを実行する_更新件数付きのNO_RESULT_SETが返ること() {
        QueryResult result =
                manager.execute("INSERT INTO {t} (id, name, value) VALUES (?, ?, ?)",
                        List.of(1, "foo", "bar"));

        assertEquals(QueryResult.Status.NO_RESULT_SET, result.getStatus());
        assertEquals(1, result.getUpdateCount());
        assertTrue(result.getRows().isEmpty());
    }

    @Test
    void execute_正常ケース_挿入した行をfetchOneで取得する_同じ値の行が返ること() {
        manager.execute("INSERT INTO {t} (id, name, value) VALUES (?, ?, ?)",
                List.of(1, "foo", "bar"));

        QueryResult result =
                manager.execute("SELECT id, name, value FROM {t} WHERE id = ?", List.of(1), true);

        assertEquals(QueryResult.Status.ROWS, result.getStatus());
        NormalizedRow row = result.getSingleRow().orElseThrow();
        assertEquals(List.of("id", "name", "value"), row.getColumnNames());
        assertEquals(1L, row.get("id"));
        assertEquals("foo", row.get("name"));
        assertEquals("bar", row.get("value"));
    }

    @Test
    void execute_正常ケース_複数行の中からfetchOneで取得する_1行のみ返ること() {
        manager.execute("INSERT INTO {t} (id, name) VALUES (1, 'a'), (2, 'b'), (3, 'c')",
                Collections.emptyList());

        QueryResult result =
                manager.execute("SELECT id FROM {t} ORDER BY id", (List<?>) null, true);

        assertEquals(1, result.getRows().size());
        assertEquals(1L, result.getRows().get(0).get("id"));
    }

    @Test
    void execute_正常ケース_一致する行がない_空のROWSが返り失敗ではないこと() {
        QueryResult all = manager.execute("SELECT * FROM {t} WHERE id = ?", List.of(99));
        QueryResult one = manager.execute("SELECT * FROM {t} WHERE id = ?", List.of(99), true);

        assertEquals(QueryResult.Status.ROWS, all.getStatus());
        assertTrue(all.getRows().isEmpty());
        assertFalse(one.isFailed());
        assertFalse(one.getSingleRow().isPresent());
    }

    @Test
    void execute_正常ケース_nullパラメータを指定する_NULLとして登録されること() {
        manager.execute("INSERT INTO {t} (id, name, value) VALUES (?, ?, ?)",
                Arrays.asList(5, null, "v"));

        NormalizedRow row = manager
                .execute("SELECT name, value FROM {t} WHERE id = 5", (List<?>) null, true)
                .getSingleRow().orElseThrow();

        assertTrue(row.containsColumn("name"));
        assertEquals(null, row.get("name"));
        assertEquals("v", row.get("value"));
    }

    @Test
    void execute_異常ケース_存在しないテーブルを参照する_FAILEDが返り詳細が含まれること() {
        QueryResult result = manager.execute("SELECT * FROM {missing}", Collections.emptyList());

        assertTrue(result.isFailed());
        QueryFailure failure = result.getFailure().orElseThrow();
        assertNotNull(failure.getSqlState());
        assertTrue(failure.getMessage().toLowerCase().contains("dr_missing"));
        assertTrue(result.getRows().isEmpty());
    }

    @Test
    void execute_正常ケース_名前付きパラメータを指定する_位置パラメータに変換され実行されること() {
        manager.execute("INSERT INTO {t} (id, name, value) VALUES (:id, :name, :name)",
                Map.of("id", 7, "name", "x"));

        QueryResult result = manager.execute("SELECT value FROM {t} WHERE id = :id",
                Map.of("id", 7));

        assertEquals("x", result.getSingleRow().orElseThrow().get("value"));
    }

    @Test
    void execute_異常ケース_名前付きパラメータの値が不足する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.execute("SELECT * FROM {t} WHERE id = :id", new HashMap<>()));
    }

    @Test
    void execute_正常ケース_名前付きパラメータとfetchOneを指定する_1行のみ返ること() {
        manager.execute("INSERT INTO {t} (id, name) VALUES (1, 'a'), (2, 'a'), (3, 'b')",
                Collections.emptyList());

        QueryResult result = manager.execute("SELECT id FROM {t} WHERE name = :name ORDER BY id",
                Map.of("name", "a"), true);

        assertEquals(1, result.getRows().size());
        assertEquals(1L, result.getRows().get(0).get("id"));
    }

    @Test
    void getTemplater_正常ケース_MySQLの方言_バックスラッシュでエスケープした引用符の後の参照が展開されること() {
        String template =
                "SELECT * FROM {t} WHERE name = 'O\\'Brien' AND id IN (SELECT id FROM {t})";

        assertEquals("SELECT * FROM dr_t WHERE name = 'O\\'Brien' AND id IN (SELECT id FROM dr_t)",
                manager.getTemplater().prepareQuery(template));
    }

    @Test
    void execute_正常ケース_PostgreSQLでバックスラッシュで終わるリテラル_後続の参照とパラメータが展開されること() {
        try (DbManager pgsql = H2TestSupport.newManager(DatabaseDriver.PGSQL, "dr_")) {
            pgsql.execute("CREATE TABLE {t} (id INT PRIMARY KEY, name VARCHAR(50))",
                    Collections.emptyList());
            pgsql.execute("INSERT INTO {t} (id, name) VALUES (1, 'a')", Collections.emptyList());

            NormalizedRow row = pgsql.execute("SELECT 'C:\\' AS dir, name FROM {t} WHERE id = :id",
                    Map.of("id", 1), true).getSingleRow().orElseThrow();

            assertEquals("C:\\", row.get("dir"));
            assertEquals("a", row.get("name"));
        }
    }

    @Test
    void close_正常ケース_2回呼び出す_例外が送出されず切断状態になること() {
        manager.close();
        manager.close();
        assertFalse(manager.isConnected());
    }

    @Test
    void execute_正常ケース_close後に実行する_再接続して結果が返ること() {
        manager.execute("INSERT INTO {t} (id, name) VALUES (1, 'kept')", Collections.emptyList());
        manager.close();

        QueryResult result = manager.execute("SELECT name FROM {t}", Collections.emptyList());

        assertFalse(result.isFailed());
        assertEquals("kept", result.getSingleRow().orElseThrow().get("name"));
        assertTrue(manager.isConnected());
    }

    @Test
    void execute_異常ケース_再接続に失敗する_FAILEDが返り再試行されないこと() {
        String url = H2TestSupport.newUrl(DatabaseDriver.PGSQL);
        AtomicInteger opened = new AtomicInteger();
        ConnectionFactory factory = (config, dialect) -> {
            if (opened.incrementAndGet() > 1) {
                throw new SQLException("Connection refused", "08001");
            }
            return DriverManager.getConnection(url, "sa", "");
        };
        DbManager flaky = new DbManager(H2TestSupport.config(DatabaseDriver.PGSQL, ""),
                H2TestSupport.sessionlessHandlers(), factory);
        flaky.close();

        QueryResult result = flaky.execute("SELECT 1", Collections.emptyList());

        assertTrue(result.isFailed());
        assertTrue(result.getFailure().orElseThrow().getMessage().contains("Connection refused"));
        assertEquals(2, opened.get());
    }

    @Test
    void execute_正常ケース_接続が無効になっている_1回再接続して実行されること() throws Exception {
        Connection stale = mock(Connection.class);
        when(stale.isValid(anyInt())).thenReturn(false);
        Connection fresh = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(fresh.isValid(anyInt())).thenReturn(true);
        when(fresh.getAutoCommit()).thenReturn(true);
        when(fresh.prepareStatement(anyString())).thenReturn(ps);
        when(ps.execute()).thenReturn(false);
        when(ps.getUpdateCount()).thenReturn(0);
        ConnectionFactory factory = mock(ConnectionFactory.class);
        when(factory.open(any(), any())).thenReturn(stale, fresh);

        DbManager m = new DbManager(H2TestSupport.config(DatabaseDriver.PGSQL, ""),
                new DbDialectHandlerFactory(), factory);
        QueryResult result = m.execute("DELETE FROM t", Collections.emptyList());

        assertEquals(QueryResult.Status.NO_RESULT_SET, result.getStatus());
        verify(stale).close();
        verify(factory, times(2)).open(any(), any());
    }

    @Test
    void execute_正常ケース_自動コミットが無効な接続_更新後にコミットされること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.isValid(anyInt())).thenReturn(true);
        when(conn.getAutoCommit()).thenReturn(false);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.execute()).thenReturn(false);
        when(ps.getUpdateCount()).thenReturn(3);

        DbManager m = new DbManager(H2TestSupport.config(DatabaseDriver.PGSQL, "dr_"),
                new DbDialectHandlerFactory(), (c, d) -> conn);
        QueryResult result =
                m.execute("UPDATE {t} SET name = ? WHERE value IS NULL", Arrays.asList("n"));

        assertEquals(3, result.getUpdateCount());
        verify(conn).prepareStatement("UPDATE dr_t SET name = ? WHERE value IS NULL");
        verify(ps).setObject(1, "n");
        verify(conn).commit();
    }

    @Test
    void execute_異常ケース_自動コミットが無効な接続で失敗する_ロールバックされること() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.isValid(anyInt())).thenReturn(true);
        when(conn.getAutoCommit()).thenReturn(false);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.execute()).thenThrow(new SQLException("deadlock", "40001", 1213));

        DbManager m = new DbManager(H2TestSupport.config(DatabaseDriver.PGSQL, ""),
                new DbDialectHandlerFactory(), (c, d) -> conn);
        QueryResult result = m.execute("UPDATE t SET x = ?", Collections.singletonList(null));

        QueryFailure failure = result.getFailure().orElseThrow();
        assertEquals("40001", failure.getSqlState());
        assertEquals(1213, failure.getErrorCode());
        verify(ps).setNull(1, Types.NULL);
        verify(conn).rollback();
        verify(conn, never()).commit();
    }

    @Test
    void execute_正常ケース_検証タイムアウトが0_isValidが呼ばれないこと() throws Exception {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.execute()).thenReturn(false);
        DatabaseConfig config = DatabaseConfig.builder().driver(DatabaseDriver.PGSQL).host("h")
                .port(5432).database("d").username("u").password("p").validationTimeoutSeconds(0)
                .build();

        DbManager m = new DbManager(config, new DbDialectHandlerFactory(), (c, d) -> conn);
        m.execute("DELETE FROM t", Collections.emptyList());

        verify(conn, never()).isValid(anyInt());
    }

    @Test
    void execute_異常ケース_queryにnullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class,
                () -> manager.execute(null, Collections.emptyList(), false));
    }
}
