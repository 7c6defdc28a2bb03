package io.github.yok.drupaldblink.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.content.DrupalContentRepository;
import io.github.yok.drupaldblink.core.CrossTableSearchEngine;
import io.github.yok.drupaldblink.core.DbManager;
import io.github.yok.drupaldblink.core.QueryResult;
import io.github.yok.drupaldblink.core.ResultNormalizer;
import io.github.yok.drupaldblink.core.SchemaIntrospector;
import io.github.yok.drupaldblink.core.SearchFinding;
import io.github.yok.drupaldblink.db.DatabaseDriver;
import io.github.yok.drupaldblink.db.NormalizedRow;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests against a MySQL container.
 *
 * <p>
 * Covers: session setup, templated queries, catalog introspection, cross-table search and binary
 * normalization.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
public class MySqlIntegrationTest {

    @Container
    private static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("drupal").withUsername("drupal").withPassword("drupal");

    private DbManager manager;

    @BeforeEach
    public void setup() {
        DatabaseConfig config = DatabaseConfig.builder().driver(DatabaseDriver.MYSQL)
                .host(mysql.getHost()).port(mysql.getMappedPort(MySQLContainer.MYSQL_PORT))
                .database("drupal").username("drupal").password("drupal").prefix("dr_")
                .driverOptions(Map.of("useSSL", "false", "allowPublicKeyRetrieval", "true"))
                .build();
        manager = new DbManager(config);
        for (String sql : List.of("DROP TABLE IF EXISTS {t}", "DROP TABLE IF EXISTS {blobs}",
                "DROP TABLE IF EXISTS other_t",
                "CREATE TABLE {t} (id INT PRIMARY KEY, name VARCHAR(50), value VARCHAR(50))",
                "CREATE TABLE {blobs} (id INT PRIMARY KEY, data VARBINARY(16))",
                "CREATE TABLE other_t (id INT PRIMARY KEY, name VARCHAR(50))",
                "INSERT INTO other_t VALUES (1, 'foo')")) {
            assertFalse(manager.execute(sql, Collections.emptyList()).isFailed(), sql);
        }
    }

    @AfterEach
    public void teardown() {
        manager.close();
    }

    @Test
    public void execute_正常ケース_挿入した行を取得する_正規化された値が返ること() {
        QueryResult inserted = manager.execute(
                "INSERT INTO {t} (id, name, value) VALUES (?, ?, ?)", List.of(1, "foo", "bar"));
        assertEquals(1, inserted.getUpdateCount());

        NormalizedRow row = manager.execute("SELECT * FROM {t} WHERE id = ?", List.of(1), true)
                .getSingleRow().orElseThrow();

        assertEquals(List.of("id", "name", "value"), row.getColumnNames());
        assertEquals(1L, row.get("id"));
        assertEquals("foo", row.get("name"));
        assertEquals("bar", row.get("value"));
    }

    @Test
    public void listTables_正常ケース_接頭辞付きテーブルのみ_論理名で返りスキーマを取得できること() {
        SchemaIntrospector introspector =
                new SchemaIntrospector(manager, manager.getDialect(), manager.getTemplater());

        List<String> tables = introspector.listTables().orElseThrow();

        assertTrue(tables.containsAll(List.of("t", "blobs")));
        assertFalse(tables.contains("other_t"));
        for (String table : tables) {
            assertTrue(introspector.getTableSchema(table).isPresent(), table);
        }
        Map<String, String> schema = introspector.getTableSchema("t").orElseThrow();
        assertEquals(List.of("id", "name", "value"), List.copyOf(schema.keySet()));
        assertTrue(introspector.isTextLike(schema.get("name")));
        assertFalse(introspector.isTextLike(schema.get("id")));
    }

    @Test
    public void searchAllTables_正常ケース_1列に一致する_行数上限内で1件検出されること() {
        manager.execute("INSERT INTO {t} (id, name, value) VALUES (1, 'foo', 'bar'), "
                + "(2, 'FOOD', 'baz'), (3, 'xfoox', 'qux')", Collections.emptyList());
        SchemaIntrospector introspector =
                new SchemaIntrospector(manager, manager.getDialect(), manager.getTemplater());
        CrossTableSearchEngine engine =
                new CrossTableSearchEngine(manager, introspector, manager.getDialect());

        List<SearchFinding> findings = engine.searchAllTables("foo", 2);

        assertEquals(1, findings.size());
        assertEquals("t", findings.get(0).getTableName());
        assertEquals("name", findings.get(0).getColumnName());
        assertEquals(2, findings.get(0).getMatchingRows().size());
    }

    @Test
    public void searchTable_正常ケース_バイナリ照合順序の列_大文字小文字を区別せず一致すること() {
        for (String sql : List.of("DROP TABLE IF EXISTS {cs}",
                "CREATE TABLE {cs} (id INT PRIMARY KEY, name VARCHAR(50) COLLATE utf8mb4_bin)",
                "INSERT INTO {cs} VALUES (1, 'FOO'), (2, 'bar')")) {
            assertFalse(manager.execute(sql, Collections.emptyList()).isFailed(), sql);
        }
        SchemaIntrospector introspector =
                new SchemaIntrospector(manager, manager.getDialect(), manager.getTemplater());
        CrossTableSearchEngine engine =
                new CrossTableSearchEngine(manager, introspector, manager.getDialect());

        List<SearchFinding> findings = engine.searchTable("cs", "foo", 10);

        assertEquals(1, findings.size());
        assertEquals("FOO", findings.get(0).getMatchingRows().get(0).get("name"));
    }

    @Test
    public void execute_正常ケース_バックスラッシュでエスケープした引用符を含む_後続の参照とパラメータが展開されること() {
        manager.execute("INSERT INTO {t} (id, name) VALUES (1, 'O\\'Brien')",
                Collections.emptyList());

        QueryResult result = manager.execute(
                "SELECT id FROM {t} WHERE name = 'O\\'Brien' AND id IN (SELECT id FROM {t}) "
                        + "AND id = :id",
                Map.of("id", 1), true);

        assertFalse(result.isFailed());
        assertEquals(1L, result.getSingleRow().orElseThrow().get("id"));
    }

    @Test
    public void execute_正常ケース_UTF8として不正なバイナリ_代替文字列が返ること() {
        manager.execute("INSERT INTO {blobs} (id, data) VALUES (1, X'FFFE'), (2, X'414243')",
                Collections.emptyList());

        List<NormalizedRow> rows =
                manager.execute("SELECT data FROM {blobs} ORDER BY id", List.of()).getRows();

        assertEquals(ResultNormalizer.UNDECODABLE_BINARY, rows.get(0).get("data"));
        assertEquals("ABC", rows.get(1).get("data"));
    }

    @Test
    public void getUserById_正常ケース_複数ロールを持つユーザー_ロールが連結されること() {
        for (String sql : List.of("DROP TABLE IF EXISTS {users_field_data}",
                "DROP TABLE IF EXISTS {user__roles}",
                "CREATE TABLE {users_field_data} (uid INT, name VARCHAR(60), mail VARCHAR(254), "
                        + "status TINYINT, created INT, changed INT, langcode VARCHAR(12))",
                "CREATE TABLE {user__roles} (entity_id INT, roles_target_id VARCHAR(32))",
                "INSERT INTO {users_field_data} VALUES (1, 'admin', 'a@example.com', 1, 0, 0, 'en')",
                "INSERT INTO {user__roles} VALUES (1, 'editor'), (1, 'administrator')")) {
            assertFalse(manager.execute(sql, Collections.emptyList()).isFailed(), sql);
        }
        DrupalContentRepository repository =
                new DrupalContentRepository(manager, manager.getDialect());

        NormalizedRow user = repository.getUserById(1L).getSingleRow().orElseThrow();

        assertEquals("admin", user.get("name"));
        assertEquals(List.of("administrator", "editor"),
                Stream.of(String.valueOf(user.get("roles")).split(",")).sorted()
                        .collect(Collectors.toList()));
    }
}
