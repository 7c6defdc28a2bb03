package io.github.yok.drupaldblink.db.mysql;

import com.google.common.collect.ImmutableSet;
import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.db.DatabaseDriver;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.NormalizedRow;
import io.github.yok.drupaldblink.db.SqlStatement;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MySQL / MariaDB dialect handler.
 *
 * <ul>
 * <li>Identifiers are quoted with backticks.</li>
 * <li>Tables are listed with {@code SHOW TABLES}; the table name is the first (and only relevant)
 * column, whose label depends on the database name ({@code Tables_in_<db>}).</li>
 * <li>Columns are described with {@code SHOW COLUMNS FROM}, which cannot take a bind parameter;
 * the table name is validated by the caller before it is interpolated.</li>
 * <li>Row limiting uses a trailing {@code LIMIT ?}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler implements DbDialectHandler {

    private static final Set<String> TEXT_LIKE_TYPES = ImmutableSet.of("char", "varchar",
            "tinytext", "text", "mediumtext", "longtext", "enum", "set");

    @Override
    public DatabaseDriver getDriver() {
        return DatabaseDriver.MYSQL;
    }

    @Override
    public String getDriverClassName() {
        return "com.mysql.cj.jdbc.Driver";
    }

    /**
     * Builds a MySQL JDBC URL.
     *
     * @param config database configuration
     * @return {@code jdbc:mysql://host:port/database}
     */
    @Override
    public String buildJdbcUrl(DatabaseConfig config) {
        return "jdbc:mysql://" + config.getHost() + ":" + config.getPort() + "/"
                + config.getDatabase();
    }

    /**
     * Applies MySQL session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES utf8mb4");
        }
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public boolean supportsBackslashEscapes() {
        return true;
    }

    @Override
    public String getListTablesSql() {
        return "SHOW TABLES";
    }

    /**
     * Both sides are upper-cased so the match ignores case under {@code _bin} and {@code _cs}
     * collations as well.
     */
    @Override
    public SqlStatement buildColumnSearch(String physicalTable, String column, String pattern,
            int limit) {
        String sql = "SELECT * FROM " + quoteIdentifier(physicalTable) + " WHERE UPPER("
                + quoteIdentifier(column) + ") LIKE UPPER(?) LIMIT ?";
        return SqlStatement.of(sql, pattern, limit);
    }

    @Override
    public String buildStringAggregate(String expression, String alias) {
        return "GROUP_CONCAT(DISTINCT " + expression + ") AS " + alias;
    }

    @Override
    public Optional<String> extractTableName(NormalizedRow row) {
        return row.getFirst().map(String::valueOf);
    }

    /**
     * Builds {@code SHOW COLUMNS FROM `table`} (equivalent to {@code DESCRIBE}).
     *
     * @param physicalTable validated table name
     * @return schema statement without parameters
     */
    @Override
    public SqlStatement buildTableSchemaQuery(String physicalTable) {
        return SqlStatement.of("SHOW COLUMNS FROM " + quoteIdentifier(physicalTable));
    }

    @Override
    public Optional<Map.Entry<String, String>> extractColumnDefinition(NormalizedRow row) {
        Optional<Object> field = row.getIgnoreCase("Field");
        Optional<Object> type = row.getIgnoreCase("Type");
        if (field.isEmpty() || type.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SimpleImmutableEntry<>(String.valueOf(field.get()),
                String.valueOf(type.get())));
    }

    @Override
    public Set<String> getTextLikeTypes() {
        return TEXT_LIKE_TYPES;
    }
}
