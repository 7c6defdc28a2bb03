package io.github.yok.drupaldblink.db.sqlserver;

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
 * SQL Server dialect handler.
 *
 * <p>
 * Identifiers are quoted with square brackets. Row limiting is a {@code TOP (?)} placed right after
 * {@code SELECT}, so the limit is the first bind parameter of the search statement. Catalog
 * queries go through {@code INFORMATION_SCHEMA} of the current database ({@code DB_NAME()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialectHandler implements DbDialectHandler {

    private static final Set<String> TEXT_LIKE_TYPES =
            ImmutableSet.of("char", "varchar", "text", "nchar", "nvarchar", "ntext");

    @Override
    public DatabaseDriver getDriver() {
        return DatabaseDriver.MSSQL;
    }

    @Override
    public String getDriverClassName() {
        return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
    }

    /**
     * Builds a SQL Server JDBC URL.
     *
     * @param config database configuration
     * @return {@code jdbc:sqlserver://host:port;databaseName=database}
     */
    @Override
    public String buildJdbcUrl(DatabaseConfig config) {
        return "jdbc:sqlserver://" + config.getHost() + ":" + config.getPort() + ";databaseName="
                + config.getDatabase();
    }

    /**
     * Applies SQL Server session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET LANGUAGE us_english");
            st.execute("SET DATEFORMAT ymd");
        }
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public String getListTablesSql() {
        return "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES "
                + "WHERE TABLE_TYPE = 'BASE TABLE' AND TABLE_CATALOG = DB_NAME()";
    }

    /**
     * Both sides are upper-cased so the match ignores case under {@code _CS_} collations as well.
     * The column is cast to {@code NVARCHAR(MAX)} first; {@code UPPER} does not accept
     * {@code text} or {@code ntext}.
     */
    @Override
    public SqlStatement buildColumnSearch(String physicalTable, String column, String pattern,
            int limit) {
        String sql = "SELECT TOP (?) * FROM " + quoteIdentifier(physicalTable)
                + " WHERE UPPER(CAST(" + quoteIdentifier(column)
                + " AS NVARCHAR(MAX))) LIKE UPPER(?)";
        return SqlStatement.of(sql, limit, pattern);
    }

    @Override
    public String buildStringAggregate(String expression, String alias) {
        return "STRING_AGG(" + expression + ", ',') WITHIN GROUP (ORDER BY " + expression
                + ") AS " + alias;
    }

    @Override
    public Optional<String> extractTableName(NormalizedRow row) {
        return row.getIgnoreCase("TABLE_NAME").map(String::valueOf);
    }

    @Override
    public SqlStatement buildTableSchemaQuery(String physicalTable) {
        return SqlStatement.of("SELECT COLUMN_NAME, DATA_TYPE FROM INFORMATION_SCHEMA.COLUMNS "
                + "WHERE TABLE_NAME = ? AND TABLE_CATALOG = DB_NAME() ORDER BY ORDINAL_POSITION",
                physicalTable);
    }

    @Override
    public Optional<Map.Entry<String, String>> extractColumnDefinition(NormalizedRow row) {
        Optional<Object> name = row.getIgnoreCase("COLUMN_NAME");
        Optional<Object> type = row.getIgnoreCase("DATA_TYPE");
        if (name.isEmpty() || type.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SimpleImmutableEntry<>(String.valueOf(name.get()),
                String.valueOf(type.get())));
    }

    @Override
    public Set<String> getTextLikeTypes() {
        return TEXT_LIKE_TYPES;
    }
}
