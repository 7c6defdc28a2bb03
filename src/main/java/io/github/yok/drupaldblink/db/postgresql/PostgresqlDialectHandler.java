package io.github.yok.drupaldblink.db.postgresql;

import com.google.common.collect.ImmutableSet;
import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.db.DatabaseDriver;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.NormalizedRow;
import io.github.yok.drupaldblink.db.SqlStatement;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL dialect handler.
 *
 * <p>
 * Drupal keeps its tables in the {@code public} schema, so both the table listing and the column
 * description are restricted to it. Substring search uses {@code ILIKE} on the column cast to
 * {@code TEXT}, limited by a trailing {@code LIMIT ?}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler implements DbDialectHandler {

    private static final String SCHEMA = "public";

    private static final Set<String> TEXT_LIKE_TYPES = ImmutableSet.of("character varying",
            "varchar", "character", "char", "bpchar", "text", "citext");

    @Override
    public DatabaseDriver getDriver() {
        return DatabaseDriver.PGSQL;
    }

    @Override
    public String getDriverClassName() {
        return "org.postgresql.Driver";
    }

    /**
     * Builds a PostgreSQL JDBC URL.
     *
     * @param config database configuration
     * @return {@code jdbc:postgresql://host:port/database}
     */
    @Override
    public String buildJdbcUrl(DatabaseConfig config) {
        return "jdbc:postgresql://" + config.getHost() + ":" + config.getPort() + "/"
                + config.getDatabase();
    }

    /**
     * PostgreSQL needs no session initialization.
     *
     * @param connection JDBC connection
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        // nothing to do
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String getListTablesSql() {
        return "SELECT tablename FROM pg_catalog.pg_tables WHERE schemaname = '" + SCHEMA + "'";
    }

    @Override
    public SqlStatement buildColumnSearch(String physicalTable, String column, String pattern,
            int limit) {
        String sql = "SELECT * FROM " + quoteIdentifier(physicalTable) + " WHERE CAST("
                + quoteIdentifier(column) + " AS TEXT) ILIKE ? LIMIT ?";
        return SqlStatement.of(sql, pattern, limit);
    }

    @Override
    public String buildStringAggregate(String expression, String alias) {
        return "STRING_AGG(DISTINCT " + expression + ", ',') AS " + alias;
    }

    @Override
    public Optional<String> extractTableName(NormalizedRow row) {
        return row.getIgnoreCase("tablename").map(String::valueOf);
    }

    @Override
    public SqlStatement buildTableSchemaQuery(String physicalTable) {
        return SqlStatement.of("SELECT column_name, data_type FROM information_schema.columns "
                + "WHERE table_name = ? AND table_schema = ? ORDER BY ordinal_position",
                physicalTable, SCHEMA);
    }

    @Override
    public Optional<Map.Entry<String, String>> extractColumnDefinition(NormalizedRow row) {
        Optional<Object> name = row.getIgnoreCase("column_name");
        Optional<Object> type = row.getIgnoreCase("data_type");
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
