package io.github.yok.drupaldblink.db.oracle;

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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Oracle dialect handler.
 *
 * <p>
 * Oracle stores unquoted identifiers in upper case. To give callers the same names as the other
 * dialects, this handler
 * </p>
 * <ul>
 * <li>folds upper-case catalog names and result labels to lower case,</li>
 * <li>upper-cases names that were never read from the catalog before quoting them
 * ({@link #toStoredIdentifier(String)}),</li>
 * <li>limits rows with a {@code ROWNUM <= ?} filter wrapped around a sub-query.</li>
 * </ul>
 *
 * <p>
 * The configured database name is used as the service name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialectHandler implements DbDialectHandler {

    private static final Set<String> TEXT_LIKE_TYPES = ImmutableSet.of("char", "nchar", "varchar",
            "varchar2", "nvarchar2", "clob", "nclob", "long");

    @Override
    public DatabaseDriver getDriver() {
        return DatabaseDriver.ORACLE;
    }

    @Override
    public String getDriverClassName() {
        return "oracle.jdbc.OracleDriver";
    }

    /**
     * Builds an Oracle thin JDBC URL with a service name.
     *
     * @param config database configuration
     * @return {@code jdbc:oracle:thin:@//host:port/service}
     */
    @Override
    public String buildJdbcUrl(DatabaseConfig config) {
        return "jdbc:oracle:thin:@//" + config.getHost() + ":" + config.getPort() + "/"
                + config.getDatabase();
    }

    /**
     * Adds {@code oracle.jdbc.J2EE13Compliant} so that temporal columns come back as standard JDBC
     * types instead of {@code oracle.sql} wrappers.
     *
     * @param config database configuration
     * @return connection properties
     */
    @Override
    public Properties buildConnectionProperties(DatabaseConfig config) {
        Properties props = new Properties();
        props.setProperty("oracle.jdbc.J2EE13Compliant", "true");
        props.putAll(DbDialectHandler.super.buildConnectionProperties(config));
        return props;
    }

    /**
     * Applies Oracle session settings (NLS formats).
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("ALTER SESSION SET NLS_DATE_FORMAT = 'YYYY-MM-DD HH24:MI:SS'");
            stmt.execute("ALTER SESSION SET NLS_TIMESTAMP_FORMAT = 'YYYY-MM-DD HH24:MI:SS.FF'");
            stmt.execute("ALTER SESSION SET NLS_NUMERIC_CHARACTERS = '.,'");
        }
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toStoredIdentifier(String identifier) {
        return identifier.toUpperCase(Locale.ROOT);
    }

    @Override
    public String getListTablesSql() {
        return "SELECT table_name FROM user_tables";
    }

    @Override
    public SqlStatement buildColumnSearch(String physicalTable, String column, String pattern,
            int limit) {
        String sql = "SELECT * FROM (SELECT * FROM " + quoteIdentifier(physicalTable)
                + " WHERE UPPER(" + quoteIdentifier(column)
                + ") LIKE UPPER(?)) WHERE ROWNUM <= ?";
        return SqlStatement.of(sql, pattern, limit);
    }

    @Override
    public String buildStringAggregate(String expression, String alias) {
        return "LISTAGG(" + expression + ", ',') WITHIN GROUP (ORDER BY " + expression + ") AS "
                + alias;
    }

    @Override
    public Optional<String> extractTableName(NormalizedRow row) {
        return row.getIgnoreCase("table_name").map(String::valueOf);
    }

    @Override
    public SqlStatement buildTableSchemaQuery(String physicalTable) {
        return SqlStatement.of("SELECT COLUMN_NAME, DATA_TYPE FROM USER_TAB_COLUMNS "
                + "WHERE TABLE_NAME = ? ORDER BY COLUMN_ID", physicalTable);
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

    /**
     * Folds labels that Oracle reported in upper case (unquoted identifiers) to lower case.
     * Mixed-case labels come from quoted identifiers and are kept.
     *
     * @param label JDBC column label
     * @return row key
     */
    @Override
    public String normalizeColumnLabel(String label) {
        return normalizeCatalogName(label);
    }

    @Override
    public String normalizeCatalogName(String name) {
        if (name != null && name.equals(name.toUpperCase(Locale.ROOT))) {
            return name.toLowerCase(Locale.ROOT);
        }
        return name;
    }
}
