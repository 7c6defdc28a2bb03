package io.github.yok.drupaldblink.core;

import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.NormalizedRow;
import io.github.yok.drupaldblink.db.SqlStatement;
import io.github.yok.drupaldblink.util.IdentifierValidator;
import io.github.yok.drupaldblink.util.UnsafeIdentifierException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lists tables and describes their columns through the dialect's catalog queries.
 *
 * <p>
 * Table names are exchanged in their logical form: the configured prefix is stripped on the way
 * out and added on the way in. Tables that do not carry the prefix belong to another site sharing
 * the database and are not listed.
 * </p>
 *
 * <p>
 * Names are reported through {@link DbDialectHandler#normalizeCatalogName(String)}, while the
 * catalog spelling of every table and column seen is remembered. Later catalog and search queries
 * quote that spelling, so a table created with a quoted lower-case name on Oracle is found again.
 * Names never seen in the catalog fall back to {@link DbDialectHandler#toStoredIdentifier(String)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaIntrospector {

    private final QueryExecutor executor;

    private final DbDialectHandler dialect;

    private final TableNameTemplater templater;

    // logical table name -> physical name as stored in the catalog
    private final Map<String, String> storedTableNames = new ConcurrentHashMap<>();

    // logical table name -> (reported column name -> column name as stored in the catalog)
    private final Map<String, Map<String, String>> storedColumnNames = new ConcurrentHashMap<>();

    /**
     * Lists the logical names of all tables carrying the configured prefix.
     *
     * @return logical table names in catalog order, empty if the catalog query failed
     */
    public Optional<List<String>> listTables() {
        QueryResult result = executor.execute(dialect.getListTablesSql(), Collections.emptyList());
        if (result.isFailed()) {
            log.warn("Could not list tables: {}", describe(result));
            return Optional.empty();
        }
        List<String> tables = new ArrayList<>();
        for (NormalizedRow row : result.getRows()) {
            Optional<String> stored = dialect.extractTableName(row);
            if (stored.isEmpty()) {
                continue;
            }
            Optional<String> logical =
                    templater.toLogicalName(dialect.normalizeCatalogName(stored.get()));
            if (logical.isPresent()) {
                storedTableNames.put(logical.get(), stored.get());
                tables.add(logical.get());
            }
        }
        log.debug("Found {} table(s) with prefix '{}'", tables.size(), templater.getPrefix());
        return Optional.of(tables);
    }

    /**
     * Describes the columns of a table.
     *
     * @param logicalName logical table name
     * @return column name to declared type in column order; empty if the name is unsafe, the
     *         table has no columns or the query failed
     */
    public Optional<Map<String, String>> getTableSchema(String logicalName) {
        String physical = toStoredTableName(logicalName);
        try {
            IdentifierValidator.requireSafe(physical);
        } catch (UnsafeIdentifierException e) {
            log.warn("Refusing to describe table: {}", e.getMessage());
            return Optional.empty();
        }

        SqlStatement stmt = dialect.buildTableSchemaQuery(physical);
        QueryResult result = executor.execute(stmt.getSql(), stmt.getParameters());
        if (result.isFailed()) {
            log.warn("Could not describe table {}: {}", physical, describe(result));
            return Optional.empty();
        }
        Map<String, String> columns = new LinkedHashMap<>();
        Map<String, String> storedColumns = new LinkedHashMap<>();
        for (NormalizedRow row : result.getRows()) {
            Optional<Map.Entry<String, String>> definition = dialect.extractColumnDefinition(row);
            if (definition.isPresent()) {
                String stored = definition.get().getKey();
                String name = dialect.normalizeCatalogName(stored);
                columns.put(name, definition.get().getValue());
                storedColumns.put(name, stored);
            }
        }
        if (columns.isEmpty()) {
            log.warn("Table {} has no columns or does not exist", physical);
            return Optional.empty();
        }
        storedColumnNames.put(logicalName, Collections.unmodifiableMap(storedColumns));
        return Optional.of(Collections.unmodifiableMap(columns));
    }

    /**
     * Returns the physical name of a table as stored in the catalog.
     *
     * @param logicalName logical table name
     * @return spelling reported by {@link #listTables()}, or the dialect's stored form of the
     *         prefixed name if the table has not been listed
     */
    public String toStoredTableName(String logicalName) {
        String stored = storedTableNames.get(logicalName);
        if (stored != null) {
            return stored;
        }
        return dialect.toStoredIdentifier(templater.toPhysicalName(logicalName));
    }

    /**
     * Returns the name of a column as stored in the catalog.
     *
     * @param logicalName logical table name
     * @param column column name as returned by {@link #getTableSchema(String)}
     * @return spelling reported by the schema query, or the dialect's stored form of the name if
     *         the table has not been described
     */
    public String toStoredColumnName(String logicalName, String column) {
        String stored =
                storedColumnNames.getOrDefault(logicalName, Collections.emptyMap()).get(column);
        if (stored != null) {
            return stored;
        }
        return dialect.toStoredIdentifier(column);
    }

    /**
     * Returns whether a declared column type is searchable text for the current dialect.
     *
     * @param declaredType type as returned by {@link #getTableSchema(String)}
     * @return {@code true} for text-like types
     */
    public boolean isTextLike(String declaredType) {
        return dialect.isTextLikeType(declaredType);
    }

    /**
     * Returns the text-like type names of the current dialect.
     *
     * @return lower-case type names
     */
    public Set<String> getTextLikeTypes() {
        return dialect.getTextLikeTypes();
    }

    private static String describe(QueryResult result) {
        return result.getFailure().map(QueryFailure::getMessage).orElse("unknown error");
    }
}
