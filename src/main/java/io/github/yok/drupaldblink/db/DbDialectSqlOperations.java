package io.github.yok.drupaldblink.db;

/**
 * SQL grammar operations for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes identifier in dialect style. Embedded closing quote characters are doubled.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Converts a name that was not read from the catalog to the case the engine stores unquoted
     * identifiers in, so that quoting it still refers to the same object. Names read from the
     * catalog keep their catalog spelling instead.
     *
     * @param identifier identifier as used by callers
     * @return identifier as stored in the catalog
     */
    default String toStoredIdentifier(String identifier) {
        return identifier;
    }

    /**
     * Returns whether a backslash inside a quoted literal escapes the next character.
     *
     * @return {@code true} if {@code 'O\'Brien'} is a single literal
     */
    default boolean supportsBackslashEscapes() {
        return false;
    }

    /**
     * Returns SQL listing the base tables visible to the connected user.
     *
     * @return list-tables SQL
     */
    String getListTablesSql();

    /**
     * Builds a row-limited, case-insensitive substring search on one column.
     *
     * <p>
     * The row-limiting construct differs structurally between dialects (trailing {@code LIMIT},
     * {@code TOP} right after {@code SELECT}, or a {@code ROWNUM} filter around a sub-query), so
     * each dialect produces the whole statement and orders the bind parameters itself.
     * </p>
     *
     * @param physicalTable prefixed table name as stored in the catalog
     * @param column column name as stored in the catalog
     * @param pattern LIKE pattern (already wrapped in {@code %})
     * @param limit maximum number of rows
     * @return statement with bind parameters
     */
    SqlStatement buildColumnSearch(String physicalTable, String column, String pattern, int limit);

    /**
     * Builds a string aggregation select item, e.g. {@code GROUP_CONCAT(expr) AS alias}.
     *
     * @param expression aggregated expression
     * @param alias result column alias
     * @return select-list item
     */
    String buildStringAggregate(String expression, String alias);
}
