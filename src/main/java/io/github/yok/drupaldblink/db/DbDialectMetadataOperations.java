package io.github.yok.drupaldblink.db;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog and column-type operations for each database dialect.
 */
public interface DbDialectMetadataOperations {

    /**
     * Extracts the table name from one row of {@link DbDialectSqlOperations#getListTablesSql()}.
     *
     * @param row catalog row
     * @return physical table name spelled as stored, empty if the row carries none
     */
    Optional<String> extractTableName(NormalizedRow row);

    /**
     * Builds the query describing the columns of a table.
     *
     * <p>
     * The name has already passed {@link io.github.yok.drupaldblink.util.IdentifierValidator}.
     * </p>
     *
     * @param physicalTable prefixed table name as stored in the catalog
     * @return schema statement
     */
    SqlStatement buildTableSchemaQuery(String physicalTable);

    /**
     * Extracts column name and declared type from one row of the schema query.
     *
     * @param row schema row
     * @return column name spelled as stored to declared type, empty if the row is incomplete
     */
    Optional<Map.Entry<String, String>> extractColumnDefinition(NormalizedRow row);

    /**
     * Returns the declared type names treated as searchable text (lower case, without length).
     *
     * @return text-like type names
     */
    Set<String> getTextLikeTypes();

    /**
     * Returns whether a declared column type is text-like.
     *
     * <p>
     * Length and qualifiers are ignored: {@code varchar(255)} and {@code VARCHAR} both match
     * {@code varchar}.
     * </p>
     *
     * @param declaredType type as reported by the schema query
     * @return {@code true} for text-like columns
     */
    default boolean isTextLikeType(String declaredType) {
        if (declaredType == null) {
            return false;
        }
        String base = declaredType;
        int paren = base.indexOf('(');
        if (paren >= 0) {
            base = base.substring(0, paren);
        }
        return getTextLikeTypes().contains(base.trim().toLowerCase(Locale.ROOT));
    }
}
