package io.github.yok.drupaldblink.db;

/**
 * Result-shape normalization for each database dialect.
 */
public interface DbDialectValueOperations {

    /**
     * Normalizes a result-set column label into the key used in {@link NormalizedRow}.
     *
     * @param label label reported by JDBC
     * @return row key
     */
    default String normalizeColumnLabel(String label) {
        return label;
    }

    /**
     * Normalizes a table or column name read from the catalog.
     *
     * @param name catalog name
     * @return name in the case callers use
     */
    default String normalizeCatalogName(String name) {
        return name;
    }
}
