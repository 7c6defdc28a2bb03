package io.github.yok.drupaldblink.core;

import java.util.List;
import java.util.Map;

/**
 * Executes templated SQL against the configured database.
 *
 * <p>
 * Queries may reference tables as {@code {logical_name}}; they are expanded with the configured
 * prefix before execution. Positional parameters use JDBC's {@code ?}; named parameters use
 * {@code :name}. Failures never escape as exceptions: they are reported as
 * {@link QueryResult.Status#FAILED}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface QueryExecutor {

    /**
     * Executes a query with positional parameters.
     *
     * @param query templated SQL using {@code ?} placeholders
     * @param params bind values in placeholder order
     * @param fetchOne {@code true} to read at most one row
     * @return result
     */
    QueryResult execute(String query, List<?> params, boolean fetchOne);

    /**
     * Executes a query with positional parameters and reads all rows.
     *
     * @param query templated SQL using {@code ?} placeholders
     * @param params bind values in placeholder order
     * @return result
     */
    default QueryResult execute(String query, List<?> params) {
        return execute(query, params, false);
    }

    /**
     * Executes a query with {@code :name} parameters.
     *
     * @param query templated SQL using {@code :name} placeholders
     * @param namedParams bind values by name
     * @param fetchOne {@code true} to read at most one row
     * @return result
     */
    QueryResult execute(String query, Map<String, ?> namedParams, boolean fetchOne);

    /**
     * Executes a query with {@code :name} parameters and reads all rows.
     *
     * @param query templated SQL using {@code :name} placeholders
     * @param namedParams bind values by name
     * @return result
     */
    default QueryResult execute(String query, Map<String, ?> namedParams) {
        return execute(query, namedParams, false);
    }
}
