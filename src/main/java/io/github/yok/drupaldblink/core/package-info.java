/**
 * Query execution and schema access package.
 *
 * <p>
 * {@link io.github.yok.drupaldblink.core.DbManager} owns the connection and executes templated
 * queries; results are normalized into one row shape for every dialect. Schema introspection and
 * the cross-table search are built on {@link io.github.yok.drupaldblink.core.QueryExecutor} only.
 * </p>
 *
 * <p>
 * Database-specific differences (quoting, catalog queries, row limiting, etc.) are delegated to
 * handlers in {@code db}.
 * </p>
 */
package io.github.yok.drupaldblink.core;
