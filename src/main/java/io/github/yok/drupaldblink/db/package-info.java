/**
 * Database dialect package.
 *
 * <p>
 * {@link io.github.yok.drupaldblink.db.DbDialectHandler} hides the differences between MySQL,
 * PostgreSQL, SQL Server and Oracle. Implementations live in one sub-package per dialect and are
 * selected by {@link io.github.yok.drupaldblink.db.DbDialectHandlerFactory}.
 * </p>
 */
package io.github.yok.drupaldblink.db;
