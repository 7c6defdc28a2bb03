package io.github.yok.drupaldblink.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * This interface composes focused contracts to keep responsibilities separated: connection and
 * session setup, SQL grammar, catalog access, and result-shape normalization. The query executor,
 * schema introspector, and search engine depend only on this interface.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations, DbDialectSqlOperations,
        DbDialectMetadataOperations, DbDialectValueOperations {
}
