package io.github.yok.drupaldblink.db;

import io.github.yok.drupaldblink.config.DatabaseConfig;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections for {@link io.github.yok.drupaldblink.core.DbManager}.
 *
 * <p>
 * The default implementation is {@link DriverManagerConnectionFactory}. Tests substitute an
 * in-memory database here; a pooled data source could be plugged in the same way.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection. Session initialization is left to the caller.
     *
     * @param config validated database configuration
     * @param dialect dialect handler of the configured driver
     * @return open connection
     * @throws SQLException if the driver cannot be loaded or refuses the connection
     */
    Connection open(DatabaseConfig config, DbDialectHandler dialect) throws SQLException;
}
