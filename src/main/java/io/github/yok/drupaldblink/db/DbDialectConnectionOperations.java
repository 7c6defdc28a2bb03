package io.github.yok.drupaldblink.db;

import io.github.yok.drupaldblink.config.DatabaseConfig;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Returns the driver this handler serves.
     *
     * @return database driver
     */
    DatabaseDriver getDriver();

    /**
     * Returns the JDBC driver class to load before connecting.
     *
     * @return fully qualified driver class name
     */
    String getDriverClassName();

    /**
     * Builds the JDBC URL for the configured host, port and database.
     *
     * @param config database configuration
     * @return JDBC URL
     */
    String buildJdbcUrl(DatabaseConfig config);

    /**
     * Builds JDBC connection properties: credentials, dialect defaults and configured driver
     * options (which win over the defaults).
     *
     * @param config database configuration
     * @return connection properties
     */
    default Properties buildConnectionProperties(DatabaseConfig config) {
        Properties props = new Properties();
        props.setProperty("user", config.getUsername());
        props.setProperty("password", config.getPassword());
        config.getDriverOptions().forEach(props::setProperty);
        return props;
    }

    /**
     * Applies dialect-specific session initialization to a freshly opened connection.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;
}
