package io.github.yok.drupaldblink.db;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Enumerates the database drivers supported by DrupalDBLink.
 *
 * <p>
 * The identifiers are the driver names used in Drupal's {@code $databases} settings.
 * </p>
 *
 * <ul>
 * <li>MYSQL: {@code mysql}, MySQL / MariaDB</li>
 * <li>PGSQL: {@code pgsql}, PostgreSQL</li>
 * <li>MSSQL: {@code mssql}, Microsoft SQL Server</li>
 * <li>ORACLE: {@code oracle}, Oracle Database</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum DatabaseDriver {
    MYSQL("mysql", "MySQL"),
    PGSQL("pgsql", "PostgreSQL"),
    MSSQL("mssql", "SQL Server"),
    ORACLE("oracle", "Oracle");

    // Identifier as written in configuration
    private final String id;
    // Human readable product name for logs
    private final String displayName;

    /**
     * Resolves a driver from its configuration identifier (case-insensitive).
     *
     * @param id driver identifier
     * @return matching driver
     * @throws UnsupportedDriverException if the identifier is unknown
     */
    public static DatabaseDriver fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (DatabaseDriver driver : values()) {
                if (driver.id.equals(normalized)) {
                    return driver;
                }
            }
        }
        throw new UnsupportedDriverException(id);
    }
}
