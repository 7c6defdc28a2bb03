package io.github.yok.drupaldblink.config;

import io.github.yok.drupaldblink.db.DatabaseDriver;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code drupal.database} section in {@code application.yml}.
 *
 * <pre>
 * drupal:
 *   database:
 *     driver: mysql
 *     host: localhost
 *     port: 3306
 *     database: drupal
 *     username: drupal
 *     password: secret
 *     prefix: dr_
 *     driver-options:
 *       connectTimeout: 5000
 * </pre>
 *
 * <p>
 * The values usually come from a Drupal {@code settings.php}; this class only carries them and
 * converts them into the immutable {@link DatabaseConfig}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "drupal.database")
@Data
public class DatabaseProperties {

    /**
     * Drupal driver identifier: {@code mysql}, {@code pgsql}, {@code mssql} or {@code oracle}.
     */
    private String driver;

    /**
     * Database host.
     */
    private String host;

    /**
     * Database port. {@code null} means "not configured".
     */
    private Integer port;

    /**
     * Database name. For Oracle this is the service name.
     */
    private String database;

    /**
     * Login user.
     */
    private String username;

    /**
     * Login password.
     */
    private String password;

    /**
     * Drupal table prefix prepended to every logical table name.
     */
    private String prefix = "";

    /**
     * Additional JDBC connection properties.
     */
    private Map<String, String> driverOptions = new LinkedHashMap<>();

    /**
     * Seconds allowed for the liveness check executed before each query. {@code 0} disables it.
     */
    private int validationTimeoutSeconds = 2;

    /**
     * Converts the bound properties into an immutable {@link DatabaseConfig}.
     *
     * <p>
     * A missing driver is left to {@link DatabaseConfig#validate()}; an unknown one fails here.
     * </p>
     *
     * @return database configuration
     * @throws io.github.yok.drupaldblink.db.UnsupportedDriverException if the driver identifier
     *         is not recognized
     */
    public DatabaseConfig toDatabaseConfig() {
        DatabaseDriver resolved = StringUtils.isBlank(driver) ? null : DatabaseDriver.fromId(driver);
        return DatabaseConfig.builder().driver(resolved).host(host)
                .port(port == null ? 0 : port).database(database).username(username)
                .password(password).prefix(prefix).driverOptions(driverOptions)
                .validationTimeoutSeconds(validationTimeoutSeconds).build();
    }
}
