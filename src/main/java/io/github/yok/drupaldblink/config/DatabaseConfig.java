package io.github.yok.drupaldblink.config;

import io.github.yok.drupaldblink.db.DatabaseDriver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable connection settings of one Drupal database.
 *
 * <p>
 * Instances are produced by {@link DatabaseProperties#toDatabaseConfig()} (or directly through the
 * builder) and never change afterwards. {@link #validate()} must succeed before a connection is
 * opened: driver, host, port, database, username and password are all required. The table prefix
 * defaults to an empty string.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "password")
public final class DatabaseConfig {

    // Drupal driver identifier (mysql / pgsql / mssql / oracle)
    private final DatabaseDriver driver;
    // Database host name
    private final String host;
    // Database port (must be positive)
    private final int port;
    // Login user
    private final String username;
    // Login password
    private final String password;
    // Database name (service name for Oracle)
    private final String database;
    // Drupal table prefix, never null
    private final String prefix;
    // Extra JDBC connection properties (Drupal driver_options)
    private final Map<String, String> driverOptions;
    // Timeout used when checking whether the current connection is still alive; 0 disables
    private final int validationTimeoutSeconds;

    @Builder
    private DatabaseConfig(DatabaseDriver driver, String host, int port, String username,
            String password, String database, String prefix, Map<String, String> driverOptions,
            Integer validationTimeoutSeconds) {
        this.driver = driver;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.database = database;
        this.prefix = StringUtils.defaultString(prefix);
        this.driverOptions = driverOptions == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(driverOptions));
        this.validationTimeoutSeconds =
                validationTimeoutSeconds == null ? 2 : Math.max(0, validationTimeoutSeconds);
    }

    /**
     * Verifies that every field required for connecting is present.
     *
     * @throws ConfigIncompleteException listing all missing fields
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (driver == null) {
            missing.add("driver");
        }
        if (StringUtils.isBlank(database)) {
            missing.add("database");
        }
        if (StringUtils.isBlank(username)) {
            missing.add("username");
        }
        if (StringUtils.isEmpty(password)) {
            missing.add("password");
        }
        if (StringUtils.isBlank(host)) {
            missing.add("host");
        }
        if (port <= 0) {
            missing.add("port");
        }
        if (!missing.isEmpty()) {
            throw new ConfigIncompleteException(missing);
        }
    }
}
