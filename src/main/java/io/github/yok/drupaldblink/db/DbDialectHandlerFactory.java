package io.github.yok.drupaldblink.db;

import io.github.yok.drupaldblink.db.mysql.MySqlDialectHandler;
import io.github.yok.drupaldblink.db.oracle.OracleDialectHandler;
import io.github.yok.drupaldblink.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.drupaldblink.db.sqlserver.SqlServerDialectHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database driver.
 *
 * <p>
 * Supported drivers:
 * </p>
 * <ul>
 * <li>{@code mysql}: {@link MySqlDialectHandler}</li>
 * <li>{@code pgsql}: {@link PostgresqlDialectHandler}</li>
 * <li>{@code mssql}: {@link SqlServerDialectHandler}</li>
 * <li>{@code oracle}: {@link OracleDialectHandler}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates the handler for a driver.
     *
     * @param driver database driver
     * @return a new handler instance
     * @throws UnsupportedDriverException if {@code driver} is {@code null}
     */
    public DbDialectHandler create(DatabaseDriver driver) {
        if (driver == null) {
            log.error("Database driver is not specified");
            throw new UnsupportedDriverException(null);
        }
        DbDialectHandler handler;
        switch (driver) {
            case MYSQL:
                handler = new MySqlDialectHandler();
                break;

            case PGSQL:
                handler = new PostgresqlDialectHandler();
                break;

            case MSSQL:
                handler = new SqlServerDialectHandler();
                break;

            case ORACLE:
                handler = new OracleDialectHandler();
                break;

            default:
                log.error("Unsupported database driver: {}", driver);
                throw new UnsupportedDriverException(driver.getId());
        }
        log.debug("Selected {} dialect handler", driver.getDisplayName());
        return handler;
    }
}
