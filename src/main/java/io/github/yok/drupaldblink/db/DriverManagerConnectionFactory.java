package io.github.yok.drupaldblink.db;

import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}.
 *
 * <p>
 * The dialect's driver class is loaded first so that a missing driver jar is reported as a
 * connection failure rather than as "No suitable driver".
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DriverManagerConnectionFactory implements ConnectionFactory {

    @Override
    public Connection open(DatabaseConfig config, DbDialectHandler dialect) throws SQLException {
        String driverClass = dialect.getDriverClassName();
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("Driver class not found: " + driverClass, "08001", e);
        }
        String url = dialect.buildJdbcUrl(config);
        log.info("Connecting to {} database: url={}, user={}",
                dialect.getDriver().getDisplayName(), MaskingLogUtil.maskJdbcUrl(url),
                config.getUsername());
        return DriverManager.getConnection(url, dialect.buildConnectionProperties(config));
    }
}
