package io.github.yok.drupaldblink;

import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.config.DatabaseProperties;
import io.github.yok.drupaldblink.core.DbManager;
import io.github.yok.drupaldblink.core.SchemaIntrospector;
import io.github.yok.drupaldblink.db.ConnectionFactory;
import io.github.yok.drupaldblink.db.DbDialectHandlerFactory;
import io.github.yok.drupaldblink.util.ErrorHandler;
import io.github.yok.drupaldblink.util.MaskingLogUtil;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads the {@code drupal.database} settings, connects to the Drupal database, lists the tables
 * carrying the configured prefix and exits. It is a connectivity check for the settings that the
 * MCP server will use.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see DatabaseProperties
 * @see DbManager
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(DatabaseProperties.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final DatabaseProperties databaseProperties;
    private final DbDialectHandlerFactory dialectFactory;
    private final ConnectionFactory connectionFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments (unused)
     */
    @Override
    public void run(String... args) {
        DatabaseConfig config;
        try {
            config = databaseProperties.toDatabaseConfig();
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid database configuration: " + e.getMessage(), e);
            return;
        }
        log.info("Database settings: {}", MaskingLogUtil.maskConfig(config));

        Optional<List<String>> tables;
        try (DbManager manager = new DbManager(config, dialectFactory, connectionFactory)) {
            SchemaIntrospector introspector = new SchemaIntrospector(manager,
                    manager.getDialect(), manager.getTemplater());
            tables = introspector.listTables();
        } catch (RuntimeException e) {
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }

        if (tables.isEmpty()) {
            ErrorHandler.errorAndExit("Could not list tables of database " + config.getDatabase());
            return;
        }
        log.info("Found {} Drupal table(s) with prefix '{}'", tables.get().size(),
                config.getPrefix());
        log.debug("Tables: {}", tables.get());
    }
}
