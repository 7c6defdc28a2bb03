package io.github.yok.drupaldblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.drupaldblink.config.DatabaseConfig;
import io.github.yok.drupaldblink.db.ConnectionFactory;
import io.github.yok.drupaldblink.db.ConnectionFailureException;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.DbDialectHandlerFactory;
import io.github.yok.drupaldblink.db.DriverManagerConnectionFactory;
import io.github.yok.drupaldblink.db.NormalizedRow;
import io.github.yok.drupaldblink.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the single JDBC connection to a Drupal database and executes queries on it.
 *
 * <p>
 * Construction validates the configuration, selects the dialect handler and connects eagerly, so
 * configuration and connection errors surface to the caller:
 * </p>
 * <ul>
 * <li>{@link io.github.yok.drupaldblink.config.ConfigIncompleteException}: required settings are
 * missing.</li>
 * <li>{@link io.github.yok.drupaldblink.db.UnsupportedDriverException}: unknown driver.</li>
 * <li>{@link ConnectionFailureException}: the driver refused the connection.</li>
 * </ul>
 *
 * <p>
 * Before each query the connection is checked; if it is gone, one reconnect is attempted and a
 * failure is reported as {@link QueryResult.Status#FAILED}. All operations are serialized by a
 * {@link ReentrantLock}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbManager implements QueryExecutor, AutoCloseable {

    @Getter
    private final DatabaseConfig config;

    @Getter
    private final DbDialectHandler dialect;

    @Getter
    private final TableNameTemplater templater;

    private final ConnectionFactory connectionFactory;

    private final ResultNormalizer normalizer;

    private final ReentrantLock lock = new ReentrantLock();

    // Current connection; null until connected or after close()
    private Connection connection;

    /**
     * Creates a manager that connects through {@link java.sql.DriverManager}.
     *
     * @param config database configuration
     */
    public DbManager(DatabaseConfig config) {
        this(config, new DbDialectHandlerFactory(), new DriverManagerConnectionFactory());
    }

    /**
     * Creates a manager with explicit collaborators.
     *
     * @param config database configuration
     * @param dialectHandlerFactory selects the dialect handler
     * @param connectionFactory opens JDBC connections
     */
    public DbManager(DatabaseConfig config, DbDialectHandlerFactory dialectHandlerFactory,
            ConnectionFactory connectionFactory) {
        Preconditions.checkNotNull(config, "config must not be null");
        config.validate();
        this.config = config;
        this.dialect = dialectHandlerFactory.create(config.getDriver());
        this.connectionFactory = connectionFactory;
        this.templater =
                new TableNameTemplater(config.getPrefix(), dialect.supportsBackslashEscapes());
        this.normalizer = new ResultNormalizer(dialect);
        connect();
    }

    /**
     * Opens a new connection, replacing the current one if any.
     *
     * @throws ConnectionFailureException if the connection cannot be opened or initialized
     */
    public void connect() {
        lock.lock();
        try {
            closeConnection();
            openConnection();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether a connection is currently open. The connection is not validated.
     *
     * @return {@code true} if open
     */
    public boolean isConnected() {
        lock.lock();
        try {
            return connection != null && !connection.isClosed();
        } catch (SQLException e) {
            log.debug("Could not query connection state: {}", e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueryResult execute(String query, List<?> params, boolean fetchOne) {
        Preconditions.checkNotNull(query, "query must not be null");
        String sql = templater.prepareQuery(query);
        List<?> bind = params == null ? Collections.emptyList() : params;
        lock.lock();
        try {
            Optional<QueryFailure> unavailable = ensureConnected();
            if (unavailable.isPresent()) {
                return QueryResult.failed(unavailable.get());
            }
            return run(sql, bind, fetchOne);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if a placeholder has no value in {@code namedParams}
     */
    @Override
    public QueryResult execute(String query, Map<String, ?> namedParams, boolean fetchOne) {
        Preconditions.checkNotNull(query, "query must not be null");
        PlaceholderTranslator.ParsedStatement parsed = PlaceholderTranslator
                .parse(templater.prepareQuery(query), dialect.supportsBackslashEscapes());
        return execute(parsed.getSql(), parsed.bind(namedParams), fetchOne);
    }

    /**
     * Closes the connection. Calling it again is harmless; the next query reconnects.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (connection != null) {
                closeConnection();
                log.info("Database connection closed");
            }
        } finally {
            lock.unlock();
        }
    }

    private void openConnection() {
        Connection conn = null;
        try {
            conn = connectionFactory.open(config, dialect);
            dialect.prepareConnection(conn);
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            String msg = "Failed to connect to " + dialect.getDriver().getDisplayName()
                    + " database (" + MaskingLogUtil.maskConfig(config) + "): " + e.getMessage();
            log.error(msg);
            throw new ConnectionFailureException(msg, e);
        }
        connection = conn;
        log.info("Connected to {} database: {}", dialect.getDriver().getDisplayName(),
                MaskingLogUtil.maskConfig(config));
    }

    /**
     * Makes sure a live connection exists, reconnecting once if needed.
     *
     * @return failure detail when no connection could be obtained
     */
    private Optional<QueryFailure> ensureConnected() {
        if (isAlive()) {
            return Optional.empty();
        }
        log.info("No live database connection, reconnecting");
        closeConnection();
        try {
            openConnection();
            return Optional.empty();
        } catch (ConnectionFailureException e) {
            return Optional.of(QueryFailure.of(e.getMessage()));
        }
    }

    private boolean isAlive() {
        if (connection == null) {
            return false;
        }
        try {
            if (connection.isClosed()) {
                return false;
            }
            int timeout = config.getValidationTimeoutSeconds();
            return timeout == 0 || connection.isValid(timeout);
        } catch (SQLException e) {
            log.warn("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    private QueryResult run(String sql, List<?> params, boolean fetchOne) {
        log.debug("Executing: {} params={}", MaskingLogUtil.abbreviateSql(sql),
                MaskingLogUtil.describeParameters(params));
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            if (fetchOne) {
                ps.setMaxRows(1);
            }
            for (int i = 0; i < params.size(); i++) {
                Object value = params.get(i);
                if (value == null) {
                    ps.setNull(i + 1, Types.NULL);
                } else {
                    ps.setObject(i + 1, value);
                }
            }
            if (ps.execute()) {
                List<NormalizedRow> rows;
                try (ResultSet rs = ps.getResultSet()) {
                    rows = normalizer.readRows(rs, fetchOne);
                }
                return QueryResult.rows(rows);
            }
            int updateCount = ps.getUpdateCount();
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            return QueryResult.noResultSet(updateCount);
        } catch (SQLException e) {
            log.error("Query failed: {} params={} (SQLState={}, code={}): {}",
                    MaskingLogUtil.abbreviateSql(sql), MaskingLogUtil.describeParameters(params),
                    e.getSQLState(), e.getErrorCode(), e.getMessage());
            rollbackIfNeeded();
            return QueryResult.failed(QueryFailure.from(e));
        }
    }

    private void rollbackIfNeeded() {
        try {
            if (connection != null && !connection.isClosed() && !connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback after failed statement did not succeed: {}", e.getMessage());
        }
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error while closing the database connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
