package io.github.yok.drupaldblink.db;

/**
 * Thrown when the JDBC driver refuses to open a connection.
 *
 * <p>
 * The message keeps the driver's own diagnostic text; the original {@link java.sql.SQLException}
 * is available as the cause.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionFailureException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor.
     *
     * @param message diagnostic message
     * @param cause native failure
     */
    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
