package io.github.yok.drupaldblink.core;

import java.sql.SQLException;
import lombok.Value;

/**
 * Diagnostic detail of a failed statement.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class QueryFailure {

    // Driver message
    String message;
    // SQLState, null when the driver reports none
    String sqlState;
    // Vendor error code
    int errorCode;

    /**
     * Captures the diagnostics of a JDBC exception.
     *
     * @param e JDBC exception
     * @return failure detail
     */
    public static QueryFailure from(SQLException e) {
        return new QueryFailure(e.getMessage(), e.getSQLState(), e.getErrorCode());
    }

    /**
     * Creates a failure that did not originate from the driver.
     *
     * @param message description
     * @return failure detail
     */
    public static QueryFailure of(String message) {
        return new QueryFailure(message, null, 0);
    }
}
