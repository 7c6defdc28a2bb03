package io.github.yok.drupaldblink.db;

import lombok.Getter;

/**
 * Thrown when the configured driver identifier is none of the supported ones.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnsupportedDriverException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    // Identifier exactly as configured (may be null)
    private final String driverId;

    /**
     * Constructor.
     *
     * @param driverId rejected driver identifier
     */
    public UnsupportedDriverException(String driverId) {
        super("Unsupported database driver: " + driverId);
        this.driverId = driverId;
    }
}
