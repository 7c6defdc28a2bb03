package io.github.yok.drupaldblink.config;

import java.util.List;
import lombok.Getter;

/**
 * Thrown when the database configuration lacks a field that is required for connecting.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConfigIncompleteException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    // Names of the missing fields, in declaration order
    private final List<String> missingFields;

    /**
     * Constructor.
     *
     * @param missingFields names of the missing fields
     */
    public ConfigIncompleteException(List<String> missingFields) {
        super("Database configuration is incomplete. Missing: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }
}
