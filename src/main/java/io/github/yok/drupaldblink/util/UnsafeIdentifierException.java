package io.github.yok.drupaldblink.util;

import lombok.Getter;

/**
 * Thrown when an identifier fails the injection-safety check of {@link IdentifierValidator}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnsafeIdentifierException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    // Rejected identifier
    private final String identifier;

    /**
     * Constructor.
     *
     * @param identifier rejected identifier
     */
    public UnsafeIdentifierException(String identifier) {
        super("Invalid identifier (only letters, digits and '_' are allowed): " + identifier);
        this.identifier = identifier;
    }
}
