package io.github.yok.drupaldblink.util;

import com.google.common.base.Preconditions;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Checks identifiers that must be interpolated into SQL text.
 *
 * <p>
 * Only ASCII letters, digits and underscores are accepted. Anything else is rejected before it
 * reaches a statement that cannot be parameterized (for example {@code SHOW COLUMNS FROM}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class IdentifierValidator {

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+$");

    /**
     * Prevents instantiation.
     */
    @Generated
    private IdentifierValidator() {}

    /**
     * Returns whether the identifier consists only of letters, digits and underscores.
     *
     * @param identifier identifier to test, may be {@code null}
     * @return {@code true} if safe to interpolate
     */
    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE_IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Returns the identifier unchanged if it is safe.
     *
     * @param identifier identifier to check
     * @return the same identifier
     * @throws NullPointerException if {@code identifier} is {@code null}
     * @throws UnsafeIdentifierException if the identifier contains other characters
     */
    public static String requireSafe(String identifier) {
        Preconditions.checkNotNull(identifier, "identifier must not be null");
        if (!isSafe(identifier)) {
            throw new UnsafeIdentifierException(identifier);
        }
        return identifier;
    }
}
