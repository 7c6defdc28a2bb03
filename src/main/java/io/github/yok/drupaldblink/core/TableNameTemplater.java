package io.github.yok.drupaldblink.core;

import io.github.yok.drupaldblink.util.IdentifierValidator;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Rewrites logical table references into physical (prefixed) table names.
 *
 * <p>
 * A reference is written {@code {logical_name}}, optionally with blanks inside the braces
 * ({@code { node }}). The name consists of letters, digits and underscores. The query is scanned
 * once from left to right:
 * </p>
 * <ul>
 * <li>a well-formed reference is replaced by {@code prefix + logical_name};</li>
 * <li>any other brace is copied unchanged;</li>
 * <li>nothing inside a string literal, a double-quoted identifier or a comment is rewritten.</li>
 * </ul>
 *
 * <p>
 * Expanded text contains no references, so expanding it again returns it unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TableNameTemplater {

    @Getter
    private final String prefix;

    private final boolean backslashEscapes;

    /**
     * Constructor. A backslash inside a quoted literal escapes the next character.
     *
     * @param prefix table prefix, {@code null} is treated as empty
     */
    public TableNameTemplater(String prefix) {
        this(prefix, true);
    }

    /**
     * Constructor.
     *
     * @param prefix table prefix, {@code null} is treated as empty
     * @param backslashEscapes {@code true} if the dialect reads {@code \'} inside a literal as an
     *        escaped quote
     */
    public TableNameTemplater(String prefix, boolean backslashEscapes) {
        this.prefix = StringUtils.defaultString(prefix);
        this.backslashEscapes = backslashEscapes;
    }

    /**
     * Builds a reference token for a table name that is only known at call time.
     *
     * @param logicalName logical table name
     * @return {@code {logicalName}}
     * @throws io.github.yok.drupaldblink.util.UnsafeIdentifierException if the name contains
     *         characters other than letters, digits and underscores
     */
    public static String placeholder(String logicalName) {
        return "{" + IdentifierValidator.requireSafe(logicalName) + "}";
    }

    /**
     * Expands every table reference in a query.
     *
     * @param template query containing {@code {logical_name}} references
     * @return query with physical table names
     */
    public String prepareQuery(String template) {
        if (template == null || template.indexOf('{') < 0) {
            return template;
        }
        StringBuilder out = new StringBuilder(template.length() + 16);
        int i = 0;
        int len = template.length();
        while (i < len) {
            int skipped = SqlScanner.skipNonCode(template, i, backslashEscapes);
            if (skipped > i) {
                out.append(template, i, skipped);
                i = skipped;
                continue;
            }
            char c = template.charAt(i);
            if (c == '{') {
                int end = matchReference(template, i, out);
                if (end > 0) {
                    i = end;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Converts a logical table name to its physical name.
     *
     * @param logicalName logical table name
     * @return {@code prefix + logicalName}
     */
    public String toPhysicalName(String logicalName) {
        return prefix + logicalName;
    }

    /**
     * Converts a physical table name back to its logical name.
     *
     * <p>
     * The prefix is compared without regard to case because some catalogs report names in a
     * different case than they were configured.
     * </p>
     *
     * @param physicalName table name as found in the catalog
     * @return logical name, empty if the table does not carry the prefix
     */
    public Optional<String> toLogicalName(String physicalName) {
        if (physicalName == null) {
            return Optional.empty();
        }
        if (prefix.isEmpty()) {
            return Optional.of(physicalName);
        }
        if (physicalName.length() <= prefix.length() || !physicalName
                .toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(physicalName.substring(prefix.length()));
    }

    /**
     * Tries to read a reference starting at {@code start} (which holds '{').
     *
     * @param text query text
     * @param start index of the opening brace
     * @param out output buffer, receives the physical name on success
     * @return index just after the closing brace, or {@code -1} if no reference starts here
     */
    private int matchReference(String text, int start, StringBuilder out) {
        int len = text.length();
        int pos = skipBlanks(text, start + 1);
        int nameStart = pos;
        while (pos < len && isNameChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == nameStart) {
            return -1;
        }
        String name = text.substring(nameStart, pos);
        pos = skipBlanks(text, pos);
        if (pos >= len || text.charAt(pos) != '}') {
            return -1;
        }
        out.append(prefix).append(name);
        return pos + 1;
    }

    private static int skipBlanks(String text, int pos) {
        while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '_';
    }
}
