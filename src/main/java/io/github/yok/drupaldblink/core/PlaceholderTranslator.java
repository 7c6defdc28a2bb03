package io.github.yok.drupaldblink.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Generated;
import lombok.Value;

/**
 * Translates {@code :name} placeholders into JDBC positional {@code ?} placeholders.
 *
 * <p>
 * Names start with a letter or underscore followed by letters, digits or underscores. The scan
 * skips single-quoted literals, double-quoted identifiers, {@code --} line comments and block
 * comments (see {@link SqlScanner}). A {@code ::} cast ({@code value::text}) is not a
 * placeholder. A name used several times yields one positional parameter per occurrence.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class PlaceholderTranslator {

    /**
     * SQL text with positional placeholders and the parameter names in order of appearance.
     */
    @Value
    public static class ParsedStatement {
        String sql;
        List<String> parameterNames;

        /**
         * Resolves bind values for the parameter names.
         *
         * @param namedParams values by name
         * @return values in placeholder order
         * @throws IllegalArgumentException if a name has no value
         */
        public List<Object> bind(Map<String, ?> namedParams) {
            List<Object> values = new ArrayList<>(parameterNames.size());
            for (String name : parameterNames) {
                if (namedParams == null || !namedParams.containsKey(name)) {
                    throw new IllegalArgumentException("No value for named parameter: " + name);
                }
                values.add(namedParams.get(name));
            }
            return values;
        }
    }

    @Generated
    private PlaceholderTranslator() {}

    /**
     * Parses a statement, treating a backslash inside quotes as an escape character.
     *
     * @param sql SQL text using {@code :name} placeholders
     * @return translated statement
     */
    public static ParsedStatement parse(String sql) {
        return parse(sql, true);
    }

    /**
     * Parses a statement.
     *
     * @param sql SQL text using {@code :name} placeholders
     * @param backslashEscapes {@code true} if the dialect reads {@code \'} inside a literal as an
     *        escaped quote
     * @return translated statement
     */
    public static ParsedStatement parse(String sql, boolean backslashEscapes) {
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        int len = sql.length();
        int i = 0;
        while (i < len) {
            int skipped = SqlScanner.skipNonCode(sql, i, backslashEscapes);
            if (skipped > i) {
                out.append(sql, i, skipped);
                i = skipped;
                continue;
            }
            char c = sql.charAt(i);
            if (c == ':' && i + 1 < len && sql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < len && isNameStart(sql.charAt(i + 1))) {
                int end = i + 2;
                while (end < len && isNamePart(sql.charAt(end))) {
                    end++;
                }
                names.add(sql.substring(i + 1, end));
                out.append('?');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return new ParsedStatement(out.toString(), ImmutableList.copyOf(names));
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
