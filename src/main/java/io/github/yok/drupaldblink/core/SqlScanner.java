package io.github.yok.drupaldblink.core;

import lombok.Generated;

/**
 * Finds the parts of SQL text that are not code: string literals, double-quoted identifiers,
 * {@code --} line comments and block comments.
 *
 * <p>
 * Inside a quoted region a doubled quote character stands for itself. When backslash escapes are
 * enabled (MySQL's default {@code sql_mode}), a backslash inside a quoted region also escapes the
 * character that follows it, so {@code 'O\'Brien'} is one literal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class SqlScanner {

    @Generated
    private SqlScanner() {}

    /**
     * Skips the non-code region starting at {@code start}.
     *
     * @param sql SQL text
     * @param start current index
     * @param backslashEscapes whether a backslash escapes the next character inside quotes
     * @return index just after the region, or {@code start} if code starts there
     */
    static int skipNonCode(String sql, int start, boolean backslashEscapes) {
        int len = sql.length();
        char c = sql.charAt(start);
        if (c == '\'' || c == '"') {
            return skipQuoted(sql, start, c, backslashEscapes);
        }
        if (c == '-' && start + 1 < len && sql.charAt(start + 1) == '-') {
            int end = sql.indexOf('\n', start);
            return end < 0 ? len : end;
        }
        if (c == '/' && start + 1 < len && sql.charAt(start + 1) == '*') {
            int end = sql.indexOf("*/", start + 2);
            return end < 0 ? len : end + 2;
        }
        return start;
    }

    /**
     * Returns the index just after the closing quote, or the text length if it is unterminated.
     */
    private static int skipQuoted(String sql, int start, char quote, boolean backslashEscapes) {
        int len = sql.length();
        int i = start + 1;
        while (i < len) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return len;
    }
}
