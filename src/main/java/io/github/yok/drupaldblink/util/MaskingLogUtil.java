package io.github.yok.drupaldblink.util;

import io.github.yok.drupaldblink.config.DatabaseConfig;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility for rendering connection details and SQL text in logs.
 *
 * <p>
 * Credentials are hidden before anything is written to the log: plain password fields, embedded
 * credentials in JDBC URLs and {@code password=} URL parameters. SQL text is collapsed to one line
 * and truncated so that a failing query does not flood the log.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Maximum number of characters of SQL text written to the log.
     */
    public static final int MAX_SQL_LOG_LENGTH = 200;

    /**
     * Pattern that matches embedded credentials in authority-style JDBC URLs.
     */
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#@]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);
    /**
     * Pattern that matches password parameters in JDBC URLs.
     */
    private static final Pattern PASSWORD_PARAM_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a sensitive text.
     *
     * @param value raw text
     * @return {@code ***}, or the input itself when it is {@code null} or empty
     */
    public static String maskText(String value) {
        if (StringUtils.isEmpty(value)) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_PARAM_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats a database configuration for logging. The password is never included.
     *
     * @param config database configuration
     * @return formatted log string
     */
    public static String maskConfig(DatabaseConfig config) {
        if (config == null) {
            return "<null>";
        }
        StringBuilder builder = new StringBuilder();
        builder.append("driver=")
                .append(config.getDriver() == null ? null : config.getDriver().getId());
        builder.append(", host=").append(config.getHost());
        builder.append(", port=").append(config.getPort());
        builder.append(", database=").append(config.getDatabase());
        builder.append(", user=").append(config.getUsername());
        builder.append(", password=").append(maskText(config.getPassword()));
        builder.append(", prefix=").append(config.getPrefix());
        return builder.toString();
    }

    /**
     * Collapses whitespace in SQL text and truncates it to {@link #MAX_SQL_LOG_LENGTH} characters.
     *
     * @param sql SQL text
     * @return abbreviated SQL text
     */
    public static String abbreviateSql(String sql) {
        if (sql == null) {
            return null;
        }
        return StringUtils.abbreviate(StringUtils.normalizeSpace(sql), MAX_SQL_LOG_LENGTH);
    }

    /**
     * Renders bind parameters for logging, abbreviating long values.
     *
     * @param params bind parameters
     * @return printable representation
     */
    public static String describeParameters(List<?> params) {
        if (params == null || params.isEmpty()) {
            return "[]";
        }
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            Object value = params.get(i);
            if (value instanceof byte[]) {
                builder.append("<").append(((byte[]) value).length).append(" bytes>");
            } else {
                builder.append(StringUtils.abbreviate(String.valueOf(value), 64));
            }
        }
        return builder.append("]").toString();
    }
}
