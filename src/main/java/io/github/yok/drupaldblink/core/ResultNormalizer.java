package io.github.yok.drupaldblink.core;

import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.NormalizedRow;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts JDBC result sets into {@link NormalizedRow}s of the same shape for every dialect.
 *
 * <p>
 * Column labels pass through {@link DbDialectHandler#normalizeColumnLabel(String)}. Values are
 * converted as follows:
 * </p>
 * <ul>
 * <li>{@code Byte}, {@code Short}, {@code Integer}, {@code Long} and {@code BigInteger} values that
 * fit into a long become {@link Long}.</li>
 * <li>{@link BigDecimal} with scale 0 that fits into a long becomes {@link Long}.</li>
 * <li>{@link Float} becomes {@link Double}.</li>
 * <li>{@link Timestamp}, {@link java.sql.Date} and {@link Time} become {@code LocalDateTime},
 * {@code LocalDate} and {@code LocalTime}.</li>
 * <li>{@link Clob} is read into a {@link String}.</li>
 * <li>{@code byte[]} and {@link Blob} are decoded as strict UTF-8; undecodable content becomes
 * {@link #UNDECODABLE_BINARY}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ResultNormalizer {

    /**
     * Text returned in place of binary content that is not valid UTF-8.
     */
    public static final String UNDECODABLE_BINARY = "[binary data: not valid UTF-8]";

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final DbDialectHandler dialect;

    /**
     * Reads rows from the current position of a result set.
     *
     * @param rs open result set
     * @param fetchOne {@code true} to stop after the first row
     * @return normalized rows in result-set order
     * @throws SQLException if the result set cannot be read
     */
    public List<NormalizedRow> readRows(ResultSet rs, boolean fetchOne) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int colCount = md.getColumnCount();
        String[] labels = new String[colCount];
        for (int i = 1; i <= colCount; i++) {
            labels[i - 1] = dialect.normalizeColumnLabel(md.getColumnLabel(i));
        }

        List<NormalizedRow> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= colCount; i++) {
                values.put(labels[i - 1], normalizeValue(labels[i - 1], rs.getObject(i)));
            }
            rows.add(new NormalizedRow(values));
            if (fetchOne) {
                break;
            }
        }
        return rows;
    }

    /**
     * Converts one raw JDBC value. A LOB that cannot be read is logged and returned as
     * {@code null}.
     *
     * @param column column label (for logging)
     * @param raw value returned by {@link ResultSet#getObject(int)}
     * @return canonical value
     */
    public Object normalizeValue(String column, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer
                || raw instanceof Long) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            BigInteger big = (BigInteger) raw;
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return big.longValue();
            }
            return big;
        }
        if (raw instanceof BigDecimal) {
            return normalizeDecimal((BigDecimal) raw);
        }
        if (raw instanceof Float) {
            return ((Float) raw).doubleValue();
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate();
        }
        if (raw instanceof Time) {
            return ((Time) raw).toLocalTime();
        }
        if (raw instanceof byte[]) {
            return decodeUtf8((byte[]) raw);
        }
        try {
            if (raw instanceof Clob) {
                Clob clob = (Clob) raw;
                return clob.getSubString(1, (int) clob.length());
            }
            if (raw instanceof Blob) {
                Blob blob = (Blob) raw;
                return decodeUtf8(blob.getBytes(1, (int) blob.length()));
            }
        } catch (SQLException e) {
            log.warn("Failed to read LOB column {}: {}", column, e.getMessage());
            return null;
        }
        return raw;
    }

    /**
     * Decodes bytes as strict UTF-8.
     *
     * @param bytes raw bytes
     * @return decoded text, or {@link #UNDECODABLE_BINARY}
     */
    public static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return UNDECODABLE_BINARY;
        }
    }

    private Object normalizeDecimal(BigDecimal decimal) {
        if (decimal.scale() > 0) {
            return decimal;
        }
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            return decimal;
        }
    }
}
