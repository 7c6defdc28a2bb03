package io.github.yok.drupaldblink.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One result row in the canonical shape shared by every dialect.
 *
 * <p>
 * Columns keep the order of the result set. Values are plain Java scalars (text, numbers, booleans,
 * {@code java.time} values, decoded binary text) or {@code null}. Instances are unmodifiable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class NormalizedRow {

    private final Map<String, Object> values;

    /**
     * Creates a row from an ordered column-to-value mapping. The mapping is copied.
     *
     * @param values column values in result-set order
     */
    public NormalizedRow(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a column.
     *
     * @param column column label
     * @return value, {@code null} if the column is absent or SQL NULL
     */
    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the value of a column looked up without regard to case.
     *
     * <p>
     * Catalog queries report column labels in different cases depending on the engine
     * ({@code TABLE_NAME} vs {@code table_name}).
     * </p>
     *
     * @param column column label in any case
     * @return value, or empty if the column is absent or SQL NULL
     */
    public Optional<Object> getIgnoreCase(String column) {
        if (values.containsKey(column)) {
            return Optional.ofNullable(values.get(column));
        }
        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (e.getKey().equalsIgnoreCase(column)) {
                return Optional.ofNullable(e.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the value of the first column.
     *
     * @return first value, or empty if the row has no columns or the value is SQL NULL
     */
    public Optional<Object> getFirst() {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.values().iterator().next());
    }

    /**
     * Returns whether the row has a column with the given label.
     *
     * @param column column label
     * @return {@code true} if present
     */
    public boolean containsColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * Returns the column labels in result-set order.
     *
     * @return column labels
     */
    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    /**
     * Returns the row as an unmodifiable ordered map.
     *
     * @return column-to-value view
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int size() {
        return values.size();
    }
}
