package io.github.yok.drupaldblink.db;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * SQL text together with its positional ({@code ?}) bind parameters.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SqlStatement {

    String sql;

    List<Object> parameters;

    /**
     * Creates a statement.
     *
     * @param sql SQL text using {@code ?} placeholders
     * @param parameters bind values in placeholder order (null values allowed)
     * @return statement
     */
    public static SqlStatement of(String sql, Object... parameters) {
        return new SqlStatement(sql,
                Collections.unmodifiableList(new ArrayList<>(Arrays.asList(parameters))));
    }
}
