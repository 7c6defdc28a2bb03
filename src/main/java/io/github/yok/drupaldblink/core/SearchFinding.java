package io.github.yok.drupaldblink.core;

import io.github.yok.drupaldblink.db.NormalizedRow;
import java.util.List;
import lombok.Value;

/**
 * Rows of one table column that contain the searched text.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SearchFinding {

    // Logical table name (without prefix)
    String tableName;
    // Column that matched
    String columnName;
    // Matching rows, at most the requested limit
    List<NormalizedRow> matchingRows;
}
