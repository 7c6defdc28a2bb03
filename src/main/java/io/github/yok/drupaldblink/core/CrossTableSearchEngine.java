package io.github.yok.drupaldblink.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.db.SqlStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Searches every text-like column of every table for a substring.
 *
 * <p>
 * For each table the columns are read through {@link SchemaIntrospector}; each text-like column
 * gets one case-insensitive {@code LIKE '%needle%'} query limited with the dialect's row-limit
 * construct. A table or column that cannot be read is logged and skipped, so one broken table
 * does not abort the search.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class CrossTableSearchEngine {

    private final QueryExecutor executor;

    private final SchemaIntrospector introspector;

    private final DbDialectHandler dialect;

    /**
     * Searches all prefixed tables.
     *
     * @param needle text to look for
     * @param rowLimitPerColumn maximum number of rows returned per column
     * @return findings in table and column order; empty if nothing matched or tables could not be
     *         listed
     * @throws IllegalArgumentException if the needle is blank or the limit is not positive
     */
    public List<SearchFinding> searchAllTables(String needle, int rowLimitPerColumn) {
        checkArguments(needle, rowLimitPerColumn);
        Optional<List<String>> tables = introspector.listTables();
        if (tables.isEmpty()) {
            log.warn("Search aborted: table list is unavailable");
            return ImmutableList.of();
        }
        List<SearchFinding> findings = new ArrayList<>();
        for (String table : tables.get()) {
            findings.addAll(scanTable(table, needle, rowLimitPerColumn));
        }
        log.info("Search for '{}' found matches in {} column(s)", StringUtils.abbreviate(needle, 64),
                findings.size());
        return ImmutableList.copyOf(findings);
    }

    /**
     * Searches one table.
     *
     * @param logicalName logical table name
     * @param needle text to look for
     * @param rowLimitPerColumn maximum number of rows returned per column
     * @return findings in column order
     * @throws IllegalArgumentException if the needle is blank or the limit is not positive
     */
    public List<SearchFinding> searchTable(String logicalName, String needle,
            int rowLimitPerColumn) {
        checkArguments(needle, rowLimitPerColumn);
        return ImmutableList.copyOf(scanTable(logicalName, needle, rowLimitPerColumn));
    }

    private List<SearchFinding> scanTable(String logicalName, String needle, int limit) {
        Optional<Map<String, String>> schema = introspector.getTableSchema(logicalName);
        if (schema.isEmpty()) {
            log.debug("Skipping table {}: schema unavailable", logicalName);
            return ImmutableList.of();
        }
        String physical = introspector.toStoredTableName(logicalName);
        String pattern = "%" + needle + "%";
        List<SearchFinding> findings = new ArrayList<>();
        for (Map.Entry<String, String> column : schema.get().entrySet()) {
            if (!introspector.isTextLike(column.getValue())) {
                continue;
            }
            SqlStatement stmt = dialect.buildColumnSearch(physical,
                    introspector.toStoredColumnName(logicalName, column.getKey()), pattern, limit);
            QueryResult result = executor.execute(stmt.getSql(), stmt.getParameters());
            if (result.isFailed()) {
                log.warn("Skipping column {}.{}: {}", logicalName, column.getKey(), result
                        .getFailure().map(QueryFailure::getMessage).orElse("unknown error"));
                continue;
            }
            if (!result.getRows().isEmpty()) {
                findings.add(new SearchFinding(logicalName, column.getKey(), result.getRows()));
            }
        }
        return findings;
    }

    private static void checkArguments(String needle, int rowLimitPerColumn) {
        Preconditions.checkArgument(StringUtils.isNotBlank(needle), "needle must not be blank");
        Preconditions.checkArgument(rowLimitPerColumn > 0,
                "rowLimitPerColumn must be positive: %s", rowLimitPerColumn);
    }
}
