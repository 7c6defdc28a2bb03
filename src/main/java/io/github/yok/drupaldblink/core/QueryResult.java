package io.github.yok.drupaldblink.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.drupaldblink.db.NormalizedRow;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one statement executed through {@link QueryExecutor}.
 *
 * <ul>
 * <li>{@link Status#ROWS}: the statement produced a result set (possibly empty).</li>
 * <li>{@link Status#NO_RESULT_SET}: the statement produced an update count only.</li>
 * <li>{@link Status#FAILED}: the statement could not be executed.</li>
 * </ul>
 *
 * <p>
 * An empty result is therefore never confused with a failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class QueryResult {

    /**
     * Result kinds.
     */
    public enum Status {
        ROWS, NO_RESULT_SET, FAILED
    }

    private final Status status;

    private final List<NormalizedRow> rows;

    private final int updateCount;

    @Getter(AccessLevel.NONE)
    private final QueryFailure failure;

    private QueryResult(Status status, List<NormalizedRow> rows, int updateCount,
            QueryFailure failure) {
        this.status = status;
        this.rows = rows;
        this.updateCount = updateCount;
        this.failure = failure;
    }

    /**
     * Creates a result carrying rows.
     *
     * @param rows normalized rows
     * @return result
     */
    public static QueryResult rows(List<NormalizedRow> rows) {
        Preconditions.checkNotNull(rows, "rows must not be null");
        return new QueryResult(Status.ROWS, ImmutableList.copyOf(rows), -1, null);
    }

    /**
     * Creates a result for a statement without result set.
     *
     * @param updateCount affected row count reported by the driver
     * @return result
     */
    public static QueryResult noResultSet(int updateCount) {
        return new QueryResult(Status.NO_RESULT_SET, ImmutableList.of(), updateCount, null);
    }

    /**
     * Creates a failed result.
     *
     * @param failure failure detail
     * @return result
     */
    public static QueryResult failed(QueryFailure failure) {
        Preconditions.checkNotNull(failure, "failure must not be null");
        return new QueryResult(Status.FAILED, ImmutableList.of(), -1, failure);
    }

    /**
     * Returns whether the statement failed.
     *
     * @return {@code true} for {@link Status#FAILED}
     */
    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Returns the first row.
     *
     * @return first row, empty if no row matched or the statement did not return rows
     */
    public Optional<NormalizedRow> getSingleRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Returns the failure detail.
     *
     * @return detail, empty unless {@link #isFailed()}
     */
    public Optional<QueryFailure> getFailure() {
        return Optional.ofNullable(failure);
    }
}
