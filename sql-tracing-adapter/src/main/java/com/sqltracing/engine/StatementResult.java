package com.sqltracing.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of executing a {@link SqlStatement}.
 */
public final class StatementResult {

    /** Update count, or -1 for queries. */
    private final int updateCount;

    /** Rows fetched by a query, empty for updates. */
    private final List<Map<String, Object>> rows;

    StatementResult(final int updateCount,
            final List<Map<String, Object>> rows) {
        this.updateCount = updateCount;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Get the number of rows affected by an update.
     *
     * @return the update count, -1 when the statement was a query
     */
    public int getUpdateCount() {
        return updateCount;
    }

    /**
     * Get the rows returned by a query, keyed by column label.
     *
     * @return the rows, in result set order
     */
    public List<Map<String, Object>> getRows() {
        return rows;
    }
}
