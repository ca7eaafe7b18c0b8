package com.ac.iisc.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What running one query of a case produced.
 *
 * Rows hold normalized cells only (null, Long, Double or String), see
 * {@link ResultNormalizer#normalizeCell(Object)}.
 */
public final class QueryOutcome
{
    private final boolean ok;
    private final String error;
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final int sampleLimit;
    private final boolean hasOrderBy;

    private QueryOutcome(boolean ok, String error, List<String> columns, List<List<Object>> rows, int sampleLimit, boolean hasOrderBy)
    {
        this.ok = ok;
        this.error = error == null ? "" : error;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.rows = rows == null ? List.of() : List.copyOf(rows);
        this.sampleLimit = Math.max(0, sampleLimit);
        this.hasOrderBy = hasOrderBy;
    }

    /** Successful execution. Cells may be null, so each row is wrapped rather than copied with List.copyOf. */
    public static QueryOutcome success(List<String> columns, List<List<Object>> rows, int sampleLimit, boolean hasOrderBy) {
        List<List<Object>> frozen = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            frozen.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new QueryOutcome(true, "", columns, frozen, sampleLimit, hasOrderBy);
    }

    /** Query that raised an error. */
    public static QueryOutcome failure(String error, boolean hasOrderBy) {
        return new QueryOutcome(false, error, List.of(), List.of(), 0, hasOrderBy);
    }

    /** Query that was never run (setup failed or the case timed out). */
    public static QueryOutcome notAttempted(boolean hasOrderBy) {
        return new QueryOutcome(false, "", List.of(), List.of(), 0, hasOrderBy);
    }

    public boolean isOk() { return ok; }

    /** Driver message, or "" when the query succeeded or was not attempted. */
    public String getError() { return error; }

    public List<String> getColumns() { return columns; }

    public int getRowCount() { return rows.size(); }

    /** Every row in retrieval order. */
    public List<List<Object>> getFullRows() { return rows; }

    /** The first rows, at most the configured sample size. */
    public List<List<Object>> getSampleRows() {
        return rows.subList(0, Math.min(rows.size(), sampleLimit));
    }

    /** The single value of a one-row, one-column result; null otherwise. */
    public Object getScalar() {
        return ResultNormalizer.maybeScalar(columns, rows);
    }

    /** Whether the query text carries a top-level ORDER BY. */
    public boolean hasOrderBy() { return hasOrderBy; }

    @Override
    public String toString() {
        return ok ? "QueryOutcome{ok, columns=" + columns + ", rows=" + rows.size() + "}"
                  : "QueryOutcome{failed: " + error + "}";
    }
}
