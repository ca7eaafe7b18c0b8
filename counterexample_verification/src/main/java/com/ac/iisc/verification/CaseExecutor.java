package com.ac.iisc.verification;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one case against its own in-memory SQLite database and compares the
 * two query results.
 *
 * Flow:
 * 1) Open {@code jdbc:sqlite::memory:} and switch off durability (the
 *    database only lives for this case).
 * 2) Run the setup script as one multi-statement script. On failure the case
 *    is {@link Verdict#ERROR} and neither query runs.
 * 3) Run sql1, then sql2, catching each failure separately.
 * 4) Compare under the configured {@link ComparisonMode}.
 *
 * An instance serves one {@link #execute(CounterexampleCase)} call at a time;
 * {@link #abort()} may be called from any thread while it runs.
 */
public class CaseExecutor
{
    static final String JDBC_URL = "jdbc:sqlite::memory:";

    private static final String[] PRAGMAS = {
        "PRAGMA foreign_keys = OFF",
        "PRAGMA journal_mode = OFF",
        "PRAGMA synchronous = OFF",
        "PRAGMA temp_store = MEMORY",
        "PRAGMA cache_size = -100000"
    };

    private final ComparisonMode mode;
    private final int sampleRows;

    private volatile Statement active;
    private volatile boolean aborted;

    public CaseExecutor(ComparisonMode mode) {
        this(mode, FileIO.getSampleRows());
    }

    public CaseExecutor(ComparisonMode mode, int sampleRows) {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        this.mode = mode;
        this.sampleRows = sampleRows;
    }

    public ComparisonMode getMode() {
        return mode;
    }

    /**
     * Execute a case. SQL failures end up in the returned result; only
     * failures to open the database are reported as {@link FailureKind#INTERNAL}.
     */
    public CaseResult execute(CounterexampleCase c)
    {
        if (c == null) {
            throw new IllegalArgumentException("case must not be null");
        }
        boolean ordered1 = QueryFeatures.hasOrderBy(c.getSql1());
        boolean ordered2 = QueryFeatures.hasOrderBy(c.getSql2());

        try (Connection conn = DriverManager.getConnection(JDBC_URL))
        {
            try (Statement st = conn.createStatement()) {
                for (String pragma : PRAGMAS) {
                    st.execute(pragma);
                }
            }

            try (Statement st = track(conn.createStatement())) {
                checkAborted();
                st.executeUpdate(c.getSetupSql());
            } catch (SQLException ex) {
                return CaseResult.setupFailed(c, message(ex), mode);
            } finally {
                active = null;
            }

            QueryOutcome generated = runQuery(conn, c.getSql1(), ordered1);
            QueryOutcome gold = runQuery(conn, c.getSql2(), ordered2);

            if (!generated.isOk() || !gold.isOk()) {
                return new CaseResult(c, Verdict.ERROR, FailureKind.QUERY, "", generated, gold, mode);
            }
            if (mode == ComparisonMode.ORDER_SENSITIVE && !(ordered1 && ordered2)) {
                System.err.println("[CaseExecutor] " + c.getQuestionId()
                        + ": order-sensitive comparison but a query has no top-level ORDER BY");
            }
            Verdict verdict = ResultNormalizer.resultsEqual(generated, gold, mode) ? Verdict.EQUAL : Verdict.NOT_EQUAL;
            return new CaseResult(c, verdict, FailureKind.NONE, "", generated, gold, mode);
        }
        catch (SQLException ex)
        {
            return CaseResult.internalError(c, ex, mode);
        }
    }

    private QueryOutcome runQuery(Connection conn, String sql, boolean ordered)
    {
        try (Statement st = track(conn.createStatement()))
        {
            checkAborted();
            List<String> columns = new ArrayList<>();
            List<List<Object>> rows = new ArrayList<>();
            if (st.execute(sql)) {
                try (ResultSet rs = st.getResultSet()) {
                    ResultSetMetaData md = rs.getMetaData();
                    int n = md.getColumnCount();
                    for (int i = 1; i <= n; i++) {
                        columns.add(md.getColumnLabel(i));
                    }
                    while (rs.next()) {
                        List<Object> row = new ArrayList<>(n);
                        for (int i = 1; i <= n; i++) {
                            row.add(ResultNormalizer.normalizeCell(rs.getObject(i)));
                        }
                        rows.add(row);
                    }
                }
            }
            return QueryOutcome.success(columns, rows, sampleRows, ordered);
        }
        catch (SQLException ex)
        {
            return QueryOutcome.failure(message(ex), ordered);
        }
        finally
        {
            active = null;
        }
    }

    /**
     * Interrupt the running statement (sqlite3_interrupt). The executing thread
     * then fails fast and closes the connection as it unwinds; later steps of
     * the same case are skipped.
     */
    public void abort()
    {
        aborted = true;
        Statement st = active;
        if (st != null) {
            try {
                st.cancel();
            } catch (SQLException ex) {
                System.err.println("[CaseExecutor] Could not cancel statement: " + ex.getMessage());
            }
        }
    }

    private Statement track(Statement st) {
        active = st;
        return st;
    }

    private void checkAborted() throws SQLException {
        if (aborted) {
            throw new SQLException("aborted");
        }
    }

    private static String message(SQLException ex) {
        String m = ex.getMessage();
        return (m == null || m.isBlank()) ? ex.getClass().getSimpleName() : m;
    }
}
