package com.ac.iisc.verification;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a predicted and a gold query against the same SQLite database file and
 * yields 1 when they return the same set of rows, 0 otherwise. Duplicates and
 * row order are ignored; column names are not compared. Any failure or
 * timeout scores 0.
 */
public class ExecutionMatchTask implements VerificationTask<Integer>
{
    private final String predictedSql;
    private final String goldSql;
    private final Path database;

    private volatile Statement active;

    public ExecutionMatchTask(String predictedSql, String goldSql, Path database)
    {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        this.predictedSql = predictedSql == null ? "" : predictedSql;
        this.goldSql = goldSql == null ? "" : goldSql;
        this.database = database;
    }

    @Override
    public Integer call() throws SQLException
    {
        // the driver would silently create an empty database
        if (!Files.isRegularFile(database)) {
            throw new SQLException("database not found: " + database);
        }
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath())) {
            Set<String> predicted = rowSet(conn, predictedSql);
            Set<String> gold = rowSet(conn, goldSql);
            return predicted.equals(gold) ? 1 : 0;
        }
    }

    private Set<String> rowSet(Connection conn, String sql) throws SQLException
    {
        Set<String> rows = new HashSet<>();
        try (Statement st = conn.createStatement()) {
            active = st;
            try (ResultSet rs = st.executeQuery(sql)) {
                int n = rs.getMetaData().getColumnCount();
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(n);
                    for (int i = 1; i <= n; i++) {
                        row.add(ResultNormalizer.normalizeCell(rs.getObject(i)));
                    }
                    rows.add(ResultNormalizer.rowKey(row));
                }
            }
        } finally {
            active = null;
        }
        return rows;
    }

    @Override
    public Integer timedOut(Duration budget) {
        return 0;
    }

    @Override
    public Integer failed(Throwable cause) {
        return 0;
    }

    @Override
    public void abort() {
        Statement st = active;
        if (st == null) return;
        try {
            st.cancel();
        } catch (SQLException ex) {
            System.err.println("[ExecutionMatchTask] Could not cancel statement: " + ex.getMessage());
        }
    }

    @Override
    public String describe() {
        return "pair on " + database.getFileName();
    }
}
