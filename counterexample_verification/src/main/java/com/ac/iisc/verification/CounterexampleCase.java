package com.ac.iisc.verification;

import java.util.Objects;

/**
 * One parsed counterexample: a setup script that should make the two queries
 * diverge, plus the two queries themselves.
 *
 * Instances are immutable and always carry non-empty setup/query text; the
 * constructor rejects anything else so that malformed input is caught at the
 * parse boundary rather than deep inside execution.
 *
 * {@code questionId} is not unique on its own (the prover is run for several
 * bound sizes per question); {@code (questionId, boundSize)} is the key.
 */
public final class CounterexampleCase
{
    private final String questionId;
    private final Integer boundSize;
    private final String setupSql;
    private final String sql1;
    private final String sql2;

    public CounterexampleCase(String questionId, Integer boundSize, String setupSql, String sql1, String sql2)
    {
        if (questionId == null || questionId.isBlank()) {
            throw new IllegalArgumentException("questionId must not be null or blank");
        }
        this.questionId = questionId;
        this.boundSize = boundSize;
        this.setupSql = requireText(setupSql, "setupSql");
        this.sql1 = requireText(sql1, "sql1");
        this.sql2 = requireText(sql2, "sql2");
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    /** Copy with a replaced setup script (used after sanitization). */
    public CounterexampleCase withSetupSql(String newSetupSql) {
        return new CounterexampleCase(questionId, boundSize, newSetupSql, sql1, sql2);
    }

    /** Copy with replaced query text. */
    public CounterexampleCase withQueries(String newSql1, String newSql2) {
        return new CounterexampleCase(questionId, boundSize, setupSql, newSql1, newSql2);
    }

    public String getQuestionId() { return questionId; }

    /** Bound size carried through from the source record, or null when the record had none. */
    public Integer getBoundSize() { return boundSize; }

    public String getSetupSql() { return setupSql; }

    /** First query (the generated SQL in prover output). */
    public String getSql1() { return sql1; }

    /** Second query (the gold SQL in prover output). */
    public String getSql2() { return sql2; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterexampleCase other)) return false;
        return questionId.equals(other.questionId)
                && Objects.equals(boundSize, other.boundSize)
                && setupSql.equals(other.setupSql)
                && sql1.equals(other.sql1)
                && sql2.equals(other.sql2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questionId, boundSize, setupSql, sql1, sql2);
    }

    @Override
    public String toString() {
        return "CounterexampleCase{" + questionId + (boundSize == null ? "" : ", bound=" + boundSize) + "}";
    }
}
