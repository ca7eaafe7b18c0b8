package com.ac.iisc.verification;

import java.time.Duration;

/**
 * Verdict for one case plus what each side produced. Per-case failures live
 * here; they are never thrown.
 */
public final class CaseResult
{
    private final CounterexampleCase testCase;
    private final Verdict verdict;
    private final FailureKind failureKind;
    private final String setupError;
    private final QueryOutcome generated;
    private final QueryOutcome gold;
    private final ComparisonMode mode;

    CaseResult(CounterexampleCase testCase, Verdict verdict, FailureKind failureKind, String setupError,
               QueryOutcome generated, QueryOutcome gold, ComparisonMode mode)
    {
        if (testCase == null || verdict == null || generated == null || gold == null) {
            throw new IllegalArgumentException("case, verdict and both outcomes are required");
        }
        if (verdict != Verdict.ERROR && !(generated.isOk() && gold.isOk())) {
            throw new IllegalArgumentException("EQUAL/NOT_EQUAL require both queries to have run");
        }
        this.testCase = testCase;
        this.verdict = verdict;
        this.failureKind = failureKind == null ? FailureKind.NONE : failureKind;
        this.setupError = setupError == null ? "" : setupError;
        this.generated = generated;
        this.gold = gold;
        this.mode = mode;
    }

    /** Setup script failed: neither query attempted, both query errors empty. */
    static CaseResult setupFailed(CounterexampleCase c, String error, ComparisonMode mode) {
        return new CaseResult(c, Verdict.ERROR, FailureKind.SETUP, error,
                QueryOutcome.notAttempted(QueryFeatures.hasOrderBy(c.getSql1())),
                QueryOutcome.notAttempted(QueryFeatures.hasOrderBy(c.getSql2())), mode);
    }

    /** Canonical outcome of a case that ran past its budget. */
    public static CaseResult timedOut(CounterexampleCase c, Duration budget, ComparisonMode mode) {
        String msg = "timeout after " + budget.toSeconds() + "s";
        return new CaseResult(c, Verdict.ERROR, FailureKind.TIMEOUT, "",
                QueryOutcome.failure(msg, QueryFeatures.hasOrderBy(c.getSql1())),
                QueryOutcome.failure(msg, QueryFeatures.hasOrderBy(c.getSql2())), mode);
    }

    /** Something other than SQL failed (driver missing, unexpected exception). */
    public static CaseResult internalError(CounterexampleCase c, Throwable cause, ComparisonMode mode) {
        String msg = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new CaseResult(c, Verdict.ERROR, FailureKind.INTERNAL, "",
                QueryOutcome.failure(msg, QueryFeatures.hasOrderBy(c.getSql1())),
                QueryOutcome.failure(msg, QueryFeatures.hasOrderBy(c.getSql2())), mode);
    }

    /** Same outcome reported against {@code c} (the text as read, before sanitizing). */
    CaseResult withCase(CounterexampleCase c) {
        return new CaseResult(c, verdict, failureKind, setupError, generated, gold, mode);
    }

    public CounterexampleCase getCase() { return testCase; }
    public String getQuestionId() { return testCase.getQuestionId(); }
    public Integer getBoundSize() { return testCase.getBoundSize(); }
    public Verdict getVerdict() { return verdict; }
    public FailureKind getFailureKind() { return failureKind; }

    /** Setup script error, or "" when setup ran. */
    public String getSetupError() { return setupError; }

    /** Outcome of sql1. */
    public QueryOutcome getGenerated() { return generated; }

    /** Outcome of sql2. */
    public QueryOutcome getGold() { return gold; }

    public ComparisonMode getMode() { return mode; }

    public boolean isTimedOut() { return failureKind == FailureKind.TIMEOUT; }

    /** 1 when the claimed counterexample holds (the two queries really differ), else 0. */
    public int claimHolds() { return verdict == Verdict.NOT_EQUAL ? 1 : 0; }

    @Override
    public String toString() {
        return "CaseResult{" + testCase.getQuestionId() + ", " + verdict
                + (failureKind == FailureKind.NONE ? "" : ", " + failureKind) + "}";
    }
}
