package com.ac.iisc.verification;

import java.time.Duration;

/**
 * Sanitizes and executes one case. The setup script is always sanitized; the
 * queries only when {@code sanitizeQueries} is set.
 */
public class CaseExecutionTask implements VerificationTask<CaseResult>
{
    private final CounterexampleCase testCase;
    private final TextSanitizer sanitizer;
    private final boolean sanitizeQueries;
    private final ComparisonMode mode;
    private final int sampleRows;

    private volatile CaseExecutor executor;

    public CaseExecutionTask(CounterexampleCase testCase, TextSanitizer sanitizer, boolean sanitizeQueries,
                             ComparisonMode mode, int sampleRows)
    {
        if (testCase == null || sanitizer == null || mode == null) {
            throw new IllegalArgumentException("case, sanitizer and mode are required");
        }
        this.testCase = testCase;
        this.sanitizer = sanitizer;
        this.sanitizeQueries = sanitizeQueries;
        this.mode = mode;
        this.sampleRows = sampleRows;
    }

    @Override
    public CaseResult call() {
        CounterexampleCase prepared = testCase.withSetupSql(sanitizer.sanitize(testCase.getSetupSql()));
        if (sanitizeQueries) {
            prepared = prepared.withQueries(sanitizer.sanitizeQuery(prepared.getSql1()),
                                            sanitizer.sanitizeQuery(prepared.getSql2()));
        }
        CaseExecutor ex = new CaseExecutor(mode, sampleRows);
        executor = ex;
        return ex.execute(prepared).withCase(testCase);
    }

    @Override
    public CaseResult timedOut(Duration budget) {
        return CaseResult.timedOut(testCase, budget, mode);
    }

    @Override
    public CaseResult failed(Throwable cause) {
        return CaseResult.internalError(testCase, cause, mode);
    }

    @Override
    public void abort() {
        CaseExecutor ex = executor;
        if (ex != null) ex.abort();
    }

    @Override
    public String describe() {
        return "case " + testCase.getQuestionId() + (testCase.getBoundSize() == null ? "" : " @" + testCase.getBoundSize());
    }

    public CounterexampleCase getCase() {
        return testCase;
    }
}
