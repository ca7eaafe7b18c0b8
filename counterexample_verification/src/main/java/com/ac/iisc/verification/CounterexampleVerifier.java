package com.ac.iisc.verification;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns prover result records into executed cases.
 *
 * Steps:
 * 1) {@link #selectClaims(List)}: keep the rows that claim non-equivalence.
 * 2) {@link #parseCases(List)}: split each claim's counterexample text into cases.
 * 3) {@link #verify(List)}: sanitize and execute every case on the worker pool.
 */
public class CounterexampleVerifier
{
    private final ComparisonMode mode;
    private final int workers;
    private final Duration timeout;
    private final boolean sanitizeQueries;
    private final int sampleRows;
    private final TextSanitizer sanitizer;
    private final BlockParser parser = new BlockParser();

    public CounterexampleVerifier(ComparisonMode mode, int workers, Duration timeout, boolean sanitizeQueries)
    {
        this(mode, workers, timeout, sanitizeQueries, FileIO.getSampleRows(), new TextSanitizer());
    }

    public CounterexampleVerifier(ComparisonMode mode, int workers, Duration timeout, boolean sanitizeQueries,
                                  int sampleRows, TextSanitizer sanitizer)
    {
        if (mode == null || timeout == null || sanitizer == null) {
            throw new IllegalArgumentException("mode, timeout and sanitizer are required");
        }
        this.mode = mode;
        this.workers = workers;
        this.timeout = timeout;
        this.sanitizeQueries = sanitizeQueries;
        this.sampleRows = sampleRows;
        this.sanitizer = sanitizer;
    }

    /**
     * Rows whose {@code equivalent} is False and whose generated SQL was judged
     * correct (or that carry no {@code res} column at all).
     */
    public static List<CounterexampleRecord> selectClaims(List<CounterexampleRecord> records)
    {
        List<CounterexampleRecord> out = new ArrayList<>();
        for (CounterexampleRecord r : records) {
            String eq = r.getEquivalent();
            if (eq == null || !eq.trim().equalsIgnoreCase(DifficultyAggregator.CLAIMED_NOT_EQUIVALENT)) continue;
            String res = r.getRes();
            if (!r.has(CounterexampleRecord.RES) || DifficultyAggregator.RES_CORRECT.equals(res == null ? null : res.trim())) {
                out.add(r);
            }
        }
        return out;
    }

    /**
     * Parse every record's counterexample text. Records without usable blocks
     * or with a non-integer {@code bound_size} contribute nothing; a record
     * without a question id is named {@code row_<n>} (1-based).
     *
     * @throws IllegalArgumentException if records exist but none has a counterexample column
     */
    public List<CounterexampleCase> parseCases(List<CounterexampleRecord> records)
    {
        if (!records.isEmpty() && records.stream().noneMatch(r -> r.has(CounterexampleRecord.COUNTEREXAMPLE))) {
            throw new IllegalArgumentException("input must contain a '" + CounterexampleRecord.COUNTEREXAMPLE
                    + "' column; found " + records.get(0).columns());
        }
        List<CounterexampleCase> cases = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            CounterexampleRecord r = records.get(i);
            String text = r.getCounterexample();
            if (text == null || text.isBlank()) continue;
            String id = r.getQuestionId();
            if (id == null || id.isEmpty()) id = "row_" + (i + 1);
            if (!r.hasValidBoundSize()) {
                System.err.println("[CounterexampleVerifier] Skipping " + id + ": bound_size '"
                        + r.get(CounterexampleRecord.BOUND_SIZE) + "' is not a whole number.");
                continue;
            }
            cases.addAll(parser.parseCases(id, r.getBoundSize(), text));
        }
        return cases;
    }

    /** Execute every case; results come back in case order. */
    public List<CaseResult> verify(List<CounterexampleCase> cases) throws InterruptedException
    {
        List<CaseExecutionTask> tasks = new ArrayList<>(cases.size());
        for (CounterexampleCase c : cases) {
            tasks.add(new CaseExecutionTask(c, sanitizer, sanitizeQueries, mode, sampleRows));
        }
        ParallelScheduler scheduler = new ParallelScheduler(workers, timeout, "cases");
        return scheduler.runAll(tasks);
    }

    /** Cases whose queries returned equal results: the claimed counterexample does not hold. */
    public static List<CaseResult> incorrectAttacks(List<CaseResult> results) {
        List<CaseResult> out = new ArrayList<>();
        for (CaseResult r : results) {
            if (r.getVerdict() == Verdict.EQUAL) out.add(r);
        }
        return out;
    }
}
