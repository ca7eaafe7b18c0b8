package com.ac.iisc.verification;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the prover over every question at every bound size and produces the
 * results table that {@link Main} later verifies.
 *
 * Both queries are formatted with {@link SqlTextFormatter#formatSql(String)};
 * back-tick quoted names in the generated query are turned into plain
 * identifiers. Rows come out ordered by question, then bound size.
 */
public class ProverSweep
{
    /** Bound sizes tried when the caller names none. */
    public static final List<Integer> DEFAULT_BOUNDS = List.of(1, 2, 3);

    public static final List<String> COLUMNS = List.of(
            CounterexampleRecord.BOUND_SIZE, CounterexampleRecord.QUESTION_ID, CounterexampleRecord.EQUIVALENT,
            CounterexampleRecord.COUNTEREXAMPLE, CounterexampleRecord.TIME_COST,
            CounterexampleRecord.GENERATED_SQL, CounterexampleRecord.GOLD_SQL);

    private static final Map<String, Boolean> PROVER_OPTIONS = Map.of(
            "generate_code", true,
            "timer", true,
            "show_counterexample", true);

    private final EquivalenceProver prover;
    private final ParallelScheduler scheduler;

    public ProverSweep(EquivalenceProver prover, int workers, Duration timeout)
    {
        if (prover == null) {
            throw new IllegalArgumentException("prover must not be null");
        }
        this.prover = prover;
        this.scheduler = new ParallelScheduler(workers, timeout, "prover calls");
    }

    public List<CounterexampleRecord> run(List<ProverQuestion> questions, List<Integer> bounds) throws InterruptedException
    {
        List<Integer> sizes = (bounds == null || bounds.isEmpty()) ? DEFAULT_BOUNDS : bounds;
        List<ProverTask> tasks = new ArrayList<>(questions.size() * sizes.size());
        for (ProverQuestion q : questions) {
            String generated = SqlTextFormatter.cleanBacktickIdentifiers(SqlTextFormatter.formatSql(q.getGeneratedSql()));
            String gold = SqlTextFormatter.formatSql(q.getGoldSql());
            for (int bound : sizes) {
                tasks.add(new ProverTask(prover, q, generated, gold, bound, PROVER_OPTIONS));
            }
        }

        List<ProverResult> results = scheduler.runAll(tasks);
        List<CounterexampleRecord> rows = new ArrayList<>(results.size());
        for (int i = 0; i < tasks.size(); i++) {
            rows.add(toRecord(tasks.get(i), results.get(i)));
        }
        return rows;
    }

    static CounterexampleRecord toRecord(ProverTask task, ProverResult result)
    {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(CounterexampleRecord.BOUND_SIZE, String.valueOf(task.getBoundSize()));
        values.put(CounterexampleRecord.QUESTION_ID, task.getQuestion().getQuestionId());
        values.put(CounterexampleRecord.EQUIVALENT, result.getStatus().getLabel());
        values.put(CounterexampleRecord.COUNTEREXAMPLE, result.getCounterexample());
        values.put(CounterexampleRecord.TIME_COST, result.getTimeCost() == null ? "" : String.valueOf(result.getTimeCost()));
        values.put(CounterexampleRecord.GENERATED_SQL, task.getGeneratedSql());
        values.put(CounterexampleRecord.GOLD_SQL, task.getGoldSql());
        return new CounterexampleRecord(values);
    }

    /** Write sweep rows in the column layout the verifier reads. */
    public static void write(Path out, List<CounterexampleRecord> rows) throws IOException {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (CounterexampleRecord r : rows) {
            List<String> row = new ArrayList<>(COLUMNS.size());
            for (String c : COLUMNS) {
                String v = r.get(c);
                row.add(v == null ? "" : v);
            }
            cells.add(row);
        }
        FileIO.writeTable(out, COLUMNS, cells);
    }
}
