package com.ac.iisc.verification;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry that verifies claimed counterexamples.
 *
 * Flow:
 * 1) Read the prover results table and keep the rows claiming non-equivalence.
 * 2) Parse, sanitize and execute every counterexample on SQLite.
 * 3) Write the per-case results table and report the claims execution disproved.
 * 4) Relabel disproved claims as "Failed Attack" in a copy of the input and
 *    print the resulting score breakdown (written to ATTACK_UPDATED.csv with
 *    --update_original).
 *
 * Exit codes: 0 ok, 1 I/O failure, 2 bad arguments or no valid case, 130 interrupted.
 */
public class Main
{
    static final String DEFAULT_OUT = "verieql_verification_results.csv";
    static final String UPDATED_FILE = "ATTACK_UPDATED.csv";

    private static final String USAGE =
            "Usage: Main --input <csv> [--out <csv>] [--order_sensitive] [--list] [--update_original]\n"
          + "            [--workers <n>] [--timeout <seconds>] [--sanitize_queries]";

    /** Parsed command line. */
    static final class Options
    {
        Path input;
        Path out = Paths.get(DEFAULT_OUT);
        boolean orderSensitive;
        boolean list;
        boolean updateOriginal;
        int workers = FileIO.getWorkers();
        int timeoutSeconds = FileIO.getCaseTimeoutSeconds();
        boolean sanitizeQueries = FileIO.isSanitizeQueries();

        static Options parse(String[] args)
        {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--input" -> o.input = Paths.get(value(args, ++i, a));
                    case "--out" -> o.out = Paths.get(value(args, ++i, a));
                    case "--order_sensitive" -> o.orderSensitive = true;
                    case "--list" -> o.list = true;
                    case "--update_original" -> o.updateOriginal = true;
                    case "--sanitize_queries" -> o.sanitizeQueries = true;
                    case "--workers" -> o.workers = positiveInt(value(args, ++i, a), a);
                    case "--timeout" -> o.timeoutSeconds = positiveInt(value(args, ++i, a), a);
                    default -> throw new IllegalArgumentException("unknown option: " + a);
                }
            }
            if (o.input == null) {
                throw new IllegalArgumentException("--input is required");
            }
            return o;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[i];
        }

        private static int positiveInt(String raw, String option) {
            try {
                int v = Integer.parseInt(raw.trim());
                if (v < 1) throw new IllegalArgumentException(option + " must be >= 1");
                return v;
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(option + " expects an integer, got '" + raw + "'");
            }
        }
    }

    /** Runs the verification and returns the process exit code. */
    static int run(String[] args)
    {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("[Main] " + ex.getMessage());
            System.err.println(USAGE);
            return 2;
        }

        try
        {
            List<CounterexampleRecord> records = FileIO.readRecords(opts.input);
            List<CounterexampleRecord> claims = CounterexampleVerifier.selectClaims(records);
            System.out.println("[Main] " + claims.size() + " of " + records.size() + " rows claim a counterexample.");

            CounterexampleVerifier verifier = new CounterexampleVerifier(
                    ComparisonMode.of(opts.orderSensitive), opts.workers,
                    Duration.ofSeconds(opts.timeoutSeconds), opts.sanitizeQueries);

            List<CounterexampleCase> cases;
            try {
                cases = verifier.parseCases(claims);
            } catch (IllegalArgumentException ex) {
                System.err.println("[Main] " + ex.getMessage());
                return 2;
            }
            if (cases.isEmpty()) {
                System.err.println("No valid cases found (are the sql1/sql2 markers present in the 'counterexample' text?).");
                return 2;
            }

            List<CaseResult> results = verifier.verify(cases);
            new ResultWriter().write(opts.out, results);
            printVerdictSummary(results);

            List<CaseResult> incorrect = CounterexampleVerifier.incorrectAttacks(results);
            System.out.println("Amount of incorrect attacks: " + incorrect.size());
            if (opts.list) {
                for (CaseResult r : incorrect) {
                    System.out.println("Incorrect attack: Question ID: " + r.getQuestionId()
                            + ", Bound: " + (r.getBoundSize() == null ? "" : r.getBoundSize()));
                }
            }

            List<CounterexampleRecord> updated = new ArrayList<>(records.size());
            for (CounterexampleRecord r : records) updated.add(r.copy());
            int relabelled = DifficultyAggregator.overrideFailedAttacks(updated, results);
            System.out.println("[Main] Relabelled " + relabelled + " row(s) as '" + DifficultyAggregator.FAILED_ATTACK + "'.");
            System.out.print(DifficultyAggregator.breakdown(updated).format());

            if (opts.updateOriginal) {
                Path updatedPath = FileIO.sibling(opts.input, UPDATED_FILE);
                FileIO.writeRecords(updatedPath, updated);
                System.out.println("[Main] Wrote updated table to " + updatedPath);
            }

            System.out.println("Wrote " + results.size() + " results to " + opts.out);
            return 0;
        }
        catch (IOException ex)
        {
            System.err.println("[Main] " + ex.getMessage());
            return 1;
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            System.err.println("[Main] Interrupted; no results written.");
            return 130;
        }
    }

    private static void printVerdictSummary(List<CaseResult> results) {
        int[] counts = new int[Verdict.values().length];
        int timeouts = 0;
        for (CaseResult r : results) {
            counts[r.getVerdict().ordinal()]++;
            if (r.isTimedOut()) timeouts++;
        }
        System.out.println("[Main] Verdicts: " + Verdict.EQUAL.getLabel() + "=" + counts[Verdict.EQUAL.ordinal()]
                + ", " + Verdict.NOT_EQUAL.getLabel() + "=" + counts[Verdict.NOT_EQUAL.ordinal()]
                + ", " + Verdict.ERROR.getLabel() + "=" + counts[Verdict.ERROR.ordinal()]
                + " (timeouts=" + timeouts + ")");
    }

    /**
     * Shutdown hook body: while a batch is running it interrupts the batch
     * thread and waits for it to unwind. Once the batch has returned it does
     * nothing, so exiting with a non-zero code does not wait on it.
     */
    static final class ShutdownGuard implements Runnable
    {
        private final Thread batchThread;
        private final long joinMillis;
        private volatile boolean batchRunning = true;
        private volatile boolean shuttingDown;

        ShutdownGuard(Thread batchThread, long joinMillis) {
            this.batchThread = batchThread;
            this.joinMillis = joinMillis;
        }

        /** Called by the batch thread once {@link Main#run(String[])} has returned. */
        void batchFinished() {
            batchRunning = false;
        }

        /** True once the JVM has started running shutdown hooks. */
        boolean isShuttingDown() {
            return shuttingDown;
        }

        @Override
        public void run()
        {
            shuttingDown = true;
            if (!batchRunning) return;
            batchThread.interrupt();
            try {
                batchThread.join(joinMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public static void main(String[] args)
    {
        // Ctrl-C: stop the batch through the same interrupt path a caller would use
        ShutdownGuard guard = new ShutdownGuard(Thread.currentThread(), 5_000);
        Runtime.getRuntime().addShutdownHook(new Thread(guard, "verify-shutdown"));

        int code = run(args);
        guard.batchFinished();
        // System.exit would block once the JVM is already shutting down
        if (code != 0 && !guard.isShuttingDown()) {
            System.exit(code);
        }
    }
}
