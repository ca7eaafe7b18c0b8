package com.ac.iisc.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest
{
    @TempDir
    Path tmp;

    private Path writeInput(List<CounterexampleRecord> records) throws Exception {
        Path input = tmp.resolve("prover_results.csv");
        FileIO.writeRecords(input, records);
        return input;
    }

    @Test
    void testEndToEnd() throws Exception
    {
        Path input = writeInput(List.of(
                CounterexampleVerifierTest.record("1", "1", "False", "correct",
                        CounterexampleVerifierTest.block("SELECT x FROM t ORDER BY x ASC", "SELECT x FROM t ORDER BY x DESC")),
                CounterexampleVerifierTest.record("2", "1", "False", "correct",
                        CounterexampleVerifierTest.block("SELECT count(*) FROM t", "SELECT count(*) FROM t WHERE x > 1")),
                CounterexampleVerifierTest.record("3", "1", "True", "correct", "")));
        Path out = tmp.resolve("out/results.csv");

        int code = Main.run(new String[] {"--input", input.toString(), "--out", out.toString(), "--list", "--workers", "2"});

        assertEquals(0, code);
        List<CounterexampleRecord> rows = FileIO.readRecords(out);
        assertEquals(2, rows.size());
        assertEquals(ResultWriter.COLUMNS, rows.get(0).columns());
        assertEquals("1", rows.get(0).getQuestionId());
        assertEquals("True", rows.get(0).get("equal"));
        assertEquals("[[1],[2]]", rows.get(0).get("generated_sql_results"));
        assertEquals("[\"x\"]", rows.get(0).get("gold_sql_columns"));
        assertEquals("False", rows.get(1).get("equal"));
        assertEquals("2", rows.get(1).get("generated_sql_scalar"));
        assertEquals("1", rows.get(1).get("gold_sql_scalar"));
        assertEquals("True", rows.get(1).get("generated_sql_ok"));
        assertEquals("", rows.get(1).get("setup_error"));
        // only written on request
        assertFalse(Files.exists(tmp.resolve(Main.UPDATED_FILE)));
    }

    @Test
    void testOrderSensitiveRunAndUpdatedTable() throws Exception
    {
        Path input = writeInput(List.of(
                CounterexampleVerifierTest.record("1", "1", "False", "correct",
                        CounterexampleVerifierTest.block("SELECT x FROM t ORDER BY x ASC", "SELECT x FROM t ORDER BY x DESC")),
                CounterexampleVerifierTest.record("2", "2", "False", "correct",
                        CounterexampleVerifierTest.block("SELECT x FROM t ORDER BY x", "SELECT x FROM t ORDER BY x"))));
        Path out = tmp.resolve("results.csv");

        int code = Main.run(new String[] {"--input", input.toString(), "--out", out.toString(),
                "--order_sensitive", "--update_original"});

        assertEquals(0, code);
        List<CounterexampleRecord> rows = FileIO.readRecords(out);
        assertEquals("False", rows.get(0).get("equal"));
        assertEquals("True", rows.get(1).get("equal"));

        List<CounterexampleRecord> updated = FileIO.readRecords(tmp.resolve(Main.UPDATED_FILE));
        assertEquals("False", updated.get(0).getEquivalent());
        assertEquals(DifficultyAggregator.FAILED_ATTACK, updated.get(1).getEquivalent());
        // the input itself is left alone
        assertEquals("False", FileIO.readRecords(input).get(1).getEquivalent());
    }

    @Test
    void testSetupErrorIsReported() throws Exception
    {
        String broken = "CREATE TABLE t(x INT;\n" + BlockParser.SQL1_MARKER + "\nSELECT 1\n" + BlockParser.SQL2_MARKER + "\nSELECT 2";
        Path input = writeInput(List.of(CounterexampleVerifierTest.record("9", "3", "False", null, broken)));
        Path out = tmp.resolve("results.csv");

        assertEquals(0, Main.run(new String[] {"--input", input.toString(), "--out", out.toString()}));
        CounterexampleRecord row = FileIO.readRecords(out).get(0);
        assertEquals("Error", row.get("equal"));
        assertEquals("3", row.get("bound_size"));
        assertFalse(row.get("setup_error").isEmpty());
        assertEquals("", row.get("generated_sql_error"));
        assertEquals("False", row.get("generated_sql_ok"));
        assertEquals("", row.get("generated_sql_columns"));
    }

    @Test
    void testNoValidCases() throws Exception
    {
        Path input = writeInput(List.of(CounterexampleVerifierTest.record("1", "1", "False", null, "no markers")));
        Path out = tmp.resolve("results.csv");

        assertEquals(2, Main.run(new String[] {"--input", input.toString(), "--out", out.toString()}));
        assertFalse(Files.exists(out));
    }

    @Test
    void testMissingCounterexampleColumn() throws Exception
    {
        Path input = writeInput(List.of(CounterexampleVerifierTest.record("1", "1", "False", null, null)));
        assertEquals(2, Main.run(new String[] {"--input", input.toString()}));
    }

    @Test
    void testBadArguments()
    {
        assertEquals(2, Main.run(new String[] {}));
        assertEquals(2, Main.run(new String[] {"--input"}));
        assertEquals(2, Main.run(new String[] {"--input", "x.csv", "--workers", "zero"}));
        assertEquals(2, Main.run(new String[] {"--input", "x.csv", "--timeout", "0"}));
        assertEquals(2, Main.run(new String[] {"--input", "x.csv", "--frobnicate"}));
    }

    @Test
    void testMissingInputFile()
    {
        assertEquals(1, Main.run(new String[] {"--input", tmp.resolve("absent.csv").toString()}));
    }

    @Test
    void testShutdownGuardInterruptsRunningBatch() throws Exception
    {
        Thread batch = new Thread(() -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        batch.start();
        Main.ShutdownGuard guard = new Main.ShutdownGuard(batch, 5_000);

        guard.run();

        assertFalse(batch.isAlive());
        assertTrue(guard.isShuttingDown());
    }

    @Test
    void testShutdownGuardReturnsAtOnceAfterBatch() throws Exception
    {
        Thread batch = new Thread(() -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        batch.start();
        Main.ShutdownGuard guard = new Main.ShutdownGuard(batch, 5_000);
        guard.batchFinished();

        long start = System.nanoTime();
        guard.run();

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 500);
        // not interrupted: still sleeping
        assertTrue(batch.isAlive());
        batch.interrupt();
        batch.join(5_000);
    }

    @Test
    void testOptionsDefaults()
    {
        Main.Options o = Main.Options.parse(new String[] {"--input", "in.csv"});
        assertEquals(Path.of(Main.DEFAULT_OUT), o.out);
        assertFalse(o.orderSensitive);
        assertEquals(1, o.workers);
        assertEquals(30, o.timeoutSeconds);
        assertFalse(o.updateOriginal);
    }
}
