package com.ac.iisc.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DifficultyAggregatorTest
{
    @TempDir
    Path tmp;

    private static CounterexampleRecord record(String id, String bound, String equivalent, String res) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("question_id", id);
        m.put("bound_size", bound);
        m.put("equivalent", equivalent);
        m.put("res", res);
        return new CounterexampleRecord(m);
    }

    @Test
    void testBandsAndTotal()
    {
        List<Integer> flags = List.of(1, 0, 1, 1, 0);
        List<String> labels = List.of("simple", "simple", "Moderate", "challenging", "challenging");
        DifficultyBreakdown b = DifficultyAggregator.compute(flags, labels);

        assertEquals(2, b.get(DifficultyBand.SIMPLE).getCount());
        assertEquals(50.0, b.get(DifficultyBand.SIMPLE).getAccuracyPercent(), 1e-9);
        assertEquals(100.0, b.get(DifficultyBand.MODERATE).getAccuracyPercent(), 1e-9);
        assertEquals(50.0, b.get(DifficultyBand.CHALLENGING).getAccuracyPercent(), 1e-9);
        assertEquals(5, b.getTotal().getCount());
        assertEquals(60.0, b.getTotal().getAccuracyPercent(), 1e-9);
    }

    @Test
    void testEmptyBandScoresZero()
    {
        DifficultyBreakdown b = DifficultyAggregator.compute(List.of(1, 1), List.of("simple", "simple"));
        assertEquals(0, b.get(DifficultyBand.MODERATE).getCount());
        assertEquals(0.0, b.get(DifficultyBand.MODERATE).getAccuracyPercent(), 1e-9);
        assertEquals(0.0, DifficultyAggregator.compute(List.of(), null).getTotal().getAccuracyPercent(), 1e-9);
    }

    @Test
    void testUnknownLabelsOnlyCountInTotal()
    {
        DifficultyBreakdown b = DifficultyAggregator.compute(List.of(1, 0, 1), Arrays.asList("simple", "expert", null));
        assertEquals(1, b.get(DifficultyBand.SIMPLE).getCount());
        assertEquals(3, b.getTotal().getCount());
        assertEquals(200.0 / 3, b.getTotal().getAccuracyPercent(), 1e-9);
    }

    @Test
    void testWithoutLabelsEveryBandReportsTheTotal()
    {
        DifficultyBreakdown b = DifficultyAggregator.compute(List.of(1, 0, 0, 1), null);
        for (DifficultyBand band : DifficultyBand.values()) {
            assertEquals(4, b.get(band).getCount());
            assertEquals(50.0, b.get(band).getAccuracyPercent(), 1e-9);
        }
    }

    @Test
    void testLabelCountMustMatch()
    {
        assertThrows(IllegalArgumentException.class, () -> DifficultyAggregator.compute(List.of(1, 0), List.of("simple")));
    }

    @Test
    void testFormatHasEveryColumn()
    {
        String table = DifficultyAggregator.compute(List.of(1, 0), List.of("simple", "moderate")).format();
        assertTrue(table.contains("simple"));
        assertTrue(table.contains("challenging"));
        assertTrue(table.contains("EX"));
        assertTrue(table.contains("50.00"));
    }

    @Test
    void testLoadDifficulties() throws Exception
    {
        Path f = tmp.resolve("dev.json");
        Files.writeString(f, "[{\"question_id\":0,\"difficulty\":\"simple\"},{\"question_id\":1},{\"difficulty\":\"challenging\"}]");

        List<String> labels = DifficultyAggregator.loadDifficulties(f);
        assertEquals(3, labels.size());
        assertEquals("simple", labels.get(0));
        assertNull(labels.get(1));
        assertEquals("challenging", labels.get(2));
    }

    @Test
    void testMalformedDifficultyFile() throws Exception
    {
        Path f = tmp.resolve("bad.json");
        Files.writeString(f, "{not json");
        assertThrows(IOException.class, () -> DifficultyAggregator.loadDifficulties(f));
        assertThrows(IOException.class, () -> DifficultyAggregator.loadDifficulties(tmp.resolve("missing.json")));
    }

    @Test
    void testOverrideFailedAttacksMatchesIdAndBound()
    {
        String setup = "CREATE TABLE t(x INT); INSERT INTO t VALUES (1);";
        CounterexampleCase disproved = new CounterexampleCase("10", 2, setup, "SELECT 1", "SELECT 1");
        CaseResult equal = new CaseResult(disproved, Verdict.EQUAL, FailureKind.NONE, "",
                QueryOutcome.success(List.of("1"), List.of(List.of(1L)), 10, false),
                QueryOutcome.success(List.of("1"), List.of(List.of(1L)), 10, false),
                ComparisonMode.ORDER_INSENSITIVE);
        CaseResult error = CaseResult.timedOut(new CounterexampleCase("11", 2, setup, "SELECT 1", "SELECT 2"),
                java.time.Duration.ofSeconds(1), ComparisonMode.ORDER_INSENSITIVE);

        List<CounterexampleRecord> records = new ArrayList<>(List.of(
                record("10", "2", "False", "correct"),
                record("10", "3.0", "False", "correct"),
                record("11", "2", "False", "correct")));

        assertEquals(1, DifficultyAggregator.overrideFailedAttacks(records, List.of(equal, error)));
        assertEquals(DifficultyAggregator.FAILED_ATTACK, records.get(0).getEquivalent());
        assertEquals("False", records.get(1).getEquivalent());
        assertEquals("False", records.get(2).getEquivalent());
    }

    @Test
    void testUnreadableBoundSizesNeverMatch()
    {
        CounterexampleCase blankBound = new CounterexampleCase("7", null, "CREATE TABLE t(x INT);", "SELECT 1", "SELECT 1");
        CaseResult equal = new CaseResult(blankBound, Verdict.EQUAL, FailureKind.NONE, "",
                QueryOutcome.success(List.of("1"), List.of(List.of(1L)), 10, false),
                QueryOutcome.success(List.of("1"), List.of(List.of(1L)), 10, false),
                ComparisonMode.ORDER_INSENSITIVE);
        List<CounterexampleRecord> records = List.of(
                record("7", "b1", "False", "correct"),
                record("7", "b2", "False", "correct"),
                record("7", "", "False", "correct"));

        assertEquals(1, DifficultyAggregator.overrideFailedAttacks(records, List.of(equal)));
        assertEquals("False", records.get(0).getEquivalent());
        assertEquals("False", records.get(1).getEquivalent());
        assertEquals(DifficultyAggregator.FAILED_ATTACK, records.get(2).getEquivalent());
    }

    @Test
    void testBreakdownRemovesFalsePositiveQuestions()
    {
        List<CounterexampleRecord> records = List.of(
                record("1", "1", "False", "correct"),
                record("1", "2", "Failed Attack", "correct"),
                record("2", "1", "True", "correct"),
                record("2", "2", "Failed Attack", "correct"),
                record("3", "1", "True", "incorrect"),
                record("4", "1", "false", "incorrect"));

        ClaimBreakdown b = DifficultyAggregator.breakdown(records);

        assertEquals(6, b.getOriginalCount());
        assertEquals(2, b.getRemovedCount());
        assertEquals(4, b.getRemainingCount());
        assertEquals(1, b.getFalsePositiveCount());
        assertEquals(List.of("correct", "incorrect"), new ArrayList<>(b.getResCounts().keySet()));
        assertEquals(Integer.valueOf(2), b.getResCounts().get("correct"));
        assertEquals(2.0 / 6, b.getFinalExScore(), 1e-9);
        assertTrue(b.format().contains("Final EX Score: 33.3333%"));
    }

    @Test
    void testFalsePositiveNeedsBothConditions()
    {
        assertTrue(DifficultyAggregator.isFalsePositive(record("1", "1", " FALSE ", "correct")));
        assertFalse(DifficultyAggregator.isFalsePositive(record("1", "1", "False", "incorrect")));
        assertFalse(DifficultyAggregator.isFalsePositive(record("1", "1", "Failed Attack", "correct")));
    }
}
