package com.ac.iisc.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ResultWriterTest
{
    private static final CounterexampleCase CASE = new CounterexampleCase("12", null,
            "CREATE TABLE t(x INT);", "SELECT x, y FROM t", "SELECT x FROM t");

    private static String cell(List<String> row, String column) {
        return row.get(ResultWriter.COLUMNS.indexOf(column));
    }

    @Test
    void testLargeResultsAreNotInlined()
    {
        QueryOutcome three = QueryOutcome.success(List.of("x", "y"),
                List.of(Arrays.asList(1L, null), Arrays.asList(2L, "b"), Arrays.asList(3L, 1.5)), 10, false);
        QueryOutcome one = QueryOutcome.success(List.of("x"), List.of(Arrays.asList((Object) 7L)), 10, false);
        CaseResult r = new CaseResult(CASE, Verdict.NOT_EQUAL, FailureKind.NONE, "", three, one, ComparisonMode.ORDER_INSENSITIVE);

        List<String> row = new ResultWriter(2).toRow(r);

        assertEquals(ResultWriter.COLUMNS.size(), row.size());
        assertEquals("", cell(row, "bound_size"));
        assertEquals("False", cell(row, "equal"));
        assertEquals("", cell(row, "generated_sql_results"));
        assertEquals("[\"x\",\"y\"]", cell(row, "generated_sql_columns"));
        assertEquals("[[7]]", cell(row, "gold_sql_results"));
        assertEquals("", cell(row, "generated_sql_scalar"));
        assertEquals("7", cell(row, "gold_sql_scalar"));
        assertEquals("SELECT x, y FROM t", cell(row, "generated_sql"));

        assertEquals("[[1,null],[2,\"b\"],[3,1.5]]", cell(new ResultWriter(100).toRow(r), "generated_sql_results"));
        assertEquals("", cell(new ResultWriter(0).toRow(r), "gold_sql_results"));
    }

    @Test
    void testTimedOutRow()
    {
        List<String> row = new ResultWriter(100).toRow(CaseResult.timedOut(CASE, Duration.ofSeconds(30), ComparisonMode.ORDER_SENSITIVE));

        assertEquals("Error", cell(row, "equal"));
        assertEquals("timeout after 30s", cell(row, "generated_sql_error"));
        assertEquals("timeout after 30s", cell(row, "gold_sql_error"));
        assertEquals("False", cell(row, "gold_sql_ok"));
        assertEquals("", cell(row, "setup_error"));
    }
}
