package com.ac.iisc.verification;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;

/**
 * Writes one CSV row per verified case. Full result rows are inlined as JSON
 * only for sides that returned at most {@code inlineMaxRows} rows; larger
 * results leave the cell empty.
 */
public class ResultWriter
{
    public static final List<String> COLUMNS = List.of(
            "bound_size",
            "question_id", "equal",
            "generated_sql_error", "gold_sql_error",
            "generated_sql_columns", "gold_sql_columns",
            "generated_sql_results", "gold_sql_results",
            "generated_sql_scalar", "gold_sql_scalar",
            "generated_sql", "gold_sql",
            "generated_sql_ok", "gold_sql_ok",
            "setup_error");

    private final int inlineMaxRows;

    public ResultWriter() {
        this(FileIO.getInlineMaxRows());
    }

    /** @param inlineMaxRows row cap for inlined results; 0 or less never inlines */
    public ResultWriter(int inlineMaxRows) {
        this.inlineMaxRows = inlineMaxRows;
    }

    public void write(Path out, List<CaseResult> results) throws IOException {
        List<List<String>> rows = new ArrayList<>(results.size());
        for (CaseResult r : results) {
            rows.add(toRow(r));
        }
        FileIO.writeTable(out, COLUMNS, rows);
    }

    /** Cells of one result, in {@link #COLUMNS} order. */
    List<String> toRow(CaseResult r)
    {
        QueryOutcome gen = r.getGenerated();
        QueryOutcome gold = r.getGold();
        List<String> row = new ArrayList<>(COLUMNS.size());
        row.add(r.getBoundSize() == null ? "" : String.valueOf(r.getBoundSize()));
        row.add(r.getQuestionId());
        row.add(r.getVerdict().getLabel());
        row.add(gen.getError());
        row.add(gold.getError());
        row.add(columnsCell(gen));
        row.add(columnsCell(gold));
        row.add(resultsCell(gen));
        row.add(resultsCell(gold));
        row.add(ResultNormalizer.scalarText(gen.getScalar()));
        row.add(ResultNormalizer.scalarText(gold.getScalar()));
        row.add(r.getCase().getSql1());
        row.add(r.getCase().getSql2());
        row.add(pyBool(gen.isOk()));
        row.add(pyBool(gold.isOk()));
        row.add(r.getSetupError());
        return row;
    }

    private static String columnsCell(QueryOutcome o) {
        return o.isOk() ? new JSONArray(o.getColumns()).toString() : "";
    }

    private String resultsCell(QueryOutcome o) {
        if (!o.isOk() || inlineMaxRows <= 0 || o.getRowCount() > inlineMaxRows) return "";
        return ResultNormalizer.rowsToJson(o.getFullRows());
    }

    // same spelling as the input tables' boolean columns
    private static String pyBool(boolean b) {
        return b ? "True" : "False";
    }
}
