package com.ac.iisc.verification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a prover results table (one question at one bound size).
 *
 * Columns keep the order in which they were read so the table can be written
 * back unchanged apart from relabelled cells. Column lookup ignores case, the
 * same way the tables produced by different prover runs are read.
 */
public final class CounterexampleRecord
{
    public static final String QUESTION_ID = "question_id";
    public static final String BOUND_SIZE = "bound_size";
    public static final String EQUIVALENT = "equivalent";
    public static final String RES = "res";
    public static final String COUNTEREXAMPLE = "counterexample";
    public static final String TIME_COST = "time_cost";
    public static final String GENERATED_SQL = "generated_sql";
    public static final String GOLD_SQL = "gold_sql";

    private final Map<String, String> values = new LinkedHashMap<>();

    public CounterexampleRecord() {
    }

    public CounterexampleRecord(Map<String, String> values) {
        if (values != null) {
            values.forEach(this::set);
        }
    }

    /** Copy of this record; relabelling the copy leaves this one untouched. */
    public CounterexampleRecord copy() {
        return new CounterexampleRecord(values);
    }

    /** Column names in insertion order. */
    public List<String> columns() {
        return new ArrayList<>(values.keySet());
    }

    /** Cell value for a column (case-insensitive), or null when the column is absent. */
    public String get(String column) {
        String key = resolve(column);
        return key == null ? null : values.get(key);
    }

    public boolean has(String column) {
        return resolve(column) != null;
    }

    /** Set a cell; an existing column keeps its original spelling and position. */
    public CounterexampleRecord set(String column, String value) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be null or blank");
        }
        String key = resolve(column);
        values.put(key == null ? column : key, value == null ? "" : value);
        return this;
    }

    private String resolve(String column) {
        if (column == null) return null;
        if (values.containsKey(column)) return column;
        for (String key : values.keySet()) {
            if (key.equalsIgnoreCase(column)) return key;
        }
        return null;
    }

    public String getQuestionId() {
        String v = get(QUESTION_ID);
        return v == null ? null : v.trim();
    }

    /**
     * Bound size as an integer. Tables that went through a spreadsheet or a
     * dataframe sometimes carry "3.0"; integral decimals are accepted.
     * Returns null when the column is missing, blank or not a whole number.
     */
    public Integer getBoundSize() {
        return parseWholeNumber(get(BOUND_SIZE));
    }

    public String getEquivalent() {
        return get(EQUIVALENT);
    }

    public String getRes() {
        return get(RES);
    }

    public String getCounterexample() {
        return get(COUNTEREXAMPLE);
    }

    /** False when the {@code bound_size} cell holds something other than a whole number; a blank cell is valid. */
    public boolean hasValidBoundSize() {
        String raw = get(BOUND_SIZE);
        return raw == null || raw.isBlank() || parseWholeNumber(raw) != null;
    }

    /**
     * True when this row is the given {@code (question_id, bound_size)} pair.
     * A row with an unreadable bound size never matches.
     */
    public boolean matches(String questionId, Integer boundSize) {
        return hasValidBoundSize()
                && Objects.equals(getQuestionId(), questionId) && Objects.equals(getBoundSize(), boundSize);
    }

    static Integer parseWholeNumber(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim();
        try {
            return Integer.valueOf(t);
        } catch (NumberFormatException ex) {
            try {
                double d = Double.parseDouble(t);
                if (d == Math.rint(d) && !Double.isInfinite(d)) {
                    return (int) d;
                }
            } catch (NumberFormatException ignored) {
                // not numeric at all
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return "CounterexampleRecord" + values;
    }
}
