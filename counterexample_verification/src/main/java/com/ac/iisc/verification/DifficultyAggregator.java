package com.ac.iisc.verification;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Accuracy scores over 0/1 flags, per difficulty band and overall, plus the
 * two passes applied to prover results tables once execution has disproved
 * some claimed counterexamples.
 */
public final class DifficultyAggregator
{
    /** Sentinel written to {@code equivalent} for a claim execution disproved. */
    public static final String FAILED_ATTACK = "Failed Attack";
    public static final String RES_CORRECT = "correct";
    public static final String CLAIMED_NOT_EQUIVALENT = "False";

    private DifficultyAggregator() {
    }

    /**
     * Overall and per-band accuracy.
     *
     * @param flags  1 when a case matched expectations, 0 otherwise (errors count as 0)
     * @param labels difficulty label per flag, same order; null when the run
     *               has no labels, in which case every band reports the overall score
     */
    public static DifficultyBreakdown compute(List<Integer> flags, List<String> labels)
    {
        if (flags == null) {
            throw new IllegalArgumentException("flags must not be null");
        }
        int passed = 0;
        for (Integer f : flags) {
            if (f != null && f != 0) passed++;
        }
        AggregateScore total = AggregateScore.of(passed, flags.size());

        Map<DifficultyBand, AggregateScore> byBand = new EnumMap<>(DifficultyBand.class);
        if (labels == null) {
            for (DifficultyBand b : DifficultyBand.values()) byBand.put(b, total);
            return new DifficultyBreakdown(byBand, total);
        }
        if (labels.size() != flags.size()) {
            throw new IllegalArgumentException("got " + labels.size() + " difficulty labels for " + flags.size() + " results");
        }

        Map<DifficultyBand, int[]> tally = new EnumMap<>(DifficultyBand.class);
        for (DifficultyBand b : DifficultyBand.values()) tally.put(b, new int[2]);
        for (int i = 0; i < flags.size(); i++) {
            DifficultyBand band = DifficultyBand.fromLabel(labels.get(i));
            if (band == null) continue; // unknown labels only count toward the total
            int[] t = tally.get(band);
            Integer f = flags.get(i);
            if (f != null && f != 0) t[0]++;
            t[1]++;
        }
        tally.forEach((b, t) -> byBand.put(b, AggregateScore.of(t[0], t[1])));
        return new DifficultyBreakdown(byBand, total);
    }

    /**
     * Read difficulty labels from a JSON array of objects carrying a
     * {@code difficulty} field (the benchmark's dev/test question files).
     * Objects without the field yield null labels.
     */
    public static List<String> loadDifficulties(Path path) throws IOException
    {
        String text = FileIO.readTextFile(path);
        try {
            JSONArray arr = new JSONArray(text);
            List<String> out = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                JSONObject o = arr.optJSONObject(i);
                out.add(o == null ? null : o.optString("difficulty", null));
            }
            return out;
        } catch (JSONException ex) {
            throw new IOException("Malformed difficulty file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Relabel {@code equivalent} to {@link #FAILED_ATTACK} on every record whose
     * {@code (question_id, bound_size)} belongs to a case whose queries
     * turned out equal. Records are updated in place.
     *
     * @return number of relabelled records
     */
    public static int overrideFailedAttacks(List<CounterexampleRecord> records, List<CaseResult> results)
    {
        List<CaseResult> failed = new ArrayList<>();
        for (CaseResult r : results) {
            if (r.getVerdict() == Verdict.EQUAL) failed.add(r);
        }
        int relabelled = 0;
        for (CounterexampleRecord rec : records) {
            for (CaseResult r : failed) {
                if (rec.matches(r.getQuestionId(), r.getBoundSize())) {
                    rec.set(CounterexampleRecord.EQUIVALENT, FAILED_ATTACK);
                    relabelled++;
                    break;
                }
            }
        }
        return relabelled;
    }

    /**
     * A false positive is a row claiming non-equivalence although the generated
     * SQL was judged correct. Every row of a question with a false positive is
     * removed; the final score is the number of remaining correct rows over
     * the original row count.
     */
    public static ClaimBreakdown breakdown(List<CounterexampleRecord> records)
    {
        Set<String> falsePositiveIds = new HashSet<>();
        for (CounterexampleRecord r : records) {
            if (isFalsePositive(r)) falsePositiveIds.add(r.getQuestionId());
        }

        Map<String, Integer> counts = new HashMap<>();
        int removed = 0;
        for (CounterexampleRecord r : records) {
            if (falsePositiveIds.contains(r.getQuestionId())) {
                removed++;
                continue;
            }
            String res = r.getRes();
            if (res == null || res.isBlank()) continue;
            counts.merge(res.trim(), 1, Integer::sum);
        }

        // most frequent first, ties by name
        Map<String, Integer> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> ordered.put(e.getKey(), e.getValue()));

        return new ClaimBreakdown(records.size(), removed, falsePositiveIds.size(), ordered);
    }

    static boolean isFalsePositive(CounterexampleRecord r) {
        String eq = r.getEquivalent();
        return eq != null && eq.trim().equalsIgnoreCase(CLAIMED_NOT_EQUIVALENT)
                && Objects.equals(trimmed(r.getRes()), RES_CORRECT);
    }

    private static String trimmed(String s) {
        return s == null ? null : s.trim();
    }
}
