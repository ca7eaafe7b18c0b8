package com.ac.iisc.verification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution score of a prover results table once false-positive questions
 * are removed. See {@link DifficultyAggregator#breakdown(java.util.List)}.
 */
public final class ClaimBreakdown
{
    private final int originalCount;
    private final int removedCount;
    private final int falsePositiveCount;
    private final Map<String, Integer> resCounts;

    public ClaimBreakdown(int originalCount, int removedCount, int falsePositiveCount, Map<String, Integer> resCounts)
    {
        this.originalCount = originalCount;
        this.removedCount = removedCount;
        this.falsePositiveCount = falsePositiveCount;
        this.resCounts = Collections.unmodifiableMap(new LinkedHashMap<>(resCounts));
    }

    public int getOriginalCount() { return originalCount; }
    public int getRemovedCount() { return removedCount; }
    public int getRemainingCount() { return originalCount - removedCount; }

    /** Number of distinct questions with a false positive. */
    public int getFalsePositiveCount() { return falsePositiveCount; }

    /** {@code res} value to number of remaining rows, most frequent first. */
    public Map<String, Integer> getResCounts() { return resCounts; }

    /** Remaining rows with {@code res == correct} over all original rows, as a fraction. */
    public double getFinalExScore() {
        if (originalCount == 0) return 0.0;
        return resCounts.getOrDefault(DifficultyAggregator.RES_CORRECT, 0) / (double) originalCount;
    }

    public String format()
    {
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        sb.append("Original count: ").append(originalCount).append(nl);
        sb.append("Removed count: ").append(removedCount).append(nl);
        sb.append("Remaining count: ").append(getRemainingCount()).append(nl);
        sb.append("False positive count: ").append(falsePositiveCount).append(nl);
        sb.append("Res counts:").append(nl);
        int remaining = getRemainingCount();
        resCounts.forEach((res, n) -> sb.append(String.format("  %-20s %6d  (%.2f%%)%n", res, n,
                remaining == 0 ? 0.0 : n * 100.0 / remaining)));
        sb.append(String.format("Final EX Score: %.4f%%%n", getFinalExScore() * 100.0));
        return sb.toString();
    }
}
