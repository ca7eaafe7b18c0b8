package com.ac.iisc.verification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Score per difficulty band plus the overall score. */
public final class DifficultyBreakdown
{
    private final Map<DifficultyBand, AggregateScore> byBand;
    private final AggregateScore total;

    public DifficultyBreakdown(Map<DifficultyBand, AggregateScore> byBand, AggregateScore total)
    {
        EnumMap<DifficultyBand, AggregateScore> copy = new EnumMap<>(DifficultyBand.class);
        for (DifficultyBand b : DifficultyBand.values()) {
            AggregateScore s = byBand == null ? null : byBand.get(b);
            copy.put(b, s == null ? AggregateScore.of(0, 0) : s);
        }
        this.byBand = Collections.unmodifiableMap(copy);
        this.total = total;
    }

    public AggregateScore get(DifficultyBand band) {
        return byBand.get(band);
    }

    public Map<DifficultyBand, AggregateScore> getByBand() {
        return byBand;
    }

    public AggregateScore getTotal() {
        return total;
    }

    /** Table in the layout of the benchmark's own evaluator: simple, moderate, challenging, total. */
    public String format()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s %-20s %-20s %-20s %-20s%n", "", "simple", "moderate", "challenging", "total"));
        sb.append(String.format("%-20s %-20d %-20d %-20d %-20d%n", "count",
                get(DifficultyBand.SIMPLE).getCount(), get(DifficultyBand.MODERATE).getCount(),
                get(DifficultyBand.CHALLENGING).getCount(), total.getCount()));
        sb.append("=========================================    EX   ========================================").append(System.lineSeparator());
        sb.append(String.format("%-20s %-20.2f %-20.2f %-20.2f %-20.2f%n", "ex",
                get(DifficultyBand.SIMPLE).getAccuracyPercent(), get(DifficultyBand.MODERATE).getAccuracyPercent(),
                get(DifficultyBand.CHALLENGING).getAccuracyPercent(), total.getAccuracyPercent()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return "DifficultyBreakdown{" + byBand + ", total=" + total + "}";
    }
}
