package com.ac.iisc.verification;

/** Number of scored cases and the percentage that passed. */
public final class AggregateScore
{
    private final int count;
    private final double accuracyPercent;

    public AggregateScore(int count, double accuracyPercent) {
        this.count = count;
        this.accuracyPercent = accuracyPercent;
    }

    /** Score over 0/1 flags; an empty set scores 0 %. */
    public static AggregateScore of(int passed, int count) {
        return new AggregateScore(count, count == 0 ? 0.0 : passed * 100.0 / count);
    }

    public int getCount() { return count; }
    public double getAccuracyPercent() { return accuracyPercent; }

    @Override
    public String toString() {
        return String.format("%.2f%% of %d", accuracyPercent, count);
    }
}
