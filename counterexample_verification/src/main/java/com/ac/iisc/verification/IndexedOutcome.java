package com.ac.iisc.verification;

/** What a worker posts back to the scheduler when a task completes. */
public final class IndexedOutcome<T>
{
    private final int index;
    private final T outcome;

    public IndexedOutcome(int index, T outcome) {
        this.index = index;
        this.outcome = outcome;
    }

    public int getIndex() { return index; }
    public T getOutcome() { return outcome; }

    @Override
    public String toString() {
        return "#" + index + " " + outcome;
    }
}
