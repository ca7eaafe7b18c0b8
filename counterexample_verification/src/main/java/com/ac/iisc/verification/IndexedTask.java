package com.ac.iisc.verification;

/** A task tagged with the caller's position for it (usually the input row). */
public final class IndexedTask<T>
{
    private final int index;
    private final VerificationTask<T> task;

    public IndexedTask(int index, VerificationTask<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        this.index = index;
        this.task = task;
    }

    public int getIndex() { return index; }
    public VerificationTask<T> getTask() { return task; }
}
