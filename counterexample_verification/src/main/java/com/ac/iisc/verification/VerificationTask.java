package com.ac.iisc.verification;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * A unit of work run under {@link TimedRunner}: one case execution, one prover
 * call or one evaluated SQL pair. Each kind supplies its own canonical outcomes
 * for expiry and failure, so callers never see a timeout as an exception.
 *
 * @param <T> outcome type
 */
public interface VerificationTask<T> extends Callable<T>
{
    /** Outcome recorded when the task exceeded {@code budget}. */
    T timedOut(Duration budget);

    /** Outcome recorded when {@link #call()} threw. */
    T failed(Throwable cause);

    /**
     * Stop in-flight work. Called from another thread on expiry or interrupt;
     * must not block.
     */
    default void abort() {
    }

    /** Short label for log lines. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
