package com.ac.iisc.verification;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Runs a {@link VerificationTask} with a wall-clock budget, through a Guava
 * {@link TimeLimiter} over a cached daemon pool.
 *
 * On expiry the task is aborted and abandoned and its
 * {@link VerificationTask#timedOut(Duration)} outcome is returned. A task that
 * throws yields {@link VerificationTask#failed(Throwable)}. Only an interrupt of
 * the calling thread escapes, as {@link InterruptedException}.
 *
 * Tasks run on daemon threads so that a statement that ignores cancellation
 * cannot keep the JVM alive.
 */
public class TimedRunner implements AutoCloseable
{
    private final Duration budget;
    private final ExecutorService executor;
    private final TimeLimiter limiter;

    public TimedRunner(Duration budget)
    {
        if (budget == null || budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("budget must be positive");
        }
        this.budget = budget;
        this.executor = Executors.newCachedThreadPool(daemonThreads("timed-task-"));
        this.limiter = SimpleTimeLimiter.create(executor);
    }

    public Duration getBudget() {
        return budget;
    }

    public <T> T run(VerificationTask<T> task) throws InterruptedException
    {
        try {
            return limiter.callWithTimeout(task, budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            // the limiter has already cancelled the future
            task.abort();
            System.err.println("[TimedRunner] " + task.describe() + " exceeded " + budget.toSeconds() + "s; abandoned.");
            return task.timedOut(budget);
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            System.err.println("[TimedRunner] " + task.describe() + " failed: " + cause);
            return task.failed(cause);
        } catch (CancellationException ex) {
            return task.failed(ex);
        } catch (InterruptedException ex) {
            task.abort();
            throw ex;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
