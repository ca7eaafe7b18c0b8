package com.ac.iisc.verification;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Fans independent tasks out over a fixed worker pool and hands the outcomes
 * back in index order.
 *
 * Each worker runs its task under a {@link TimedRunner} and posts an
 * {@link IndexedOutcome} on a queue owned by the current {@link #run(List)}
 * call. The scheduling thread takes exactly one outcome per task, then sorts by
 * index. A failing or timed-out task only affects its own outcome. Interrupting
 * the scheduling thread stops the pool and propagates the interrupt. Nothing is
 * retried and nothing outlives the call.
 */
public class ParallelScheduler
{
    private final int workers;
    private final Duration budget;
    private final String label;

    public ParallelScheduler(int workers, Duration budget) {
        this(workers, budget, "tasks");
    }

    /**
     * @param workers pool size; 1 runs the tasks one after another
     * @param budget  wall-clock budget per task
     * @param label   noun used in progress lines
     */
    public ParallelScheduler(int workers, Duration budget, String label)
    {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (budget == null || budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("budget must be positive");
        }
        this.workers = workers;
        this.budget = budget;
        this.label = label == null ? "tasks" : label;
    }

    public int getWorkers() {
        return workers;
    }

    /** Run tasks indexed by their list position; returns outcomes in the same order. */
    public <T> List<T> runAll(List<? extends VerificationTask<T>> tasks) throws InterruptedException
    {
        List<IndexedTask<T>> indexed = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            indexed.add(new IndexedTask<>(i, tasks.get(i)));
        }
        List<T> out = new ArrayList<>(tasks.size());
        for (IndexedOutcome<T> o : run(indexed)) {
            out.add(o.getOutcome());
        }
        return out;
    }

    /** Run tasks and return one outcome per task, sorted by index. */
    public <T> List<IndexedOutcome<T>> run(List<IndexedTask<T>> tasks) throws InterruptedException
    {
        List<IndexedOutcome<T>> collected = new ArrayList<>(tasks.size());
        if (tasks.isEmpty()) return collected;

        int poolSize = Math.min(workers, tasks.size());
        BlockingQueue<IndexedOutcome<T>> channel = new LinkedBlockingQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, TimedRunner.daemonThreads("verify-worker-"));

        try (TimedRunner runner = new TimedRunner(budget))
        {
            for (IndexedTask<T> t : tasks) {
                pool.execute(() -> runOne(runner, t, channel));
            }

            int total = tasks.size();
            int step = Math.max(1, total / 20);
            System.out.println("[ParallelScheduler] Running " + total + " " + label + " on " + poolSize
                    + " worker(s), " + budget.toSeconds() + "s each");
            for (int done = 1; done <= total; done++) {
                collected.add(channel.take());
                if (done % step == 0 || done == total) {
                    System.out.println("[ParallelScheduler] " + done + "/" + total + " " + label + " done");
                }
            }
        }
        catch (InterruptedException ex)
        {
            System.err.println("[ParallelScheduler] Interrupted; abandoning " + (tasks.size() - collected.size()) + " " + label + ".");
            pool.shutdownNow();
            throw ex;
        }
        finally
        {
            pool.shutdownNow();
        }

        collected.sort(Comparator.comparingInt(IndexedOutcome::getIndex));
        return collected;
    }

    private static <T> void runOne(TimedRunner runner, IndexedTask<T> t, BlockingQueue<IndexedOutcome<T>> channel)
    {
        T outcome;
        try {
            outcome = runner.run(t.getTask());
        } catch (InterruptedException ex) {
            // the whole batch is being abandoned
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException ex) {
            outcome = t.getTask().failed(ex);
        }
        channel.add(new IndexedOutcome<>(t.getIndex(), outcome));
    }
}
