package com.ac.iisc.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

public class TimedRunnerTest
{
    /** Sleeps for a while, then returns "done". */
    static class SleepingTask implements VerificationTask<String>
    {
        private final long sleepMillis;
        final AtomicBoolean aborted = new AtomicBoolean();

        SleepingTask(long sleepMillis) {
            this.sleepMillis = sleepMillis;
        }

        @Override
        public String call() throws Exception {
            Thread.sleep(sleepMillis);
            return "done";
        }

        @Override
        public String timedOut(Duration budget) {
            return "timeout " + budget.toMillis();
        }

        @Override
        public String failed(Throwable cause) {
            return "failed " + cause.getMessage();
        }

        @Override
        public void abort() {
            aborted.set(true);
        }
    }

    @Test
    void testTaskWithinBudget() throws Exception
    {
        try (TimedRunner runner = new TimedRunner(Duration.ofSeconds(5))) {
            SleepingTask task = new SleepingTask(10);
            assertEquals("done", runner.run(task));
            assertEquals(false, task.aborted.get());
        }
    }

    @Test
    void testTaskOverBudgetIsAbortedAndAbandoned() throws Exception
    {
        try (TimedRunner runner = new TimedRunner(Duration.ofMillis(200))) {
            SleepingTask task = new SleepingTask(60_000);
            long start = System.nanoTime();
            assertEquals("timeout 200", runner.run(task));
            assertTrue(task.aborted.get());
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        }
    }

    @Test
    void testThrowingTaskYieldsFailedOutcome() throws Exception
    {
        VerificationTask<String> task = new SleepingTask(0)
        {
            @Override
            public String call() {
                throw new IllegalStateException("boom");
            }
        };
        try (TimedRunner runner = new TimedRunner(Duration.ofSeconds(5))) {
            assertEquals("failed boom", runner.run(task));
        }
    }

    @Test
    void testThrownErrorYieldsFailedOutcome() throws Exception
    {
        VerificationTask<String> task = new SleepingTask(0)
        {
            @Override
            public String call() {
                throw new AssertionError("bad state");
            }
        };
        try (TimedRunner runner = new TimedRunner(Duration.ofSeconds(5))) {
            assertEquals("failed bad state", runner.run(task));
        }
    }

    @Test
    void testInterruptIsRethrownAndAbortsTheTask() throws Exception
    {
        SleepingTask task = new SleepingTask(30_000);
        AtomicReference<Object> seen = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try (TimedRunner runner = new TimedRunner(Duration.ofSeconds(60))) {
                seen.set(runner.run(task));
            } catch (InterruptedException ex) {
                seen.set(ex);
            }
        });
        caller.start();
        Thread.sleep(300);
        caller.interrupt();
        caller.join(5_000);

        assertFalse(caller.isAlive());
        assertTrue(seen.get() instanceof InterruptedException, String.valueOf(seen.get()));
        assertTrue(task.aborted.get());
    }

    @Test
    void testBudgetMustBePositive()
    {
        assertThrows(IllegalArgumentException.class, () -> new TimedRunner(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new TimedRunner(null));
    }
}
