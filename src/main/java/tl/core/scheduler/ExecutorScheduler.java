package tl.core.scheduler;

import tl.core.clock.Clock;
import tl.core.clock.SystemClock;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Real-time scheduler backed by a single daemon thread.
 *
 * <p>Every task runs on that one thread, so deferred callbacks never run in
 * parallel with each other. A task that throws is logged and the thread keeps
 * serving later tasks.
 *
 * <p>Callers are resumed on a separate completion executor so their continuations
 * never occupy the timer thread.
 */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ExecutorScheduler.class.getName());
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;
    private final Executor completions;

    /**
     * Resumes callers on {@link CompletableFuture}'s default async pool: the common
     * {@link java.util.concurrent.ForkJoinPool}, or a thread per task when that pool
     * cannot run tasks in parallel.
     */
    public ExecutorScheduler() {
        this(new CompletableFuture<Void>().defaultExecutor());
    }

    /**
     * @param completions Executor that resumes callers; must not block the timer thread
     * @throws IllegalArgumentException if completions is null
     */
    public ExecutorScheduler(Executor completions) {
        if (completions == null) {
            throw new IllegalArgumentException("completions cannot be null");
        }
        this.completions = completions;
        this.clock = SystemClock.instance();
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "turn-limiter-timer-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        // Cancelled deadlines would otherwise sit in the work queue until they expire
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public Timer schedule(Runnable task, long delayNanos) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        if (delayNanos < 0) throw new IllegalArgumentException("delay < 0");

        long dueAt = Scheduler.dueAt(clock.nowNanos(), delayNanos);
        ScheduledFuture<?> future = executor.schedule(() -> runGuarded(task), delayNanos, TimeUnit.NANOSECONDS);
        return new FutureTimer(future, dueAt);
    }

    @Override
    public Executor completionExecutor() {
        return completions;
    }

    /**
     * Stops the timer thread. Tasks that have not fired yet are dropped.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "scheduled task failed", e);
        }
    }

    private record FutureTimer(ScheduledFuture<?> future, long dueAtNanos) implements Timer {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }
    }
}
