package tl.core.scheduler;

import tl.core.clock.Clock;

import java.util.concurrent.Executor;

/**
 * Deferred-callback primitive the limiter is built on.
 *
 * <p>Implementations run every task on one logical thread, in due-time order,
 * and never before the requested delay has elapsed. Tasks may fire late by
 * whatever jitter the platform adds.
 */
public interface Scheduler {

    /**
     * Time source the delays are measured against.
     */
    Clock clock();

    /**
     * Arms {@code task} to run once, {@code delayNanos} from now.
     *
     * @param task Task to run
     * @param delayNanos Delay in nanoseconds (0 means as soon as possible)
     * @return handle that can cancel the task before it runs
     * @throws IllegalArgumentException if task is null or delay is negative
     */
    Timer schedule(Runnable task, long delayNanos);

    /**
     * Executor that resumes callers whose turn was decided by a timer.
     * A real-time scheduler must not hand back its own timer thread here, otherwise
     * a slow continuation would hold up every later timer.
     */
    Executor completionExecutor();

    /**
     * {@code nowNanos + delayNanos}, pinned at {@link Long#MAX_VALUE} instead of overflowing.
     */
    static long dueAt(long nowNanos, long delayNanos) {
        return delayNanos > Long.MAX_VALUE - nowNanos ? Long.MAX_VALUE : nowNanos + delayNanos;
    }
}
