package tl.core.scheduler;

/**
 * Handle to a one-shot task armed on a {@link Scheduler}.
 */
public interface Timer {

    /**
     * Absolute fire time on the scheduler's clock.
     */
    long dueAtNanos();

    /**
     * Prevents the task from running if it has not started yet.
     *
     * @return true if this call cancelled the task, false if it already ran or was cancelled
     */
    boolean cancel();
}
