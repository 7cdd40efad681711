package tl.core.queue;

import tl.core.model.WaitTimeoutException;
import tl.core.scheduler.Timer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One caller parked in the {@link PriorityWaitQueue}.
 *
 * <p>The future is the caller's continuation: {@link #admit()} resumes it with
 * success, {@link #expire()} fails it with {@link WaitTimeoutException}. Only the
 * first of the two has any effect.
 *
 * <p>Position and deadline are owned by the queue and the limiter; callers never
 * see this class.
 */
public final class WaitingRequest {

    private static final Logger LOG = Logger.getLogger(WaitingRequest.class.getName());

    static final long DETACHED = -1L;

    private final int priority;
    private final CompletableFuture<Void> future;
    private long position = DETACHED;
    private Timer deadline;

    public WaitingRequest(int priority) {
        this.priority = priority;
        this.future = new CompletableFuture<>();
    }

    public int priority() {
        return priority;
    }

    public CompletableFuture<Void> future() {
        return future;
    }

    /**
     * Current index inside its priority lane, or -1 once the request has left the queue.
     * Compaction after a cancellation may move a request, so this is not fixed at enqueue time.
     */
    public long position() {
        return position;
    }

    void moveTo(long position) {
        this.position = position;
    }

    boolean isQueued() {
        return position != DETACHED;
    }

    /**
     * Attaches the timer that will expire this request.
     */
    public void armDeadline(Timer deadline) {
        this.deadline = deadline;
    }

    /**
     * Disarms the deadline timer, if any. Safe to call more than once.
     */
    public void disarmDeadline() {
        if (deadline != null) {
            deadline.cancel();
        }
    }

    /**
     * Resumes the caller with success.
     *
     * @return false if the caller was already resumed
     */
    public boolean admit() {
        return future.complete(null);
    }

    /**
     * Fails the caller with {@link WaitTimeoutException}.
     *
     * @return false if the caller was already resumed
     */
    public boolean expire() {
        return future.completeExceptionally(new WaitTimeoutException(priority));
    }

    /**
     * {@link #admit()} on {@code executor}, so the caller's continuation runs there.
     */
    public void admitOn(Executor executor) {
        resumeOn(executor, this::admit);
    }

    /**
     * {@link #expire()} on {@code executor}, so the caller's continuation runs there.
     */
    public void expireOn(Executor executor) {
        resumeOn(executor, this::expire);
    }

    /**
     * Abandons the wait because the limiter is going away.
     */
    public boolean abandon() {
        return future.cancel(false);
    }

    private void resumeOn(Executor executor, Runnable completion) {
        try {
            executor.execute(completion);
        } catch (RejectedExecutionException e) {
            // the caller is already out of the queue, so it must be resumed somewhere
            LOG.log(Level.WARNING, "completion executor rejected a waiter; resuming it inline", e);
            completion.run();
        }
    }
}
