package tl.java.engine;

import tl.core.model.TurnResult;
import tl.core.model.WaitTimeoutException;
import tl.core.queue.PriorityWaitQueue;
import tl.core.queue.WaitingRequest;
import tl.core.scheduler.ExecutorScheduler;
import tl.core.scheduler.Scheduler;
import tl.core.window.WindowTracker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission limiter: at most {@code capacity} turns per rolling window,
 * with priority-ordered waiting and optional wait timeouts.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>A caller that finds a free slot is admitted at once, whatever its priority</li>
 *   <li>Otherwise it waits in the queue for its priority; when a slot frees up the
 *       oldest waiter at the highest priority takes it</li>
 *   <li>A waiter with a timeout that is still queued when the timeout elapses fails
 *       with {@link WaitTimeoutException} and leaves the queue</li>
 *   <li>Every admission holds its slot for exactly one window</li>
 * </ul>
 * Low priorities can starve under sustained high-priority load.
 *
 * <p>Thread-safety: safe to share between threads. Every state change runs under
 * one {@link ReentrantLock}; timers fire on the scheduler's single thread and take
 * the same lock. Futures are completed after the lock is released; callers resumed
 * by a timer are completed on the scheduler's completion executor, never on the
 * timer thread.
 *
 * <p>Usage example:
 * <pre>
 * try (TurnLimiter limiter = TurnLimiter.create(5, 1.0)) {   // 5 per second
 *     limiter.awaitTurn(10, Duration.ofSeconds(2)).join();
 *     callRemoteApi();
 * }
 * </pre>
 */
public final class TurnLimiter implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(TurnLimiter.class.getName());
    private static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE);

    private final Scheduler scheduler;
    private final ExecutorScheduler ownedScheduler;
    private final LimiterConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityWaitQueue queue = new PriorityWaitQueue();
    private final WindowTracker window;
    private boolean closed;

    /**
     * Creates a limiter driven by the given scheduler. The caller keeps ownership of the scheduler.
     *
     * @param scheduler Scheduler for release and deadline timers
     * @param config Capacity and window
     * @throws IllegalArgumentException if any parameter is null
     */
    public TurnLimiter(Scheduler scheduler, LimiterConfig config) {
        this(scheduler, config, null);
    }

    private TurnLimiter(Scheduler scheduler, LimiterConfig config, ExecutorScheduler ownedScheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.scheduler = scheduler;
        this.ownedScheduler = ownedScheduler;
        this.config = config;
        this.window = new WindowTracker(scheduler, queue, lock, config.capacity(), config.windowNanos());
    }

    /**
     * {@code capacity} turns per 60 seconds, on a private real-time scheduler.
     */
    public static TurnLimiter create(int capacity) {
        return create(LimiterConfig.perMinute(capacity));
    }

    /**
     * {@code capacity} turns per {@code windowSeconds}, on a private real-time scheduler.
     */
    public static TurnLimiter create(int capacity, double windowSeconds) {
        return create(LimiterConfig.of(capacity, windowSeconds));
    }

    /**
     * Creates a limiter that owns its scheduler thread; {@link #close()} stops it.
     */
    public static TurnLimiter create(LimiterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ExecutorScheduler scheduler = new ExecutorScheduler();
        return new TurnLimiter(scheduler, config, scheduler);
    }

    /**
     * Waits for a turn at priority 0 with no timeout.
     */
    public CompletableFuture<Void> awaitTurn() {
        return awaitTurn(0, Duration.ZERO);
    }

    /**
     * Waits for a turn at the given priority with no timeout.
     */
    public CompletableFuture<Void> awaitTurn(int priority) {
        return awaitTurn(priority, Duration.ZERO);
    }

    /**
     * Requests a turn.
     *
     * <p>The returned future completes normally once the caller is admitted, or
     * exceptionally with {@link WaitTimeoutException} if it is still waiting when
     * {@code timeout} elapses. Exactly one of the two happens. If the limiter is
     * closed while the caller waits, the future is cancelled.
     *
     * @param priority Higher values are admitted first among waiters
     * @param timeout Maximum wait; {@link Duration#ZERO} waits indefinitely. Anything
     *                beyond {@link Long#MAX_VALUE} nanoseconds is treated as that long
     * @return future for the turn (already complete if a slot was free)
     * @throws IllegalArgumentException if timeout is null or negative
     * @throws IllegalStateException if the limiter is closed
     */
    public CompletableFuture<Void> awaitTurn(int priority, Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        long timeoutNanos = timeout.compareTo(MAX_TIMEOUT) > 0 ? Long.MAX_VALUE : timeout.toNanos();

        WaitingRequest request = new WaitingRequest(priority);
        boolean granted;

        lock.lock();
        try {
            ensureOpen();
            granted = window.tryGrant();
            if (!granted) {
                queue.enqueue(request);
                if (timeoutNanos > 0) {
                    request.armDeadline(scheduler.schedule(() -> expire(request), timeoutNanos));
                }
            }
        } finally {
            lock.unlock();
        }

        if (granted) {
            request.admit();
        } else if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("queued waiter at priority " + priority + (timeout.isZero() ? "" : " timeout=" + timeout));
        }
        return request.future();
    }

    /**
     * Takes a turn only if a slot is free right now. Never queues.
     *
     * @return ALLOW if a slot was taken, otherwise REJECT with the time until the next release
     * @throws IllegalStateException if the limiter is closed
     */
    public TurnResult tryTurn() {
        lock.lock();
        try {
            ensureOpen();
            if (window.tryGrant()) {
                return TurnResult.allow();
            }
            return TurnResult.reject(window.timeUntilNextReleaseNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of callers still waiting for a turn.
     */
    public int length() {
        lock.lock();
        try {
            return queue.length();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of admissions whose window has not elapsed yet.
     */
    public int usedSlots() {
        lock.lock();
        try {
            return window.usedSlots();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time until the earliest in-flight slot is released.
     * {@link Duration#ZERO} when nothing is in flight.
     */
    public Duration timeUntilNextAdmission() {
        lock.lock();
        try {
            return Duration.ofNanos(window.timeUntilNextReleaseNanos());
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return config.capacity();
    }

    public Duration window() {
        return config.window();
    }

    public LimiterConfig config() {
        return config;
    }

    /**
     * Shuts the limiter down. Pending timers are disarmed, every waiter's future is
     * cancelled, and an owned scheduler thread is stopped. Idempotent.
     */
    @Override
    public void close() {
        List<WaitingRequest> abandoned;

        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            window.close();
            abandoned = queue.drain();
            for (WaitingRequest request : abandoned) {
                request.disarmDeadline();
            }
        } finally {
            lock.unlock();
        }

        for (WaitingRequest request : abandoned) {
            request.abandon();
        }
        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
        if (!abandoned.isEmpty()) {
            LOG.log(Level.INFO, "limiter closed with {0} waiter(s) still queued", abandoned.size());
        }
    }

    private void expire(WaitingRequest request) {
        boolean removed;

        lock.lock();
        try {
            removed = queue.cancel(request);
        } finally {
            lock.unlock();
        }

        if (removed) {
            LOG.log(Level.FINE, "waiter at priority {0} timed out", request.priority());
            request.expireOn(scheduler.completionExecutor());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("limiter is closed");
        }
    }
}
