package tl.core.window;

import tl.core.queue.PriorityWaitQueue;
import tl.core.queue.WaitingRequest;
import tl.core.scheduler.Scheduler;
import tl.core.scheduler.Timer;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sliding admission window: at most {@code capacity} grants in flight, each
 * holding its slot for exactly one window.
 *
 * <p>When a slot's window elapses the tracker frees it and immediately hands it
 * to the next request from the {@link PriorityWaitQueue}, so the in-flight count
 * only drops below capacity while nobody is waiting.
 *
 * <p>Thread-safety: state is guarded by the limiter's lock, which callers must
 * hold around {@link #tryGrant()}, {@link #usedSlots()} and
 * {@link #timeUntilNextReleaseNanos()}. Release timers take the lock themselves
 * and resume promoted waiters on the scheduler's completion executor.
 */
public final class WindowTracker {

    private static final Logger LOG = Logger.getLogger(WindowTracker.class.getName());

    private final Scheduler scheduler;
    private final PriorityWaitQueue queue;
    private final ReentrantLock lock;
    private final int capacity;
    private final long windowNanos;

    private final Set<Release> pendingReleases = new LinkedHashSet<>();
    private int inFlight;
    private boolean closed;

    /**
     * @param scheduler Scheduler that fires release timers
     * @param queue Queue that released slots are handed to
     * @param lock Lock shared with the admission controller
     * @param capacity Maximum grants in flight (must be > 0)
     * @param windowNanos How long each grant holds its slot (must be > 0)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public WindowTracker(Scheduler scheduler, PriorityWaitQueue queue, ReentrantLock lock,
                         int capacity, long windowNanos) {
        if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
        if (queue == null) throw new IllegalArgumentException("queue cannot be null");
        if (lock == null) throw new IllegalArgumentException("lock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (windowNanos <= 0) throw new IllegalArgumentException("window must be > 0");

        this.scheduler = scheduler;
        this.queue = queue;
        this.lock = lock;
        this.capacity = capacity;
        this.windowNanos = windowNanos;
    }

    /**
     * Occupies a slot if one is free and arms its release.
     * The caller resumes whoever the slot was granted to once it has dropped the lock.
     *
     * @return true if a slot was taken
     */
    public boolean tryGrant() {
        if (closed || inFlight >= capacity) {
            return false;
        }
        occupy();
        return true;
    }

    public int usedSlots() {
        return inFlight;
    }

    /**
     * Time until the earliest pending release fires, floored at zero.
     *
     * @return nanoseconds, or 0 if no release is pending
     */
    public long timeUntilNextReleaseNanos() {
        if (pendingReleases.isEmpty()) {
            return 0L;
        }
        long earliest = Long.MAX_VALUE;
        for (Release release : pendingReleases) {
            earliest = Math.min(earliest, release.dueAtNanos);
        }
        return Math.max(0L, earliest - scheduler.clock().nowNanos());
    }

    /**
     * Disarms every pending release. Slots stay occupied and nothing is promoted afterwards.
     */
    public void close() {
        closed = true;
        for (Release release : pendingReleases) {
            if (release.timer != null) {
                release.timer.cancel();
            }
        }
        pendingReleases.clear();
    }

    private void occupy() {
        inFlight++;
        Release release = new Release(Scheduler.dueAt(scheduler.clock().nowNanos(), windowNanos));
        pendingReleases.add(release);
        release.timer = scheduler.schedule(() -> release(release), windowNanos);
    }

    private void release(Release release) {
        int skipped = 0;
        WaitingRequest promoted = null;

        lock.lock();
        try {
            if (closed || !pendingReleases.remove(release)) {
                return;
            }
            inFlight--;

            WaitingRequest next;
            while ((next = queue.dequeueHighest()) != null) {
                next.disarmDeadline();
                if (next.future().isDone()) {
                    // resolved from outside the limiter while queued
                    skipped++;
                    continue;
                }
                promoted = next;
                occupy();
                break;
            }
        } finally {
            lock.unlock();
        }

        if (skipped > 0) {
            LOG.log(Level.FINE, "dropped {0} waiter(s) whose futures were completed externally", skipped);
        }
        if (promoted != null) {
            LOG.log(Level.FINE, "promoted waiter at priority {0}", promoted.priority());
            promoted.admitOn(scheduler.completionExecutor());
        }
    }

    private static final class Release {
        private final long dueAtNanos;
        private Timer timer;

        private Release(long dueAtNanos) {
            this.dueAtNanos = dueAtNanos;
        }
    }
}
