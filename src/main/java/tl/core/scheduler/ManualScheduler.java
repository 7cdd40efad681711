package tl.core.scheduler;

import tl.core.clock.Clock;
import tl.core.clock.ManualClock;

import java.time.Duration;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.Executor;

/**
 * Virtual-time scheduler over a {@link ManualClock}.
 *
 * <p>Nothing fires until the owner advances time. {@link #advanceNanos(long)}
 * runs every due task in due-time order (ties in scheduling order), with the
 * clock parked at each task's due time while it runs. Tasks armed by a running
 * task fire in the same advance when they fall inside it.
 *
 * <p>Completions run inline on the advancing thread, so a test sees every
 * admission and timeout as soon as {@code advance} returns.
 *
 * <p>Thread-safety: none. Drive it from a single thread.
 */
public final class ManualScheduler implements Scheduler {

    private final ManualClock clock;
    private final PriorityQueue<ManualTimer> timers = new PriorityQueue<>(
        Comparator.comparingLong(ManualTimer::dueAtNanos).thenComparingLong(t -> t.sequence)
    );
    private long nextSequence;

    public ManualScheduler() {
        this(new ManualClock(0L));
    }

    public ManualScheduler(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public Timer schedule(Runnable task, long delayNanos) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        if (delayNanos < 0) throw new IllegalArgumentException("delay < 0");

        ManualTimer timer = new ManualTimer(task, Scheduler.dueAt(clock.nowNanos(), delayNanos), nextSequence++);
        timers.add(timer);
        return timer;
    }

    @Override
    public Executor completionExecutor() {
        return Runnable::run;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void advanceSeconds(double seconds) {
        advanceNanos(Math.round(seconds * 1_000_000_000d));
    }

    /**
     * Moves virtual time forward, firing every task that falls due on the way.
     */
    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        long target = Scheduler.dueAt(clock.nowNanos(), delta);

        ManualTimer next;
        while ((next = timers.peek()) != null && next.dueAtNanos() <= target) {
            timers.poll();
            if (next.cancelled) {
                continue;
            }
            if (next.dueAtNanos() > clock.nowNanos()) {
                clock.moveTo(next.dueAtNanos());
            }
            next.fired = true;
            next.task.run();
        }
        clock.moveTo(target);
    }

    /**
     * Number of armed tasks that have neither fired nor been cancelled.
     */
    public int pendingTimers() {
        int count = 0;
        for (ManualTimer timer : timers) {
            if (!timer.cancelled) count++;
        }
        return count;
    }

    private static final class ManualTimer implements Timer {
        private final Runnable task;
        private final long dueAtNanos;
        private final long sequence;
        private boolean cancelled;
        private boolean fired;

        private ManualTimer(Runnable task, long dueAtNanos, long sequence) {
            this.task = task;
            this.dueAtNanos = dueAtNanos;
            this.sequence = sequence;
        }

        @Override
        public long dueAtNanos() {
            return dueAtNanos;
        }

        @Override
        public boolean cancel() {
            if (cancelled || fired) return false;
            cancelled = true;
            return true;
        }
    }
}
