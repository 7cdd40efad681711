package tl.core.clock;

import java.time.Duration;

/**
 * Clock that only moves when told to. Time never goes backwards.
 */
public final class ManualClock implements Clock {
    private long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    /**
     * Moves the clock forward to an absolute instant.
     *
     * @throws IllegalArgumentException if {@code value} lies in the past
     */
    public void moveTo(long value) {
        if (value < now) throw new IllegalArgumentException("cannot move clock backwards");
        now = value;
    }
}
