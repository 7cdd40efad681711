package tl.core.clock;

/**
 * Real system clock - uses System.nanoTime().
 * Backs the real-time scheduler; never use it where a test needs determinism.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
