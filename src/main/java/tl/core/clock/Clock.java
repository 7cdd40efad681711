package tl.core.clock;

/**
 * Monotonic time source in nanoseconds.
 * Injected everywhere time is read so tests can drive it by hand.
 */
public interface Clock {
    long nowNanos();
}
