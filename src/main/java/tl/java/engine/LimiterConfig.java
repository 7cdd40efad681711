package tl.java.engine;

import java.time.Duration;

/**
 * Fixed parameters of a {@link TurnLimiter}.
 *
 * @param capacity Maximum admissions in flight per window
 * @param window How long each admission holds its slot
 */
public record LimiterConfig(
    int capacity,
    Duration window
) {
    /**
     * Window used when none is given.
     */
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    /**
     * Longest window that fits in a signed nanosecond count (about 292 years).
     */
    public static final Duration MAX_WINDOW = Duration.ofNanos(Long.MAX_VALUE);

    public LimiterConfig {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (window == null) throw new IllegalArgumentException("window cannot be null");
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be > 0");
        if (window.compareTo(MAX_WINDOW) > 0) throw new IllegalArgumentException("window must be <= " + MAX_WINDOW);
    }

    /**
     * {@code capacity} admissions per {@link #DEFAULT_WINDOW}.
     */
    public static LimiterConfig perMinute(int capacity) {
        return new LimiterConfig(capacity, DEFAULT_WINDOW);
    }

    public static LimiterConfig of(int capacity, Duration window) {
        return new LimiterConfig(capacity, window);
    }

    /**
     * @param capacity Maximum admissions in flight per window
     * @param windowSeconds Window length in (possibly fractional) seconds
     */
    public static LimiterConfig of(int capacity, double windowSeconds) {
        if (!Double.isFinite(windowSeconds) || windowSeconds <= 0) {
            throw new IllegalArgumentException("window must be > 0");
        }
        long nanos = Math.round(windowSeconds * 1_000_000_000d);
        return new LimiterConfig(capacity, Duration.ofNanos(Math.max(1L, nanos)));
    }

    public long windowNanos() {
        return window.toNanos();
    }
}
