package tokenbucket.core.clock;

/**
 * Monotonic time source, in nanoseconds.
 * Readings are only meaningful relative to each other.
 */
public interface Clock {
    long nowNanos();
}
