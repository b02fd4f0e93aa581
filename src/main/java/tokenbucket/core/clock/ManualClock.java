package tokenbucket.core.clock;

/**
 * Clock driven by hand, for deterministic tests.
 * Reads are visible across threads; advancing is expected from one thread at a time.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(double seconds) {
        advanceNanos(Math.round(seconds * 1_000_000_000d));
    }

    public void setNanos(long value) {
        now = value;
    }
}
