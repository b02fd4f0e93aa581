package tokenbucket.core.model;

/**
 * Immutable snapshot of one token bucket.
 *
 * Tokens are fractional and are never truncated between updates. The count may
 * sit slightly below zero after racing consumers in an unlocked store.
 *
 * @param tokens Tokens currently held
 * @param lastReplenishedAtNanos Monotonic clock reading of the last replenishment
 */
public record Bucket(
    double tokens,
    long lastReplenishedAtNanos
) {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    /**
     * A freshly created bucket: full, replenished now.
     */
    public static Bucket full(long capacity, long nowNanos) {
        return new Bucket(capacity, nowNanos);
    }

    /**
     * Tokens accrued since the last replenishment at {@code rate} tokens/second,
     * capped at {@code capacity}, stamped with {@code nowNanos}.
     * Callers must ensure {@code nowNanos} is not older than this bucket.
     */
    public Bucket replenished(double rate, long capacity, long nowNanos) {
        double elapsedSeconds = (nowNanos - lastReplenishedAtNanos) / NANOS_PER_SECOND;
        return new Bucket(Math.min(capacity, tokens + rate * elapsedSeconds), nowNanos);
    }

    /**
     * True if {@code nowNanos} is older than the recorded replenishment.
     * Compared by subtraction so a wrapping nanoTime stays ordered.
     */
    public boolean isNewerThan(long nowNanos) {
        return nowNanos - lastReplenishedAtNanos < 0;
    }

    public boolean canCover(int numTokens) {
        return tokens >= numTokens;
    }

    /**
     * The same bucket with {@code numTokens} removed; the timestamp is kept.
     */
    public Bucket debited(int numTokens) {
        return new Bucket(tokens - numTokens, lastReplenishedAtNanos);
    }
}
