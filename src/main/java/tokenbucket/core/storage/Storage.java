package tokenbucket.core.storage;

import tokenbucket.core.model.BucketKey;

/**
 * Storage contract for keyed token buckets.
 *
 * Tokens are added lazily: instead of an out-of-band timer, {@link #replenish}
 * computes how many tokens should have accrued since the bucket was last
 * replenished. Any backing store (in-memory, shared cache, database) may
 * implement this interface; the limiter always calls {@code replenish} before
 * {@code consume} for a key.
 *
 * Implementations must be safe for concurrent use.
 */
public interface Storage {

    /**
     * Returns the current token count of a bucket.
     *
     * The bucket is not replenished first, so the count is what it was the
     * last time {@link #replenish} or {@link #consume} updated it.
     *
     * @param key Bucket to query
     * @return Tokens in the bucket (may be fractional), or 0 if the bucket
     *         has never been replenished
     */
    double getTokenCount(BucketKey key);

    /**
     * Adds the tokens accrued since the last replenishment.
     *
     * Conceptually one token is added every {@code 1/rate} seconds. A bucket
     * seen for the first time is created full.
     *
     * @param key Bucket to replenish
     * @param rate Tokens added per second
     * @param capacity Maximum tokens the bucket can hold; excess tokens are discarded
     */
    void replenish(BucketKey key, double rate, long capacity);

    /**
     * Attempts to take tokens from a bucket, all or nothing.
     *
     * @param key Bucket to consume from; must have been replenished before
     * @param numTokens Tokens to remove
     * @return true if exactly {@code numTokens} were removed (conforming),
     *         false if the bucket held fewer and nothing was removed
     * @throws IllegalStateException if the bucket was never replenished
     */
    boolean consume(BucketKey key, int numTokens);
}
