package tokenbucket.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokenbucket.core.clock.Clock;
import tokenbucket.core.clock.SystemClock;
import tokenbucket.core.model.Bucket;
import tokenbucket.core.model.BucketKey;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory token bucket storage, unlocked.
 *
 * The table itself is a concurrent map, so entries are never corrupted, but
 * the read-compute-write sequences of {@link #replenish} and {@link #consume}
 * are not atomic:
 * <ul>
 *   <li>replenish: a thread holding an older {@code now} may finish last and
 *       overwrite a fresher count. Writes whose timestamp is provably older
 *       than the stored one are dropped; the rest cost a negligible,
 *       self-correcting amount of tokens.</li>
 *   <li>consume: two threads may both pass the check and both subtract,
 *       driving the count slightly negative until the bucket replenishes.</li>
 * </ul>
 * Both effects slightly reduce the effective capacity under heavy contention
 * on a single key. Raise the capacity by a few tokens, or use
 * {@link AtomicMemoryStorage}, if that matters.
 *
 * Buckets are never evicted: the table grows with every distinct key for the
 * lifetime of the instance.
 */
public final class MemoryStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorage.class);

    private final Clock clock;
    private final ConcurrentMap<BucketKey, Bucket> buckets;

    public MemoryStorage() {
        this(SystemClock.instance());
    }

    public MemoryStorage(Clock clock) {
        this(clock, new ConcurrentHashMap<>());
    }

    /**
     * Creates a storage over a caller-supplied table.
     *
     * @param clock Monotonic clock
     * @param buckets Backing table; owned by this storage from now on
     */
    public MemoryStorage(Clock clock, ConcurrentMap<BucketKey, Bucket> buckets) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (buckets == null) {
            throw new IllegalArgumentException("buckets cannot be null");
        }
        this.clock = clock;
        this.buckets = buckets;
    }

    @Override
    public double getTokenCount(BucketKey key) {
        Bucket bucket = buckets.get(key);
        return bucket == null ? 0 : bucket.tokens();
    }

    @Override
    public void replenish(BucketKey key, double rate, long capacity) {
        Bucket current = buckets.get(key);
        if (current == null) {
            // a racing creator must not refill a bucket another thread has already drained
            if (buckets.putIfAbsent(key, Bucket.full(capacity, clock.nowNanos())) == null) {
                log.debug("Created bucket '{}' with {} tokens", key, capacity);
            }
            return;
        }

        long now = clock.nowNanos();
        if (current.isNewerThan(now)) {
            log.debug("Dropped stale replenish for bucket '{}'", key);
            return;
        }

        buckets.put(key, current.replenished(rate, capacity, now));
    }

    @Override
    public boolean consume(BucketKey key, int numTokens) {
        Bucket current = buckets.get(key);
        if (current == null) {
            throw new IllegalStateException("bucket '" + key + "' was never replenished");
        }
        if (!current.canCover(numTokens)) {
            return false;
        }

        buckets.put(key, current.debited(numTokens));
        return true;
    }

    /**
     * Returns the number of tracked buckets.
     *
     * @return Number of keys in the table
     */
    public int size() {
        return buckets.size();
    }
}
