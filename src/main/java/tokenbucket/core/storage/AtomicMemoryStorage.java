package tokenbucket.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokenbucket.core.clock.Clock;
import tokenbucket.core.clock.SystemClock;
import tokenbucket.core.model.Bucket;
import tokenbucket.core.model.BucketKey;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory token bucket storage, lock-free and race-free.
 *
 * Each bucket lives in its own {@link AtomicReference}; replenish and consume
 * are compare-and-swap retry loops over the immutable {@link Bucket} snapshot.
 * The arithmetic is the same as {@link MemoryStorage}, but a count can never
 * go negative and no replenished tokens are lost, at the cost of retries when
 * many threads hit the same key.
 *
 * Like {@link MemoryStorage}, buckets are never evicted.
 */
public final class AtomicMemoryStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(AtomicMemoryStorage.class);

    private final Clock clock;
    private final ConcurrentMap<BucketKey, AtomicReference<Bucket>> buckets = new ConcurrentHashMap<>();

    public AtomicMemoryStorage() {
        this(SystemClock.instance());
    }

    public AtomicMemoryStorage(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public double getTokenCount(BucketKey key) {
        AtomicReference<Bucket> ref = buckets.get(key);
        return ref == null ? 0 : ref.get().tokens();
    }

    @Override
    public void replenish(BucketKey key, double rate, long capacity) {
        AtomicReference<Bucket> ref = buckets.get(key);
        if (ref == null) {
            AtomicReference<Bucket> created = new AtomicReference<>(Bucket.full(capacity, clock.nowNanos()));
            ref = buckets.putIfAbsent(key, created);
            if (ref == null) {
                log.debug("Created bucket '{}' with {} tokens", key, capacity);
                return;
            }
        }

        while (true) {
            Bucket current = ref.get();
            long now = clock.nowNanos();
            if (current.isNewerThan(now)) {
                return;
            }
            if (ref.compareAndSet(current, current.replenished(rate, capacity, now))) {
                return;
            }
        }
    }

    @Override
    public boolean consume(BucketKey key, int numTokens) {
        AtomicReference<Bucket> ref = buckets.get(key);
        if (ref == null) {
            throw new IllegalStateException("bucket '" + key + "' was never replenished");
        }

        while (true) {
            Bucket current = ref.get();
            if (!current.canCover(numTokens)) {
                return false;
            }
            if (ref.compareAndSet(current, current.debited(numTokens))) {
                return true;
            }
        }
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
