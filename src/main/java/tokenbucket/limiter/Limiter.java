package tokenbucket.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokenbucket.core.clock.Clock;
import tokenbucket.core.model.BucketKey;
import tokenbucket.core.storage.Storage;
import tokenbucket.core.storage.StorageFactory;

/**
 * Limits demand for a finite resource via keyed token buckets.
 *
 * A limiter manages a set of token buckets sharing one rate, capacity and
 * storage. Each bucket is referenced by a key, so consumers of a resource can
 * be limited independently; use the same key everywhere for a global limit.
 *
 * Burst sizing: with a maximum request rate M, a replenishment rate r and a
 * capacity b, a burst lasts at most {@code b / (M - r)} seconds when r < M and
 * consumes at most {@code M * b / (M - r)} tokens. When r >= M the rate can
 * never be exceeded.
 *
 * Thread-safety: the limiter holds no mutable state and takes no locks; all
 * concurrency properties come from the storage.
 *
 * Usage example:
 * <pre>
 * Limiter limiter = new Limiter(10.0, 20, new MemoryStorage());
 *
 * if (limiter.consume("user:123")) {
 *     // Process request
 * } else {
 *     // Reject
 * }
 * </pre>
 */
public final class Limiter {

    private static final Logger log = LoggerFactory.getLogger(Limiter.class);

    private final double rate;
    private final long capacity;
    private final Storage storage;

    /**
     * Creates a limiter.
     *
     * @param rate Tokens added to each bucket per second; fractional rates are allowed
     * @param capacity Maximum tokens a bucket can hold
     * @param storage Storage for bucket state
     * @throws InvalidTypeException if rate is NaN or storage is null
     * @throws InvalidValueException if rate <= 0 (or infinite) or capacity < 1
     */
    public Limiter(double rate, long capacity, Storage storage) {
        this(LimiterConfig.tokenBucket(rate, capacity), storage);
    }

    /**
     * Creates a limiter from a configuration. The config's storage type is
     * ignored in favor of the given storage.
     *
     * @param config Validated configuration
     * @param storage Storage for bucket state
     * @throws InvalidTypeException if config or storage is null
     */
    public Limiter(LimiterConfig config, Storage storage) {
        if (config == null) {
            throw new InvalidTypeException("config cannot be null");
        }
        if (storage == null) {
            throw new InvalidTypeException("storage cannot be null");
        }
        this.rate = config.rate();
        this.capacity = config.capacity();
        this.storage = storage;
    }

    /**
     * Creates a limiter from loosely typed arguments.
     *
     * @param rate Any {@link Number}
     * @param capacity An integral number
     * @param storage An implementation of {@link Storage}
     * @return New limiter
     * @throws InvalidTypeException if an argument has the wrong kind
     * @throws InvalidValueException if an argument is out of range
     */
    public static Limiter of(Object rate, Object capacity, Object storage) {
        LimiterConfig config = LimiterConfig.of(rate, capacity);
        if (!(storage instanceof Storage)) {
            throw new InvalidTypeException("storage must implement Storage, got: "
                + (storage == null ? "null" : storage.getClass().getName()));
        }
        return new Limiter(config, (Storage) storage);
    }

    /**
     * Creates a limiter with a new storage of the configured type.
     *
     * @param config Validated configuration
     * @param clock Clock for the storage
     * @return New limiter over an empty storage
     */
    public static Limiter create(LimiterConfig config, Clock clock) {
        if (config == null) {
            throw new InvalidTypeException("config cannot be null");
        }
        if (clock == null) {
            throw new InvalidTypeException("clock cannot be null");
        }
        Storage storage = StorageFactory.create(config.storageType(), clock);
        log.info("Created limiter: rate={}/s, capacity={}, storage={}",
            config.rate(), config.capacity(), config.storageType().configName());
        return new Limiter(config, storage);
    }

    /**
     * Attempts to take one token from a bucket.
     *
     * @see #consume(BucketKey, int)
     */
    public boolean consume(String key) {
        return consume(key, 1);
    }

    /**
     * Attempts to take tokens from the bucket named by a string.
     *
     * @throws InvalidValueException if key is empty or contains an unpaired surrogate
     * @see #consume(BucketKey, int)
     */
    public boolean consume(String key, int numTokens) {
        if (key == null) {
            throw new InvalidTypeException("key cannot be null");
        }
        if (key.isEmpty()) {
            throw new InvalidValueException("key must be a non-empty string");
        }
        BucketKey bucketKey;
        try {
            bucketKey = BucketKey.of(key);
        } catch (IllegalArgumentException e) {
            throw new InvalidValueException(e.getMessage(), e);
        }
        return consume(bucketKey, numTokens);
    }

    /**
     * Attempts to take one token from a bucket.
     *
     * @see #consume(BucketKey, int)
     */
    public boolean consume(byte[] key) {
        return consume(key, 1);
    }

    /**
     * Attempts to take tokens from the bucket named by a byte sequence.
     *
     * @see #consume(BucketKey, int)
     */
    public boolean consume(byte[] key, int numTokens) {
        if (key == null) {
            throw new InvalidTypeException("key cannot be null");
        }
        if (key.length == 0) {
            throw new InvalidValueException("key must be a non-empty byte sequence");
        }
        return consume(BucketKey.of(key), numTokens);
    }

    /**
     * Attempts to take tokens from a bucket.
     *
     * If the bucket does not exist yet it is created full before consuming.
     * Requesting more than one token fits requests that use a larger share of
     * the limited resource than others.
     *
     * A {@link BucketKey} is already non-empty and well-formed; malformed keys
     * are rejected by {@link BucketKey#of} with a plain
     * {@link IllegalArgumentException} before reaching the limiter. Use the
     * String or byte[] overloads to get {@link InvalidTypeException} and
     * {@link InvalidValueException} for raw keys.
     *
     * @param key Bucket to consume from
     * @param numTokens Tokens to take (>= 1)
     * @return true if all requested tokens were removed (conforming), false if
     *         the bucket held fewer and none were removed (non-conforming)
     * @throws InvalidTypeException if key is null
     * @throws InvalidValueException if numTokens < 1
     */
    public boolean consume(BucketKey key, int numTokens) {
        if (key == null) {
            throw new InvalidTypeException("key cannot be null");
        }
        if (numTokens < 1) {
            throw new InvalidValueException("numTokens must be >= 1, got: " + numTokens);
        }

        storage.replenish(key, rate, capacity);
        return storage.consume(key, numTokens);
    }

    public double rate() {
        return rate;
    }

    public long capacity() {
        return capacity;
    }

    public Storage storage() {
        return storage;
    }
}
