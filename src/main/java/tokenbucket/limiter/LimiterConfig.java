package tokenbucket.limiter;

import tokenbucket.core.storage.StorageType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Properties;

/**
 * Configuration for creating a {@link Limiter}.
 *
 * Every instance is validated on construction, so a config that exists is
 * always usable.
 *
 * @param rate Tokens added to each bucket per second (finite, > 0)
 * @param capacity Maximum tokens a bucket holds (>= 1); bounds the burst size
 * @param storageType Storage engine used by {@link Limiter#create}
 */
public record LimiterConfig(
    double rate,
    long capacity,
    StorageType storageType
) {
    public static final String RATE_PROPERTY = "rate";
    public static final String CAPACITY_PROPERTY = "capacity";
    public static final String STORAGE_PROPERTY = "storage";

    public LimiterConfig {
        if (Double.isNaN(rate)) throw new InvalidTypeException("rate must be a number");
        if (rate <= 0) throw new InvalidValueException("rate must be > 0, got: " + rate);
        if (Double.isInfinite(rate)) throw new InvalidValueException("rate must be finite");
        if (capacity < 1) throw new InvalidValueException("capacity must be >= 1, got: " + capacity);
        if (storageType == null) throw new InvalidTypeException("storageType cannot be null");
    }

    /**
     * Creates a configuration backed by the default {@link StorageType#MEMORY} engine.
     *
     * @param rate Tokens added per second
     * @param capacity Maximum tokens per bucket
     * @return Validated configuration
     */
    public static LimiterConfig tokenBucket(double rate, long capacity) {
        return new LimiterConfig(rate, capacity, StorageType.MEMORY);
    }

    /**
     * Creates a configuration from loosely typed values, e.g. entries of a
     * configuration map.
     *
     * @param rate Any {@link Number}
     * @param capacity An integral number (Byte, Short, Integer, Long or BigInteger)
     * @return Validated configuration
     * @throws InvalidTypeException if rate is not a number or capacity is not an integer
     * @throws InvalidValueException if either is out of range
     */
    public static LimiterConfig of(Object rate, Object capacity) {
        if (!(rate instanceof Number)) {
            throw new InvalidTypeException("rate must be a number, got: " + typeName(rate));
        }
        if (!isIntegral(capacity)) {
            throw new InvalidTypeException("capacity must be an integer, got: " + typeName(capacity));
        }
        if (capacity instanceof BigInteger && ((BigInteger) capacity).bitLength() >= Long.SIZE) {
            throw new InvalidValueException("capacity out of range: " + capacity);
        }
        return tokenBucket(((Number) rate).doubleValue(), ((Number) capacity).longValue());
    }

    /**
     * Returns a copy of this configuration using another storage engine.
     */
    public LimiterConfig withStorage(StorageType type) {
        return new LimiterConfig(rate, capacity, type);
    }

    /**
     * Reads a configuration from properties.
     *
     * Keys are {@code <prefix>rate}, {@code <prefix>capacity} and the optional
     * {@code <prefix>storage} ("memory" or "atomic", default "memory").
     *
     * @param properties Source properties
     * @param prefix Key prefix, e.g. "limiter.api."; may be empty
     * @return Validated configuration
     * @throws InvalidTypeException if a key is missing or a value does not parse
     * @throws InvalidValueException if a value is out of range or the storage is unknown
     */
    public static LimiterConfig fromProperties(Properties properties, String prefix) {
        if (properties == null) throw new InvalidTypeException("properties cannot be null");
        String p = prefix == null ? "" : prefix;

        double rate = parseRate(required(properties, p + RATE_PROPERTY));
        long capacity = parseCapacity(required(properties, p + CAPACITY_PROPERTY));

        String storage = properties.getProperty(p + STORAGE_PROPERTY);
        StorageType type;
        try {
            type = storage == null ? StorageType.MEMORY : StorageType.fromConfigName(storage);
        } catch (IllegalArgumentException e) {
            throw new InvalidValueException(p + STORAGE_PROPERTY + ": " + e.getMessage(), e);
        }

        return new LimiterConfig(rate, capacity, type);
    }

    /**
     * Loads a properties resource from the classpath and reads it with
     * {@link #fromProperties(Properties, String)}.
     *
     * @param resource Classpath resource name, e.g. "limiter.properties"
     * @param prefix Key prefix; may be empty
     * @return Validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static LimiterConfig load(String resource, String prefix) {
        if (resource == null) throw new InvalidTypeException("resource cannot be null");

        ClassLoader loader = LimiterConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties, prefix);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + resource, e);
        }
    }

    private static String required(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new InvalidTypeException(key + " is required");
        }
        return value.trim();
    }

    private static double parseRate(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidTypeException("rate must be a number, got: '" + value + "'", e);
        }
    }

    private static long parseCapacity(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidTypeException("capacity must be an integer, got: '" + value + "'", e);
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
