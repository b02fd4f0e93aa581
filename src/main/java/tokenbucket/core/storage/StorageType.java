package tokenbucket.core.storage;

import java.util.Locale;

/**
 * Built-in storage engines.
 *
 * - MEMORY: Unlocked table, tolerates small bounded drift under contention
 * - ATOMIC: CAS per bucket, exact under contention, retries on collision
 */
public enum StorageType {
    /**
     * {@link MemoryStorage}: lowest overhead.
     * Precision: count may dip slightly negative or lose a few replenished
     * tokens when many threads race on one key.
     */
    MEMORY("memory"),

    /**
     * {@link AtomicMemoryStorage}: lock-free compare-and-swap.
     * Precision: exact.
     */
    ATOMIC("atomic");

    private final String configName;

    StorageType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Looks up a storage type by its configuration name, ignoring case.
     *
     * @param name Configuration name ("memory" or "atomic")
     * @return The matching type
     * @throws IllegalArgumentException if no type has that name
     */
    public static StorageType fromConfigName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("storage type name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StorageType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown storage type: '" + name + "'");
    }
}
