package tokenbucket.core.storage;

import tokenbucket.core.clock.Clock;

/**
 * Factory for the built-in storage engines.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class StorageFactory {

    private StorageFactory() {
        // Utility class, no instantiation
    }

    /**
     * Creates an empty storage of the given type.
     *
     * @param type Engine to create
     * @param clock Clock instance for time control (injected for testability)
     * @return A new, empty storage
     * @throws IllegalArgumentException if type or clock is null
     */
    public static Storage create(StorageType type, Clock clock) {
        if (type == null) throw new IllegalArgumentException("type cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");

        return switch (type) {
            case MEMORY -> new MemoryStorage(clock);
            case ATOMIC -> new AtomicMemoryStorage(clock);
        };
    }
}
