package tokenbucket.core.storage;

import org.junit.jupiter.api.Test;
import tokenbucket.core.clock.ManualClock;
import tokenbucket.core.model.Bucket;
import tokenbucket.core.model.BucketKey;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageTest extends StorageContractTest {

    @Override
    protected Storage createStorage(ManualClock clock) {
        return new MemoryStorage(clock);
    }

    @Test
    void usesSuppliedTable() {
        ConcurrentMap<BucketKey, Bucket> table = new ConcurrentHashMap<>();
        MemoryStorage memory = new MemoryStorage(clock, table);

        memory.replenish(BucketKey.of("a"), 1.0, 4);
        memory.replenish(BucketKey.of("b"), 1.0, 4);

        assertEquals(2, table.size());
        assertEquals(new Bucket(4, clock.nowNanos()), table.get(BucketKey.of("a")));
        assertEquals(2, memory.size());
    }

    @Test
    void negativeCountIsReportedAsIs() {
        ConcurrentMap<BucketKey, Bucket> table = new ConcurrentHashMap<>();
        MemoryStorage memory = new MemoryStorage(clock, table);
        BucketKey key = BucketKey.of("raced");
        table.put(key, new Bucket(-1.5, clock.nowNanos()));

        assertEquals(-1.5, memory.getTokenCount(key));
        assertFalse(memory.consume(key, 1));

        clock.advanceSeconds(1.0);
        memory.replenish(key, 2.0, 10);
        assertEquals(0.5, memory.getTokenCount(key), 1e-9);
    }

    @Test
    void rejectsNullCollaborators() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryStorage(null));
        assertThrows(IllegalArgumentException.class, () -> new MemoryStorage(clock, null));
    }
}
