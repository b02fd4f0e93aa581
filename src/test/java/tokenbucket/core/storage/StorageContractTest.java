package tokenbucket.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tokenbucket.core.clock.ManualClock;
import tokenbucket.core.model.BucketKey;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every in-memory storage engine must share.
 * Subclasses supply the engine; time is driven by a ManualClock.
 */
abstract class StorageContractTest {

    private static final double EPSILON = 1e-9;
    private static final BucketKey KEY = BucketKey.of("key");

    protected ManualClock clock;
    protected Storage storage;

    protected abstract Storage createStorage(ManualClock clock);

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_000_000_000L);
        storage = createStorage(clock);
    }

    @Test
    void unknownKeyHasNoTokens() {
        assertEquals(0.0, storage.getTokenCount(KEY));
    }

    @Test
    void firstReplenishCreatesFullBucket() {
        storage.replenish(KEY, 10.0, 7);

        assertEquals(7.0, storage.getTokenCount(KEY));
    }

    @Test
    void getTokenCountDoesNotReplenish() {
        storage.replenish(KEY, 10.0, 10);
        assertTrue(storage.consume(KEY, 10));

        clock.advanceSeconds(1.0);

        assertEquals(0.0, storage.getTokenCount(KEY));
        assertEquals(0.0, storage.getTokenCount(KEY));
    }

    @Test
    void replenishFollowsElapsedTime() {
        storage.replenish(KEY, 4.0, 10);
        assertTrue(storage.consume(KEY, 9)); // t0 = 1

        clock.advanceNanos(750_000_000L); // +0.75s at 4/s = +3
        storage.replenish(KEY, 4.0, 10);

        assertEquals(4.0, storage.getTokenCount(KEY), EPSILON);
    }

    @Test
    void replenishIsCappedAtCapacity() {
        storage.replenish(KEY, 100.0, 5);
        assertTrue(storage.consume(KEY, 1));

        for (int i = 0; i < 2; i++) {
            clock.advanceSeconds(10.0);
            storage.replenish(KEY, 100.0, 5);
            assertEquals(5.0, storage.getTokenCount(KEY));
        }
    }

    @Test
    void replenishWithoutElapsedTimeChangesNothing() {
        storage.replenish(KEY, 10.0, 10);
        assertTrue(storage.consume(KEY, 3));

        storage.replenish(KEY, 10.0, 10);
        storage.replenish(KEY, 10.0, 10);

        assertEquals(7.0, storage.getTokenCount(KEY));
    }

    @Test
    void replenishWithStaleTimestampIsIgnored() {
        storage.replenish(KEY, 10.0, 10);
        assertTrue(storage.consume(KEY, 10));
        clock.advanceNanos(100_000_000L);
        storage.replenish(KEY, 10.0, 10); // 1 token at t = 1.1s

        clock.setNanos(1_000_000_000L); // a reading older than the stored one
        storage.replenish(KEY, 10.0, 10);

        assertEquals(1.0, storage.getTokenCount(KEY), EPSILON);

        clock.setNanos(1_200_000_000L);
        storage.replenish(KEY, 10.0, 10);
        assertEquals(2.0, storage.getTokenCount(KEY), EPSILON);
    }

    @Test
    void consumeIsAllOrNothing() {
        storage.replenish(KEY, 1.0, 5);

        assertFalse(storage.consume(KEY, 6));
        assertEquals(5.0, storage.getTokenCount(KEY));

        assertTrue(storage.consume(KEY, 3));
        assertEquals(2.0, storage.getTokenCount(KEY));

        assertFalse(storage.consume(KEY, 3));
        assertEquals(2.0, storage.getTokenCount(KEY));

        assertTrue(storage.consume(KEY, 2));
        assertEquals(0.0, storage.getTokenCount(KEY));
    }

    @Test
    void fractionalTokensArePreserved() {
        storage.replenish(KEY, 2.5, 1);
        assertTrue(storage.consume(KEY, 1));

        clock.advanceNanos(200_000_000L); // +0.5 token
        storage.replenish(KEY, 2.5, 1);
        assertFalse(storage.consume(KEY, 1));
        assertEquals(0.5, storage.getTokenCount(KEY), EPSILON);

        clock.advanceNanos(200_000_000L);
        storage.replenish(KEY, 2.5, 1);
        assertTrue(storage.consume(KEY, 1));
        assertEquals(0.0, storage.getTokenCount(KEY), EPSILON);
    }

    @Test
    void keysAreIndependent() {
        BucketKey other = BucketKey.of("other");
        storage.replenish(KEY, 1.0, 3);
        storage.replenish(other, 1.0, 3);

        assertTrue(storage.consume(KEY, 3));
        assertFalse(storage.consume(KEY, 1));

        assertEquals(3.0, storage.getTokenCount(other));
        assertTrue(storage.consume(other, 1));
    }

    @Test
    void consumeBeforeReplenishFails() {
        assertThrows(IllegalStateException.class, () -> storage.consume(KEY, 1));
    }
}
