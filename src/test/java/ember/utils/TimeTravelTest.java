package ember.utils;

import ember.db.Expiry;
import ember.db.Keyspace;
import ember.persistence.SnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class TimeTravelTest {

    private static class MockClock implements Time.Clock {
        private final AtomicLong currentTime = new AtomicLong(System.currentTimeMillis());

        @Override
        public long epochMillis() {
            return currentTime.get();
        }

        public void advance(long millis) {
            currentTime.addAndGet(millis);
        }
    }

    @TempDir
    Path tempDir;

    @AfterEach
    public void tearDown() {
        Time.useSystemClock();
    }

    @Test
    public void testKeyExpiresWhileServerIsDown() throws IOException {
        MockClock mockClock = new MockClock();
        Time.setClock(mockClock);
        SnapshotStore store = new SnapshotStore(tempDir.resolve("dump.json"));

        try (Keyspace keyspace = new Keyspace()) {
            keyspace.set("a", "1".getBytes(StandardCharsets.UTF_8), null);
            keyspace.set("b", "2".getBytes(StandardCharsets.UTF_8), Expiry.in(100_000));
            store.save(keyspace);
        }

        // Restart before the deadline
        try (Keyspace keyspace = store.load()) {
            assertNotNull(keyspace.get("b"));
        }

        mockClock.advance(100_001);

        try (Keyspace keyspace = store.load()) {
            assertArrayEquals("1".getBytes(StandardCharsets.UTF_8), keyspace.get("a"));
            assertNull(keyspace.get("b"), "Key should have expired while the server was down");
        }
    }

    @Test
    public void testRemainingTimeSurvivesRestart() throws IOException {
        MockClock mockClock = new MockClock();
        Time.setClock(mockClock);
        SnapshotStore store = new SnapshotStore(tempDir.resolve("dump.json"));
        long expireAt = Time.now() + 60_000;

        try (Keyspace keyspace = new Keyspace()) {
            keyspace.set("k", "v".getBytes(StandardCharsets.UTF_8), Expiry.at(expireAt));
            store.save(keyspace);
        }

        mockClock.advance(30_000);

        try (Keyspace keyspace = store.load()) {
            assertEquals(Long.valueOf(expireAt), keyspace.expireAt("k"));
            assertNotNull(keyspace.get("k"));
        }
    }

    @Test
    public void testSetClockReturnsPreviousClock() {
        Time.Clock first = Time.fixed(1_000L);
        assertSame(Time.SYSTEM, Time.setClock(first));
        assertSame(first, Time.setClock(Time.fixed(2_500L)));
        assertEquals(2_500L, Time.now());
        assertEquals(2L, Time.nowSeconds());
    }

    @Test
    public void testLastSaveTimeFollowsClock() throws IOException {
        Time.setClock(Time.fixed(1_700_000_000_123L));
        SnapshotStore store = new SnapshotStore(tempDir.resolve("dump.json"));

        try (Keyspace keyspace = new Keyspace()) {
            store.save(keyspace);
        }

        assertEquals(1_700_000_000L, store.getLastSaveTime());
    }
}
