package ember.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class ExpirationTest {

    private Keyspace keyspace;

    @BeforeEach
    public void setup() {
        keyspace = new Keyspace();
    }

    @AfterEach
    public void tearDown() {
        keyspace.close();
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean waitFor(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    @Test
    public void testKeyDisappearsAfterTtl() throws InterruptedException {
        keyspace.set("k", b("v"), Expiry.in(200));
        assertArrayEquals(b("v"), keyspace.get("k"));

        Thread.sleep(300);

        assertNull(keyspace.get("k"), "Key should have expired");
        assertEquals(0, keyspace.exists(Collections.singletonList("k")));
        assertEquals(0, keyspace.size());
    }

    @Test
    public void testJanitorReclaimsStorage() throws InterruptedException {
        keyspace.set("k", b("v"), Expiry.in(100));
        assertTrue(waitFor(() -> keyspace.storedKeyCount() == 0, 2000), "Janitor should have removed the key");
        assertEquals(0, keyspace.indexedKeyCount());
    }

    @Test
    public void testEarlierDeadlineWakesJanitor() throws InterruptedException {
        keyspace.set("slow", b("v"), Expiry.in(10_000));
        // let the janitor settle into its ten second wait
        Thread.sleep(100);
        keyspace.set("fast", b("v"), Expiry.in(200));

        assertTrue(waitFor(() -> keyspace.storedKeyCount() == 1, 2000), "Janitor should have been woken for the earlier deadline");
        assertNull(keyspace.get("fast"));
        assertArrayEquals(b("v"), keyspace.get("slow"));
    }

    @Test
    public void testSetWithoutExpiryMakesKeyPersistent() throws InterruptedException {
        keyspace.set("k", b("v1"), Expiry.in(150));
        keyspace.set("k", b("v2"), null);
        assertEquals(0, keyspace.indexedKeyCount());
        assertNull(keyspace.expireAt("k"));

        Thread.sleep(250);
        assertArrayEquals(b("v2"), keyspace.get("k"));
    }

    @Test
    public void testResetExpiryReplacesOldDeadline() throws InterruptedException {
        keyspace.set("k", b("v"), Expiry.in(150));
        keyspace.set("k", b("v"), Expiry.in(10_000));
        assertEquals(1, keyspace.indexedKeyCount());

        Thread.sleep(250);
        assertArrayEquals(b("v"), keyspace.get("k"));
    }

    @Test
    public void testIncrementAndPushKeepTtl() throws InterruptedException {
        keyspace.set("n", b("1"), Expiry.in(200));
        assertEquals(2, keyspace.increment("n"));
        assertNotNull(keyspace.expireAt("n"));

        keyspace.pushRight("l", Collections.singletonList(b("a")));
        keyspace.set("l", keyspace.get("l"), Expiry.in(200));
        keyspace.pushRight("l", Collections.singletonList(b("b")));
        assertNotNull(keyspace.expireAt("l"));

        Thread.sleep(300);
        assertNull(keyspace.get("n"));
        assertNull(keyspace.get("l"));
    }

    @Test
    public void testExpiredKeyIsAbsentForWrites() throws InterruptedException {
        keyspace.set("n", b("41"), Expiry.in(100));
        Thread.sleep(200);
        // counts from zero, not from the expired value
        assertEquals(1, keyspace.increment("n"));
        assertNull(keyspace.expireAt("n"));
    }

    @Test
    public void testDeleteRemovesIndexEntry() {
        keyspace.set("k", b("v"), Expiry.in(10_000));
        assertEquals(1, keyspace.delete(Collections.singletonList("k")));
        assertEquals(0, keyspace.indexedKeyCount());
    }

    @Test
    public void testCloseStopsJanitor() {
        keyspace.set("k", b("v"), Expiry.in(60_000));
        assertTrue(keyspace.isJanitorAlive());

        keyspace.close();

        assertFalse(keyspace.isJanitorAlive());
        assertArrayEquals(b("v"), keyspace.get("k"));
        keyspace.close(); // second close is a no-op
    }
}
