package ember.db;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

public class KeyspaceConcurrencyTest {

    @Test
    public void testConcurrentIncrementsAreNotLost() throws Exception {
        int threadCount = 8;
        int perThread = 1000;
        try (Keyspace keyspace = new Keyspace()) {
            ExecutorService es = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                futures.add(es.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) keyspace.increment("counter");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
            es.shutdown();

            assertArrayEquals(Long.toString((long) threadCount * perThread).getBytes(StandardCharsets.US_ASCII),
                    keyspace.get("counter"));
        }
    }

    @Test
    public void testConcurrentPushesKeepEveryElement() throws Exception {
        int threadCount = 4;
        int perThread = 200;
        try (Keyspace keyspace = new Keyspace()) {
            ExecutorService es = Executors.newFixedThreadPool(threadCount);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                final boolean left = t % 2 == 0;
                futures.add(es.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        List<byte[]> value = Collections.singletonList(new byte[] {(byte) i});
                        if (left) keyspace.pushLeft("list", value);
                        else keyspace.pushRight("list", value);
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
            es.shutdown();

            assertEquals(threadCount * perThread, ListCodec.decode(keyspace.get("list")).size());
        }
    }

    @Test
    public void testExpiringWritesRaceWithJanitor() throws Exception {
        try (Keyspace keyspace = new Keyspace()) {
            ExecutorService es = Executors.newFixedThreadPool(4);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int id = t;
                futures.add(es.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        keyspace.set("k" + id + ":" + i, new byte[] {1}, Expiry.in(i % 5));
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
            es.shutdown();

            long deadline = System.currentTimeMillis() + 2000;
            while (keyspace.storedKeyCount() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, keyspace.storedKeyCount());
            assertEquals(0, keyspace.indexedKeyCount());
        }
    }
}
