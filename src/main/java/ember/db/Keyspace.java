package ember.db;

import ember.persistence.Snapshot;
import ember.utils.Log;
import ember.utils.Time;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The shared keyspace: key to value map, expiry index and the janitor thread
 * that reclaims expired keys.
 *
 * <p>All state is guarded by one read/write lock, held for exactly one logical
 * operation. Reads treat a key whose deadline has passed as absent even if the
 * janitor has not removed it yet; writes drop such a key before touching it.
 *
 * <p>Deadlines are monotonic nanoseconds measured from the keyspace's creation;
 * the wall-clock instant is kept alongside for snapshots.
 */
public class Keyspace implements AutoCloseable {

    private static final class Expiration implements Comparable<Expiration> {
        final String key;
        final long deadline;
        final long expireAtMillis;

        Expiration(String key, long deadline, long expireAtMillis) {
            this.key = key;
            this.deadline = deadline;
            this.expireAtMillis = expireAtMillis;
        }

        @Override
        public int compareTo(Expiration o) {
            int c = Long.compare(deadline, o.deadline);
            return c != 0 ? c : key.compareTo(o.key);
        }
    }

    private static final long NO_DEADLINE = Long.MAX_VALUE;
    // ~100 years; keeps origin-relative deadlines far from overflow
    private static final long MAX_REMAINING_NANOS = TimeUnit.DAYS.toNanos(36500);

    private final Map<String, byte[]> data = new HashMap<>();
    private final Map<String, Expiration> expirations = new HashMap<>();
    private final TreeSet<Expiration> expiryIndex = new TreeSet<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Condition janitorWakeup = lock.writeLock().newCondition();
    private final long origin = System.nanoTime();

    // Guarded by the write lock
    private long janitorWaitTarget = NO_DEADLINE;
    private boolean shutdown = false;

    private final Thread janitor;

    public Keyspace() {
        janitor = new Thread(this::runJanitor, "Janitor");
        janitor.setDaemon(true);
        janitor.start();
    }

    /**
     * Builds a keyspace from a snapshot. Entries whose expiry is not after the
     * current wall-clock time are skipped.
     */
    public static Keyspace restore(Snapshot snapshot) {
        Keyspace keyspace = new Keyspace();
        long now = Time.now();
        int dropped = 0;
        for (Map.Entry<String, byte[]> e : snapshot.data.entrySet()) {
            Long expireAt = snapshot.expiry == null ? null : snapshot.expiry.get(e.getKey());
            if (expireAt != null && expireAt <= now) {
                dropped++;
                continue;
            }
            keyspace.set(e.getKey(), e.getValue(), expireAt == null ? null : Expiry.at(expireAt));
        }
        if (dropped > 0) {
            Log.debug("Skipped " + dropped + " keys that expired while the server was down");
        }
        return keyspace;
    }

    private long clock() {
        return System.nanoTime() - origin;
    }

    private long deadlineFor(Expiry expiry) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, expiry.remainingMillis()));
        return clock() + Math.min(remaining, MAX_REMAINING_NANOS);
    }

    // --- READS ---

    /** Returns a copy of the value, or null when the key is absent or expired. */
    public byte[] get(String key) {
        lock.readLock().lock();
        try {
            return isLive(key, clock()) ? data.get(key).clone() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Counts present keys; a key named more than once counts each time. */
    public int exists(Collection<String> keys) {
        lock.readLock().lock();
        try {
            long now = clock();
            int count = 0;
            for (String key : keys) {
                if (isLive(key, now)) count++;
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            long now = clock();
            int count = 0;
            for (String key : data.keySet()) {
                if (isLive(key, now)) count++;
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Wall-clock expiry of a live key, or null if it has none. */
    public Long expireAt(String key) {
        lock.readLock().lock();
        try {
            if (!isLive(key, clock())) return null;
            Expiration e = expirations.get(key);
            return e == null ? null : e.expireAtMillis;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            long now = clock();
            Map<String, byte[]> values = new HashMap<>();
            Map<String, Long> expiry = new HashMap<>();
            for (Map.Entry<String, byte[]> e : data.entrySet()) {
                String key = e.getKey();
                if (!isLive(key, now)) continue;
                values.put(key, e.getValue().clone());
                Expiration exp = expirations.get(key);
                if (exp != null) expiry.put(key, exp.expireAtMillis);
            }
            return new Snapshot(values, expiry);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean isLive(String key, long now) {
        if (!data.containsKey(key)) return false;
        Expiration e = expirations.get(key);
        return e == null || e.deadline > now;
    }

    // --- WRITES ---

    /**
     * Stores a copy of {@code value} under {@code key}, replacing any previous
     * value and expiry. A null {@code expiry} leaves the key persistent.
     *
     * @return the previous value, or null if the key was absent
     */
    public byte[] set(String key, byte[] value, Expiry expiry) {
        lock.writeLock().lock();
        try {
            dropIfExpired(key);
            byte[] previous = data.put(key, value.clone());
            removeExpiration(key);
            if (expiry != null) {
                Expiration e = new Expiration(key, deadlineFor(expiry), expiry.expireAtMillis());
                expirations.put(key, e);
                expiryIndex.add(e);
                if (e.deadline < janitorWaitTarget) {
                    janitorWakeup.signal();
                }
            }
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return how many of the keys were present and removed */
    public int delete(Collection<String> keys) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String key : keys) {
                dropIfExpired(key);
                if (data.remove(key) != null) {
                    removeExpiration(key);
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long increment(String key) {
        return incrementBy(key, 1);
    }

    public long decrement(String key) {
        return incrementBy(key, -1);
    }

    /**
     * Adds {@code delta} to the integer stored at {@code key} (0 when absent).
     * An existing expiry is kept.
     *
     * @throws ValueTypeException if the value is not a base-10 64-bit integer or
     *         the result would overflow
     */
    public long incrementBy(String key, long delta) {
        lock.writeLock().lock();
        try {
            dropIfExpired(key);
            byte[] current = data.get(key);
            long value = current == null ? 0 : parseInteger(current);
            long updated;
            try {
                updated = Math.addExact(value, delta);
            } catch (ArithmeticException e) {
                throw new ValueTypeException(ValueTypeException.OVERFLOW, e);
            }
            data.put(key, Long.toString(updated).getBytes(StandardCharsets.US_ASCII));
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static long parseInteger(byte[] value) {
        String text = new String(value, StandardCharsets.UTF_8);
        // Long.parseLong tolerates a leading '+', stored integers never carry one
        if (text.isEmpty() || text.length() > 20 || text.charAt(0) == '+') {
            throw new ValueTypeException(ValueTypeException.NOT_AN_INTEGER);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ValueTypeException(ValueTypeException.NOT_AN_INTEGER, e);
        }
    }

    /** Pushes each value to the head in turn; returns the new length. */
    public int pushLeft(String key, List<byte[]> values) {
        return push(key, values, true);
    }

    /** Appends the values in order; returns the new length. */
    public int pushRight(String key, List<byte[]> values) {
        return push(key, values, false);
    }

    private int push(String key, List<byte[]> values, boolean head) {
        lock.writeLock().lock();
        try {
            dropIfExpired(key);
            byte[] current = data.get(key);
            Deque<byte[]> list = current == null ? new ArrayDeque<>() : new ArrayDeque<>(ListCodec.decode(current));
            for (byte[] v : values) {
                if (head) list.addFirst(v);
                else list.addLast(v);
            }
            data.put(key, ListCodec.encode(list));
            return list.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Callers hold the write lock.
    private void dropIfExpired(String key) {
        Expiration e = expirations.get(key);
        if (e != null && e.deadline <= clock()) {
            data.remove(key);
            expirations.remove(key);
            expiryIndex.remove(e);
        }
    }

    // Callers hold the write lock.
    private void removeExpiration(String key) {
        Expiration stale = expirations.remove(key);
        if (stale != null) {
            expiryIndex.remove(stale);
        }
    }

    // --- JANITOR ---

    private void runJanitor() {
        Log.info("[Janitor] Started");
        lock.writeLock().lock();
        try {
            while (!shutdown) {
                long next = purgeExpired();
                janitorWaitTarget = next;
                if (next == NO_DEADLINE) {
                    janitorWakeup.await();
                } else {
                    long wait = next - clock();
                    if (wait > 0) janitorWakeup.awaitNanos(wait);
                }
                janitorWaitTarget = NO_DEADLINE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.warn("[Janitor] Interrupted, expired keys will no longer be reclaimed in the background");
        } finally {
            lock.writeLock().unlock();
        }
        Log.info("[Janitor] Stopped");
    }

    /**
     * Removes every due key. Caller holds the write lock.
     *
     * @return the next pending deadline, or {@link #NO_DEADLINE}
     */
    private long purgeExpired() {
        long now = clock();
        int purged = 0;
        while (!expiryIndex.isEmpty()) {
            Expiration earliest = expiryIndex.first();
            if (earliest.deadline > now) {
                if (purged > 0) Log.debug("[Janitor] Reclaimed " + purged + " expired keys");
                return earliest.deadline;
            }
            expiryIndex.pollFirst();
            expirations.remove(earliest.key);
            data.remove(earliest.key);
            purged++;
        }
        if (purged > 0) Log.debug("[Janitor] Reclaimed " + purged + " expired keys");
        return NO_DEADLINE;
    }

    boolean isJanitorAlive() {
        return janitor.isAlive();
    }

    // Includes expired keys the janitor has not reclaimed yet.
    int storedKeyCount() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    int indexedKeyCount() {
        lock.readLock().lock();
        try {
            return expiryIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stops the janitor and waits for it to exit. The data stays readable.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (shutdown) return;
            shutdown = true;
            janitorWakeup.signalAll();
        } finally {
            lock.writeLock().unlock();
        }
        try {
            janitor.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
