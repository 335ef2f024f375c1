package ember.db;

import ember.utils.Time;

/**
 * When a key should disappear, as an absolute wall-clock instant.
 *
 * <p>The keyspace turns it into a monotonic deadline on insertion; the wall-clock
 * form is what survives in a snapshot.
 */
public final class Expiry {
    private final long expireAtMillis;

    private Expiry(long expireAtMillis) {
        this.expireAtMillis = expireAtMillis;
    }

    /** Expires {@code millis} from now. */
    public static Expiry in(long millis) {
        return new Expiry(Time.now() + millis);
    }

    /** Expires at the given Unix time in milliseconds. */
    public static Expiry at(long epochMillis) {
        return new Expiry(epochMillis);
    }

    public long expireAtMillis() {
        return expireAtMillis;
    }

    public long remainingMillis() {
        return expireAtMillis - Time.now();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Expiry && ((Expiry) o).expireAtMillis == expireAtMillis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(expireAtMillis);
    }

    @Override
    public String toString() {
        return "Expiry(" + expireAtMillis + ")";
    }
}
