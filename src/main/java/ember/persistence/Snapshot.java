package ember.persistence;

import java.util.Map;

/**
 * Point-in-time copy of the keyspace. Expiry timestamps are Unix milliseconds,
 * so they stay meaningful across process restarts.
 */
public class Snapshot {
    public Map<String, byte[]> data;
    // Keys without expiry are absent; the whole section may be missing
    public Map<String, Long> expiry;

    public Snapshot() {
        // Default constructor for Jackson
    }

    public Snapshot(Map<String, byte[]> data, Map<String, Long> expiry) {
        this.data = data;
        this.expiry = expiry;
    }
}
