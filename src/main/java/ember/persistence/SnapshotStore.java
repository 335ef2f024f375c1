package ember.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import ember.db.Keyspace;
import ember.utils.Log;
import ember.utils.Time;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Saves and restores the whole keyspace as one JSON file:
 * {@code {"data": {key: base64}, "expiry": {key: unixMillis}}}.
 */
public class SnapshotStore {

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private volatile long lastSaveTime = 0;

    public SnapshotStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /** Unix seconds of the last successful save, 0 if none. */
    public long getLastSaveTime() {
        return lastSaveTime;
    }

    /**
     * Writes a snapshot of {@code keyspace}. The file is written next to the
     * target and moved into place, so a failed save never leaves a truncated
     * snapshot behind.
     */
    public synchronized void save(Keyspace keyspace) throws IOException {
        Snapshot snapshot = keyspace.snapshot();

        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writeValue(out, snapshot);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        lastSaveTime = Time.nowSeconds();
        Log.info("Snapshot saved to " + file + " (" + snapshot.data.size() + " keys)");
    }

    /**
     * Restores the keyspace from the snapshot file, or returns an empty one when
     * there is no file yet.
     */
    public Keyspace load() throws IOException {
        if (!Files.exists(file)) {
            Log.info("No snapshot at " + file + ", starting with an empty keyspace");
            return new Keyspace();
        }
        Snapshot snapshot;
        try (InputStream in = Files.newInputStream(file)) {
            snapshot = mapper.readValue(in, Snapshot.class);
        }
        if (snapshot == null || snapshot.data == null) {
            throw new IOException("Snapshot " + file + " has no data section");
        }
        Keyspace keyspace = Keyspace.restore(snapshot);
        Log.info("Loaded " + keyspace.size() + " keys from " + file);
        return keyspace;
    }
}
