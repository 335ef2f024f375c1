package ember;

import ember.db.Keyspace;
import ember.persistence.SnapshotStore;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class EmberServerContext implements ServerContext {
    private final Keyspace keyspace;
    private final SnapshotStore snapshotStore;
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicLong totalCommands = new AtomicLong(0);

    public EmberServerContext(Keyspace keyspace, SnapshotStore snapshotStore) {
        this.keyspace = keyspace;
        this.snapshotStore = snapshotStore;
    }

    @Override
    public Keyspace getKeyspace() {
        return keyspace;
    }

    @Override
    public SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }

    @Override
    public int getActiveConnections() {
        return activeConnections.get();
    }

    @Override
    public void clientConnected() {
        activeConnections.incrementAndGet();
    }

    @Override
    public void clientDisconnected() {
        activeConnections.decrementAndGet();
    }

    @Override
    public long getTotalCommandsProcessed() {
        return totalCommands.get();
    }

    @Override
    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }
}
