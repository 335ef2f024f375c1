package ember;

import ember.db.Keyspace;
import ember.persistence.SnapshotStore;

/**
 * What commands and connection handlers see of the running server. One
 * instance is shared by every connection.
 */
public interface ServerContext {
    // Storage
    Keyspace getKeyspace();
    SnapshotStore getSnapshotStore();

    // Clients
    int getActiveConnections();
    void clientConnected();
    void clientDisconnected();

    // Stats
    long getTotalCommandsProcessed();
    void commandProcessed();
}
