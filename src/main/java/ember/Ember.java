package ember;

import ember.db.Keyspace;
import ember.persistence.SnapshotStore;
import ember.utils.Log;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Project: Ember
 * In-memory key-value server with per-key expiration and snapshots.
 */
public class Ember {
    public static final String VERSION = "0.1.0";

    public static void printBanner() {
        Log.info("\n" +
                "  ______           _               \n" +
                " |  ____|         | |              \n" +
                " | |__   _ __ ___ | |__   ___ _ __ \n" +
                " |  __| | '_ ` _ \\| '_ \\ / _ \\ '__|\n" +
                " | |____| | | | | | |_) |  __/ |   \n" +
                " |______|_| |_| |_|_.__/ \\___|_|   \n" +
                "                                   \n" +
                " :: Ember ::        (v" + VERSION + ") \n");
    }

    public static void main(String[] args) {
        String configFile = args.length > 0 ? args[0] : Config.DEFAULT_FILE;

        Config config;
        try {
            config = Config.load(configFile);
        } catch (Config.ConfigException e) {
            Log.error(e.getMessage());
            System.exit(1);
            return;
        }
        Log.setLevel(config.logLevel);
        printBanner();

        SnapshotStore snapshots = new SnapshotStore(Paths.get(config.snapshotFile));
        Keyspace keyspace;
        try {
            keyspace = snapshots.load();
        } catch (IOException e) {
            Log.error("Cannot load snapshot " + snapshots.getFile() + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        EmberServer server = new EmberServer(config.bindAddress, config.port, new EmberServerContext(keyspace, snapshots));
        try {
            server.start();
        } catch (Exception e) {
            Log.error("Cannot listen on " + config.bindAddress + ":" + config.port + ": " + e.getMessage());
            keyspace.close();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "Shutdown"));

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            server.stop();
        }
    }
}
