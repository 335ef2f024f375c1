package ember;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Server settings, read from a YAML file and then overridden by environment
 * variables.
 *
 * <pre>
 * port: 6379
 * bindAddress: 0.0.0.0
 * snapshotFile: dump.json
 * logLevel: INFO
 * </pre>
 */
public class Config {
    public static final String DEFAULT_FILE = "ember.yaml";

    public static final String ENV_PORT = "EMBER_PORT";
    public static final String ENV_SNAPSHOT_FILE = "EMBER_SNAPSHOT_FILE";
    public static final String ENV_LOG_LEVEL = "EMBER_LOG_LEVEL";

    public int port = 6379;
    public String bindAddress = "0.0.0.0";
    public String snapshotFile = "dump.json";
    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    /** Reads {@code filename} (defaults when missing) and applies the process environment. */
    public static Config load(String filename) throws ConfigException {
        return load(new File(filename), System.getenv());
    }

    public static Config load(File f, Map<String, String> env) throws ConfigException {
        Config config = new Config();

        if (f.exists()) {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
                JsonNode root = mapper.readTree(f);
                // An empty document has no root node
                if (root != null && !root.isMissingNode() && !root.isNull()) {
                    config = mapper.treeToValue(root, Config.class);
                }
            } catch (IOException e) {
                throw new ConfigException("Failed to read config " + f + ": " + e.getMessage(), e);
            }
        }

        config.applyEnv(env);
        config.validate();
        return config;
    }

    void applyEnv(Map<String, String> env) throws ConfigException {
        String port = env.get(ENV_PORT);
        if (port != null && !port.isBlank()) {
            try {
                this.port = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(ENV_PORT + " is not a number: " + port, e);
            }
        }
        String snapshot = env.get(ENV_SNAPSHOT_FILE);
        if (snapshot != null && !snapshot.isBlank()) {
            this.snapshotFile = snapshot.trim();
        }
        String level = env.get(ENV_LOG_LEVEL);
        if (level != null && !level.isBlank()) {
            this.logLevel = level.trim();
        }
    }

    void validate() throws ConfigException {
        if (port < 0 || port > 65535) {
            throw new ConfigException("port out of range: " + port);
        }
        if (bindAddress == null || bindAddress.isBlank()) {
            throw new ConfigException("bindAddress must not be empty");
        }
        if (snapshotFile == null || snapshotFile.isBlank()) {
            throw new ConfigException("snapshotFile must not be empty");
        }
    }

    public static class ConfigException extends Exception {
        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
