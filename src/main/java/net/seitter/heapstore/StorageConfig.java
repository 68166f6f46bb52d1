package net.seitter.heapstore;

import net.seitter.heapstore.buffer.EvictionPolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Immutable settings of a storage engine instance.
 *
 * <p>{@link #load()} reads {@code heapstore.properties} from the classpath and then applies
 * any {@code heapstore.*} system properties on top, for example
 * {@code -Dheapstore.data.dir=/tmp/db}.
 */
public class StorageConfig {
    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    public static final String RESOURCE_NAME = "heapstore.properties";

    public static final String DATA_DIR = "heapstore.data.dir";
    public static final String PAGE_SIZE = "heapstore.page.size";
    public static final String BUFFER_CAPACITY = "heapstore.buffer.capacity";
    public static final String BUFFER_POLICY = "heapstore.buffer.policy";
    public static final String EVICTION_LOG = "heapstore.buffer.eviction-log";
    public static final String BTREE_ORDER = "heapstore.btree.order";
    public static final String STATS_PORT = "heapstore.stats.port";

    public static final int DEFAULT_PAGE_SIZE = 4096;
    public static final int DEFAULT_BUFFER_CAPACITY = 256;
    public static final int DEFAULT_BTREE_ORDER = 64;
    public static final int DEFAULT_STATS_PORT = 8080;

    private static final int MIN_PAGE_SIZE = 64;

    private final Path dataDir;
    private final int pageSize;
    private final int bufferPoolCapacity;
    private final EvictionPolicyType evictionPolicy;
    private final boolean evictionLogEnabled;
    private final int btreeOrder;
    private final int statsPort;

    private StorageConfig(Builder builder) {
        if (builder.pageSize < MIN_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be at least " + MIN_PAGE_SIZE + " bytes: " +
                    builder.pageSize);
        }
        if (builder.bufferPoolCapacity <= 0) {
            throw new IllegalArgumentException("Buffer pool capacity must be positive: " + builder.bufferPoolCapacity);
        }
        if (builder.btreeOrder < 3) {
            throw new IllegalArgumentException("B+Tree order must be at least 3: " + builder.btreeOrder);
        }
        if (builder.statsPort < 0 || builder.statsPort > 65535) {
            throw new IllegalArgumentException("Invalid stats server port: " + builder.statsPort);
        }
        this.dataDir = builder.dataDir;
        this.pageSize = builder.pageSize;
        this.bufferPoolCapacity = builder.bufferPoolCapacity;
        this.evictionPolicy = builder.evictionPolicy;
        this.evictionLogEnabled = builder.evictionLogEnabled;
        this.btreeOrder = builder.btreeOrder;
        this.statsPort = builder.statsPort;
    }

    /**
     * Gets the built-in defaults with the data directory {@code ./data}.
     *
     * @return The default configuration
     */
    public static StorageConfig getDefault() {
        return builder().build();
    }

    /**
     * Loads the configuration from the classpath resource and system properties.
     *
     * @return The configuration
     */
    public static StorageConfig load() {
        Properties properties = new Properties();
        try (InputStream in = StorageConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
                logger.debug("Loaded {} from classpath", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("heapstore.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties; missing keys keep their defaults.
     *
     * @param properties The properties to read
     * @return The configuration
     * @throws IllegalArgumentException If a value cannot be parsed or is out of range
     */
    public static StorageConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String dataDir = properties.getProperty(DATA_DIR);
        if (dataDir != null && !dataDir.isBlank()) {
            builder.dataDir(Paths.get(dataDir.trim()));
        }
        builder.pageSize(intProperty(properties, PAGE_SIZE, DEFAULT_PAGE_SIZE));
        builder.bufferPoolCapacity(intProperty(properties, BUFFER_CAPACITY, DEFAULT_BUFFER_CAPACITY));
        String policy = properties.getProperty(BUFFER_POLICY);
        if (policy != null && !policy.isBlank()) {
            builder.evictionPolicy(EvictionPolicyType.fromName(policy));
        }
        String evictionLog = properties.getProperty(EVICTION_LOG);
        if (evictionLog != null && !evictionLog.isBlank()) {
            builder.evictionLogEnabled(Boolean.parseBoolean(evictionLog.trim()));
        }
        builder.btreeOrder(intProperty(properties, BTREE_ORDER, DEFAULT_BTREE_ORDER));
        builder.statsPort(intProperty(properties, STATS_PORT, DEFAULT_STATS_PORT));
        return builder.build();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with this configuration's values.
     *
     * @return The builder
     */
    public Builder toBuilder() {
        return new Builder()
                .dataDir(dataDir)
                .pageSize(pageSize)
                .bufferPoolCapacity(bufferPoolCapacity)
                .evictionPolicy(evictionPolicy)
                .evictionLogEnabled(evictionLogEnabled)
                .btreeOrder(btreeOrder)
                .statsPort(statsPort);
    }

    public Path getDataDir() {
        return dataDir;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getBufferPoolCapacity() {
        return bufferPoolCapacity;
    }

    public EvictionPolicyType getEvictionPolicy() {
        return evictionPolicy;
    }

    public boolean isEvictionLogEnabled() {
        return evictionLogEnabled;
    }

    public int getBtreeOrder() {
        return btreeOrder;
    }

    public int getStatsPort() {
        return statsPort;
    }

    @Override
    public String toString() {
        return "StorageConfig{dataDir=" + dataDir + ", pageSize=" + pageSize +
                ", bufferPoolCapacity=" + bufferPoolCapacity + ", evictionPolicy=" + evictionPolicy +
                ", evictionLogEnabled=" + evictionLogEnabled + ", btreeOrder=" + btreeOrder +
                ", statsPort=" + statsPort + "}";
    }

    /**
     * Builder for {@link StorageConfig}.
     */
    public static class Builder {
        private Path dataDir = Paths.get("data");
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int bufferPoolCapacity = DEFAULT_BUFFER_CAPACITY;
        private EvictionPolicyType evictionPolicy = EvictionPolicyType.LRU;
        private boolean evictionLogEnabled = false;
        private int btreeOrder = DEFAULT_BTREE_ORDER;
        private int statsPort = DEFAULT_STATS_PORT;

        private Builder() {
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder bufferPoolCapacity(int bufferPoolCapacity) {
            this.bufferPoolCapacity = bufferPoolCapacity;
            return this;
        }

        public Builder evictionPolicy(EvictionPolicyType evictionPolicy) {
            this.evictionPolicy = evictionPolicy;
            return this;
        }

        public Builder evictionLogEnabled(boolean evictionLogEnabled) {
            this.evictionLogEnabled = evictionLogEnabled;
            return this;
        }

        public Builder btreeOrder(int btreeOrder) {
            this.btreeOrder = btreeOrder;
            return this;
        }

        public Builder statsPort(int statsPort) {
            this.statsPort = statsPort;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
