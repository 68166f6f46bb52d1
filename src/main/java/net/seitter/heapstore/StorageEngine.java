package net.seitter.heapstore;

import net.seitter.heapstore.buffer.BufferPoolStatistics;
import net.seitter.heapstore.buffer.EvictionEvent;
import net.seitter.heapstore.index.IndexCatalog;
import net.seitter.heapstore.index.IndexMetadata;
import net.seitter.heapstore.index.IndexRegistry;
import net.seitter.heapstore.index.JsonIndexCatalog;
import net.seitter.heapstore.pool.HandlePool;
import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Schema;
import net.seitter.heapstore.table.RecordId;
import net.seitter.heapstore.table.TableHeap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Entry point of the storage engine for one data directory. Owns the handle pool, the
 * table schema store, the index catalog and the index registry.
 *
 * <p>Table files are named {@code <dataDir>/<table>.tbl}.
 */
public class StorageEngine implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(StorageEngine.class);

    public static final String SCHEMA_FILE = "schemas.json";
    public static final String INDEX_CATALOG_FILE = "indexes.json";
    public static final String TABLE_SUFFIX = ".tbl";

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final StorageConfig config;
    private final HandlePool handlePool;
    private final JsonSchemaStore schemaStore;
    private final IndexRegistry indexRegistry;
    private final Map<String, TableHeap> tables = new LinkedHashMap<>();
    private boolean shutdown;

    /**
     * Opens the data directory with an index catalog stored in {@code indexes.json}.
     *
     * @param config The configuration
     * @throws IOException If the data directory or its metadata files cannot be read
     */
    public StorageEngine(StorageConfig config) throws IOException {
        this(config, new JsonIndexCatalog(config.getDataDir().resolve(INDEX_CATALOG_FILE)));
    }

    /**
     * Opens the data directory with a caller-supplied index catalog.
     *
     * @param config The configuration
     * @param indexCatalog The index metadata store
     * @throws IOException If the data directory or the schema store cannot be read
     */
    public StorageEngine(StorageConfig config, IndexCatalog indexCatalog) throws IOException {
        this.config = config;
        Files.createDirectories(config.getDataDir());
        this.handlePool = new HandlePool(config);
        this.schemaStore = new JsonSchemaStore(config.getDataDir().resolve(SCHEMA_FILE));
        this.indexRegistry = new IndexRegistry(config.getDataDir(), config.getBtreeOrder(), handlePool,
                indexCatalog, this::getTable);

        logger.info("Storage engine opened at {} ({})", config.getDataDir().toAbsolutePath(), config);
    }

    public StorageConfig getConfig() {
        return config;
    }

    public HandlePool getHandlePool() {
        return handlePool;
    }

    public IndexRegistry getIndexRegistry() {
        return indexRegistry;
    }

    public Path tablePath(String table) {
        checkName(table);
        return config.getDataDir().resolve(table + TABLE_SUFFIX);
    }

    /**
     * Creates an empty table.
     *
     * @param name The table name
     * @param schema The table schema
     * @return The table heap
     * @throws IOException If the table file cannot be created
     * @throws IllegalStateException If the table already exists
     */
    public synchronized TableHeap createTable(String name, Schema schema) throws IOException {
        ensureRunning();
        Path path = tablePath(name);
        if (tables.containsKey(name) || schemaStore.contains(name) || Files.exists(path)) {
            throw new IllegalStateException("Table '" + name + "' already exists");
        }

        TableHeap heap = open(name, path, schema);
        schemaStore.put(name, schema);
        logger.info("Created table '{}' {}", name, schema);
        return heap;
    }

    /**
     * Opens an existing table file with the given schema and records the schema.
     *
     * @param name The table name
     * @param schema The table schema
     * @return The table heap
     * @throws IOException If the table file cannot be opened
     * @throws IllegalArgumentException If the table file does not exist, or the table is open with another schema
     */
    public synchronized TableHeap openTable(String name, Schema schema) throws IOException {
        ensureRunning();
        TableHeap heap = tables.get(name);
        if (heap != null) {
            if (!heap.getSchema().equals(schema)) {
                throw new IllegalArgumentException("Table '" + name + "' is open with schema " + heap.getSchema());
            }
            return heap;
        }

        Path path = tablePath(name);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Table file " + path + " does not exist");
        }
        heap = open(name, path, schema);
        schemaStore.put(name, schema);
        return heap;
    }

    /**
     * Gets an open table, opening it with its stored schema if needed.
     *
     * @param name The table name
     * @return The table heap, or null if the table is unknown
     * @throws IOException If the table file cannot be opened
     */
    public synchronized TableHeap getTable(String name) throws IOException {
        ensureRunning();
        TableHeap heap = tables.get(name);
        if (heap != null) {
            return heap;
        }
        Schema schema = schemaStore.get(name);
        if (schema == null) {
            return null;
        }
        Path path = tablePath(name);
        if (!Files.exists(path)) {
            logger.warn("Table '{}' has a stored schema but no file at {}", name, path);
            return null;
        }
        return open(name, path, schema);
    }

    /**
     * Appends a row to a table and to every index of the table.
     *
     * @param table The table name
     * @param row The row
     * @return The location of the new tuple
     * @throws IOException If the table or an index cannot be written
     */
    public synchronized RecordId insert(String table, Row row) throws IOException {
        TableHeap heap = getTable(table);
        if (heap == null) {
            throw new IllegalArgumentException("Table '" + table + "' does not exist");
        }
        RecordId recordId = heap.append(row);
        indexRegistry.insert(table, row);
        return recordId;
    }

    /**
     * Drops a table: its indexes are dropped and their files deleted, then the table
     * handle is released and the table file deleted.
     *
     * @param name The table name
     * @return true if the table existed
     * @throws IOException If a file cannot be closed or deleted
     */
    public synchronized boolean dropTable(String name) throws IOException {
        ensureRunning();
        Path path = tablePath(name);
        boolean known = tables.containsKey(name) || schemaStore.contains(name) || Files.exists(path);
        if (!known) {
            return false;
        }

        for (IndexMetadata metadata : indexRegistry.listIndexes(name)) {
            indexRegistry.dropIndex(name, metadata.getName(), true);
        }
        if (tables.remove(name) != null) {
            handlePool.release(path);
        }
        Files.deleteIfExists(path);
        schemaStore.remove(name);
        logger.info("Dropped table '{}'", name);
        return true;
    }

    /**
     * Lists every known table: open tables and tables with a stored schema.
     *
     * @return The table names in alphabetical order
     */
    public synchronized List<String> tableNames() {
        TreeSet<String> names = new TreeSet<>(schemaStore.tableNames());
        names.addAll(tables.keySet());
        return new ArrayList<>(names);
    }

    public List<BufferPoolStatistics> getStatistics() {
        return handlePool.getStatistics();
    }

    public List<EvictionEvent> getEvictionLog() {
        return handlePool.getEvictionLog();
    }

    /**
     * Flushes and closes every open file. The engine cannot be used afterwards.
     *
     * @throws IOException If a file fails to flush or close
     */
    public synchronized void shutdown() throws IOException {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down storage engine...");
        try {
            indexRegistry.close();
        } finally {
            tables.clear();
            handlePool.closeAll();
        }
        logger.info("Storage engine shutdown complete");
    }

    @Override
    public void close() throws IOException {
        shutdown();
    }

    private TableHeap open(String name, Path path, Schema schema) throws IOException {
        PageFileHandle handle = handlePool.acquire(path);
        TableHeap heap = new TableHeap(name, handle, schema);
        tables.put(name, heap);
        return heap;
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Storage engine has been shut down");
        }
    }

    private static void checkName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + name);
        }
    }
}
