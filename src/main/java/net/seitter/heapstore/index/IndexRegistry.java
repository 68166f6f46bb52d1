package net.seitter.heapstore.index;

import net.seitter.heapstore.btree.BPlusTreeIndex;
import net.seitter.heapstore.pool.HandlePool;
import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.table.TableHeap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps (table, index name) to the backing index file and hands out B+Tree indexes,
 * building each tree from its entry log the first time it is used.
 *
 * <p>Index records live in an {@link IndexCatalog}. Dropping an index removes its record
 * and releases its file handle but leaves the file on disk; such orphaned files must be
 * removed by the operator before an index of the same name can be created again.
 */
public class IndexRegistry {
    private static final Logger logger = LoggerFactory.getLogger(IndexRegistry.class);

    /**
     * Looks up the table heap an index is built on.
     */
    @FunctionalInterface
    public interface TableResolver {
        /**
         * @param table The table name
         * @return The open table heap, or null if the table does not exist
         * @throws IOException If the table file cannot be opened
         */
        TableHeap resolve(String table) throws IOException;
    }

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Path dataDir;
    private final int btreeOrder;
    private final HandlePool handlePool;
    private final IndexCatalog catalog;
    private final TableResolver tables;
    private final Map<String, BPlusTreeIndex> indexes = new LinkedHashMap<>();

    public IndexRegistry(Path dataDir, int btreeOrder, HandlePool handlePool,
                         IndexCatalog catalog, TableResolver tables) {
        this.dataDir = dataDir;
        this.btreeOrder = btreeOrder;
        this.handlePool = handlePool;
        this.catalog = catalog;
        this.tables = tables;
    }

    /**
     * Gets the file that backs an index: {@code <dataDir>/__idx__<table>__<index>.idx}.
     *
     * @param table The table name
     * @param name The index name
     * @return The index file path
     */
    public Path indexPath(String table, String name) {
        return dataDir.resolve("__idx__" + table + "__" + name + ".idx");
    }

    /**
     * Creates a non-unique index, see {@link #createIndex(String, String, String, boolean)}.
     */
    public IndexMetadata createIndex(String table, String column, String name) throws IOException {
        return createIndex(table, column, name, false);
    }

    /**
     * Creates an index by scanning the whole table, writing one entry per row to a new
     * index file and recording the index in the catalog.
     *
     * @param table The table name
     * @param column The indexed column
     * @param name The index name
     * @param unique Whether the index is declared unique; the flag is recorded, not enforced
     * @return The new index record
     * @throws IOException If the table or index file cannot be read or written
     * @throws IllegalArgumentException If the table or column does not exist
     * @throws IllegalStateException If the index exists, or its file is left over from a dropped index
     */
    public synchronized IndexMetadata createIndex(String table, String column, String name,
                                                  boolean unique) throws IOException {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid index name: " + name);
        }
        if (catalog.getIndex(table, name) != null) {
            throw new IllegalStateException("Index '" + name + "' already exists on table '" + table + "'");
        }
        TableHeap heap = requireTable(table);
        int columnIndex = heap.getSchema().indexOf(column);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Table '" + table + "' has no column '" + column + "'");
        }

        Path path = indexPath(table, name);
        if (Files.exists(path)) {
            throw new IllegalStateException("Index file " + path + " already exists; it is an orphan of a " +
                    "dropped index and must be removed first");
        }

        PageFileHandle handle = handlePool.acquire(path);
        BPlusTreeIndex index = new BPlusTreeIndex(name, handle, btreeOrder);
        IndexMetadata metadata = new IndexMetadata(table, name, heap.getSchema().getColumn(columnIndex).getName(),
                path.toString(), IndexType.BTREE, unique);
        long entries = 0;
        try {
            index.load();
            Iterator<Row> rows = heap.scan();
            while (rows.hasNext()) {
                Row row = rows.next();
                index.insert(row.get(columnIndex), row);
                entries++;
            }
            handle.getBufferPool().flushAll();
            catalog.addIndex(metadata);
        } catch (IOException | RuntimeException e) {
            discardFile(path);
            throw e;
        }

        indexes.put(key(table, name), index);
        logger.info("Created index {} with {} entries", metadata, entries);
        return metadata;
    }

    /**
     * Drops an index, keeping its file on disk.
     *
     * @param table The table name
     * @param name The index name
     * @return true if the index existed
     * @throws IOException If the catalog or the index file handle cannot be updated
     */
    public boolean dropIndex(String table, String name) throws IOException {
        return dropIndex(table, name, false);
    }

    /**
     * Drops an index: removes its record, releases its file handle and discards the tree.
     *
     * @param table The table name
     * @param name The index name
     * @param deleteFile Whether the index file is deleted as well
     * @return true if the index existed
     * @throws IOException If the catalog, the handle or the file cannot be updated
     */
    public synchronized boolean dropIndex(String table, String name, boolean deleteFile) throws IOException {
        IndexMetadata metadata = catalog.getIndex(table, name);
        if (metadata == null) {
            logger.warn("Attempted to drop unknown index '{}' on table '{}'", name, table);
            return false;
        }

        catalog.dropIndex(table, name);
        BPlusTreeIndex index = indexes.remove(key(table, name));
        Path path = Path.of(metadata.getPath());
        if (index != null) {
            index.unload();
            handlePool.release(path);
        }
        if (deleteFile) {
            Files.deleteIfExists(path);
        }
        logger.info("Dropped index '{}' on table '{}'{}", name, table, deleteFile ? " and deleted " + path : "");
        return true;
    }

    /**
     * Gets an index with its tree built, reading the entry log if the tree is not resident.
     *
     * @param table The table name
     * @param name The index name
     * @return The loaded index
     * @throws IOException If the index file cannot be read
     * @throws IllegalArgumentException If there is no such index
     */
    public synchronized BPlusTreeIndex load(String table, String name) throws IOException {
        BPlusTreeIndex index = indexes.get(key(table, name));
        if (index == null) {
            IndexMetadata metadata = catalog.getIndex(table, name);
            if (metadata == null) {
                throw new IllegalArgumentException("No index '" + name + "' on table '" + table + "'");
            }
            Path path = Path.of(metadata.getPath());
            PageFileHandle handle = handlePool.acquire(path);
            index = new BPlusTreeIndex(name, handle, btreeOrder);
            indexes.put(key(table, name), index);
        }
        index.load();
        return index;
    }

    /**
     * Discards the resident tree of an index so the next load rebuilds it from disk.
     *
     * @param table The table name
     * @param name The index name
     */
    public synchronized void markUnloaded(String table, String name) {
        BPlusTreeIndex index = indexes.get(key(table, name));
        if (index != null) {
            index.unload();
        }
    }

    /**
     * Checks whether the tree of an index is resident.
     */
    public synchronized boolean isLoaded(String table, String name) {
        BPlusTreeIndex index = indexes.get(key(table, name));
        return index != null && index.isLoaded();
    }

    public List<IndexMetadata> listIndexes(String table) {
        return catalog.listIndexes(table);
    }

    public IndexMetadata findIndexByColumn(String table, String column) {
        return catalog.findIndexByColumn(table, column);
    }

    /**
     * Adds a row that was just appended to a table to every index of that table.
     *
     * @param table The table name
     * @param row The row as stored in the table
     * @return The number of indexes updated
     * @throws IOException If an index cannot be loaded or written
     */
    public synchronized int insert(String table, Row row) throws IOException {
        List<IndexMetadata> tableIndexes = catalog.listIndexes(table);
        if (tableIndexes.isEmpty()) {
            return 0;
        }
        TableHeap heap = requireTable(table);
        Row normalized = heap.normalize(row);
        for (IndexMetadata metadata : tableIndexes) {
            int columnIndex = heap.getSchema().indexOf(metadata.getColumn());
            if (columnIndex < 0) {
                throw new IllegalStateException("Index " + metadata + " refers to a missing column");
            }
            load(table, metadata.getName()).insert(normalized.get(columnIndex), normalized);
        }
        return tableIndexes.size();
    }

    /**
     * Releases the file handles of every index opened through this registry.
     *
     * @throws IOException If a handle fails to flush or close
     */
    public synchronized void close() throws IOException {
        List<BPlusTreeIndex> open = new ArrayList<>(indexes.values());
        indexes.clear();
        for (BPlusTreeIndex index : open) {
            index.unload();
            handlePool.release(index.getHandle().getPath());
        }
    }

    public IndexCatalog getCatalog() {
        return catalog;
    }

    private TableHeap requireTable(String table) throws IOException {
        TableHeap heap = tables.resolve(table);
        if (heap == null) {
            throw new IllegalArgumentException("Table '" + table + "' does not exist");
        }
        return heap;
    }

    private void discardFile(Path path) {
        try {
            handlePool.release(path);
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to remove partially built index file {}", path, e);
        }
    }

    private static String key(String table, String name) {
        return table + "." + name;
    }
}
