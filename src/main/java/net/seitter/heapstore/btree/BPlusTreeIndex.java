package net.seitter.heapstore.btree;

import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * A single-column index: the persisted entry log plus the in-memory tree rebuilt from it.
 *
 * <p>The tree is built lazily on first access by replaying the log in file order and is
 * kept until {@link #unload()} is called. Entries hold full row snapshots, so later
 * updates or deletes of the table row are not reflected here.
 */
public class BPlusTreeIndex {
    private static final Logger logger = LoggerFactory.getLogger(BPlusTreeIndex.class);

    private final String name;
    private final IndexLog log;
    private final int order;
    private BPlusTree tree;

    public BPlusTreeIndex(String name, PageFileHandle handle, int order) {
        if (order < 3) {
            throw new IllegalArgumentException("B+Tree order must be at least 3: " + order);
        }
        this.name = name;
        this.log = new IndexLog(handle);
        this.order = order;
    }

    public String getName() {
        return name;
    }

    public PageFileHandle getHandle() {
        return log.getHandle();
    }

    public int getOrder() {
        return order;
    }

    public synchronized boolean isLoaded() {
        return tree != null;
    }

    /**
     * Builds the in-memory tree from the entry log unless it is already resident.
     *
     * @return The tree
     * @throws IOException If the log cannot be read
     */
    public synchronized BPlusTree load() throws IOException {
        if (tree == null) {
            BPlusTree rebuilt = new BPlusTree(order);
            List<IndexEntry> entries = log.readAll();
            for (IndexEntry entry : entries) {
                rebuilt.insert(entry.getKey(), entry.getRow());
            }
            tree = rebuilt;
            logger.info("Loaded index '{}' from {} with {} entries (height {})",
                    name, log.getHandle().getFileName(), entries.size(), tree.getHeight());
        }
        return tree;
    }

    /**
     * Discards the in-memory tree; the next access rebuilds it from the log.
     */
    public synchronized void unload() {
        if (tree != null) {
            tree = null;
            logger.debug("Unloaded index '{}'", name);
        }
    }

    /**
     * Persists an entry and adds it to the tree.
     *
     * @param key The key
     * @param row The row snapshot
     * @throws IOException If the entry cannot be written
     */
    public synchronized void insert(Value key, Row row) throws IOException {
        BPlusTree loaded = load();
        log.append(new IndexEntry(key, row));
        loaded.insert(key, row);
    }

    /**
     * Finds the rows stored under a key, in insertion order.
     */
    public synchronized List<Row> find(Value key) throws IOException {
        return load().find(key);
    }

    /**
     * Scans a key range in ascending order, see {@link BPlusTree#range}.
     */
    public synchronized Iterator<Row> range(Value lower, Value upper,
                                            boolean lowerInclusive, boolean upperInclusive) throws IOException {
        return load().range(lower, upper, lowerInclusive, upperInclusive);
    }

    public synchronized long size() throws IOException {
        return load().size();
    }

    /**
     * Counts the entries persisted in the log, without building the tree.
     */
    public long getPersistedEntryCount() throws IOException {
        return log.getEntryCount();
    }
}
