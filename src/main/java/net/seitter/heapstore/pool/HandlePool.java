package net.seitter.heapstore.pool;

import net.seitter.heapstore.StorageConfig;
import net.seitter.heapstore.buffer.BufferPoolManager;
import net.seitter.heapstore.buffer.BufferPoolStatistics;
import net.seitter.heapstore.buffer.EvictionEvent;
import net.seitter.heapstore.storage.Pager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-wide registry that keeps exactly one pager and buffer pool per physical page file.
 * Repeated acquisitions of the same path return the same handle and therefore share the
 * warm cache; the file is flushed and closed when the last reference is released.
 */
public class HandlePool {
    private static final Logger logger = LoggerFactory.getLogger(HandlePool.class);

    private final StorageConfig config;
    private final Map<Path, PageFileHandle> handles = new LinkedHashMap<>();

    public HandlePool(StorageConfig config) {
        this.config = config;
        logger.info("Handle pool initialized (policy: {}, default capacity: {} pages)",
                config.getEvictionPolicy(), config.getBufferPoolCapacity());
    }

    /**
     * Acquires the handle of a file using the configured page size and pool capacity.
     *
     * @param path The file path
     * @return The shared handle
     * @throws IOException If the file cannot be opened
     */
    public PageFileHandle acquire(Path path) throws IOException {
        return acquire(path, config.getPageSize(), config.getBufferPoolCapacity());
    }

    /**
     * Acquires the handle of a file, opening the file if no handle exists yet.
     * Each call adds one reference that must be given back with {@link #release(Path)}.
     *
     * @param path The file path
     * @param pageSize The page size of the file
     * @param capacity The buffer pool capacity, used only when the file is opened
     * @return The shared handle
     * @throws IOException If the file cannot be opened
     * @throws IllegalArgumentException If the file is already open with another page size
     */
    public synchronized PageFileHandle acquire(Path path, int pageSize, int capacity) throws IOException {
        Path key = normalize(path);
        PageFileHandle handle = handles.get(key);
        if (handle != null) {
            if (handle.getPageSize() != pageSize) {
                throw new IllegalArgumentException("File " + key + " is open with page size " +
                        handle.getPageSize() + ", requested " + pageSize);
            }
            handle.retain();
            logger.debug("Reusing handle for {} ({} references)", key, handle.getReferenceCount());
            return handle;
        }

        Pager pager = new Pager(key, pageSize);
        BufferPoolManager bufferPool;
        try {
            bufferPool = new BufferPoolManager(pager, capacity,
                    config.getEvictionPolicy().create(capacity), config.isEvictionLogEnabled());
        } catch (RuntimeException e) {
            pager.close();
            throw e;
        }

        handle = new PageFileHandle(key, pager, bufferPool);
        handle.retain();
        handles.put(key, handle);
        logger.info("Opened handle for {}", key);
        return handle;
    }

    /**
     * Gives back one reference. When the last reference is released the buffer pool is
     * flushed and the file is closed.
     *
     * @param path The file path
     * @return true if the handle was closed by this call
     * @throws IOException If flushing or closing fails
     */
    public synchronized boolean release(Path path) throws IOException {
        Path key = normalize(path);
        PageFileHandle handle = handles.get(key);
        if (handle == null) {
            logger.warn("Attempted to release unknown handle {}", key);
            return false;
        }

        if (handle.releaseReference() > 0) {
            logger.debug("Released reference to {} ({} remaining)", key, handle.getReferenceCount());
            return false;
        }

        handles.remove(key);
        handle.close();
        logger.info("Closed handle for {}", key);
        return true;
    }

    /**
     * Gets the open handle of a file without adding a reference.
     *
     * @param path The file path
     * @return The handle, or null if the file is not open
     */
    public synchronized PageFileHandle get(Path path) {
        return handles.get(normalize(path));
    }

    public synchronized boolean isOpen(Path path) {
        return handles.containsKey(normalize(path));
    }

    public synchronized List<PageFileHandle> getHandles() {
        return new ArrayList<>(handles.values());
    }

    /**
     * Takes a statistics snapshot of every open buffer pool.
     *
     * @return One snapshot per open file
     */
    public synchronized List<BufferPoolStatistics> getStatistics() {
        List<BufferPoolStatistics> statistics = new ArrayList<>(handles.size());
        for (PageFileHandle handle : handles.values()) {
            statistics.add(handle.getBufferPool().getStatistics());
        }
        return statistics;
    }

    /**
     * Collects the eviction logs of every open buffer pool.
     *
     * @return The eviction events, grouped by file
     */
    public synchronized List<EvictionEvent> getEvictionLog() {
        List<EvictionEvent> events = new ArrayList<>();
        for (PageFileHandle handle : handles.values()) {
            events.addAll(handle.getBufferPool().getEvictionLog());
        }
        return events;
    }

    /**
     * Flushes and closes every handle regardless of reference counts.
     *
     * @throws IOException If any handle fails to close; the remaining handles are still closed
     */
    public synchronized void closeAll() throws IOException {
        IOException failure = null;
        for (PageFileHandle handle : handles.values()) {
            try {
                handle.close();
            } catch (IOException e) {
                logger.warn("Failed to close handle for {}", handle.getPath(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        logger.info("Closed {} handles", handles.size());
        handles.clear();
        if (failure != null) {
            throw failure;
        }
    }

    public StorageConfig getConfig() {
        return config;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
