package net.seitter.heapstore.buffer;

import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.PageId;

import java.io.IOException;
import java.util.List;

/**
 * Interface for a buffer pool that caches the pages of one page file in a bounded
 * number of frames.
 */
public interface IBufferPoolManager {
    /**
     * Fetches and pins a page, loading it from disk on a miss. A miss on a full pool
     * evicts one unpinned page first, writing it back if it is dirty.
     *
     * @param pageId The ID of the page to fetch
     * @return The pinned page
     * @throws IOException If the page does not exist, all frames are pinned, or I/O fails
     */
    Page fetchPage(PageId pageId) throws IOException;

    /**
     * Unpins a page, allowing it to be evicted once its pin count reaches 0.
     *
     * @param pageId The ID of the page to unpin
     * @param isDirty Whether the page was modified
     */
    void unpinPage(PageId pageId, boolean isDirty);

    /**
     * Writes a resident page back if it is dirty.
     *
     * @param pageId The ID of the page to flush
     * @return true if the page was written, false if it is not resident or not dirty
     * @throws IOException If the write fails
     */
    boolean flushPage(PageId pageId) throws IOException;

    /**
     * Appends a new zero-filled page to the file and returns it pinned.
     *
     * @return The newly allocated page
     * @throws IOException If the file cannot be extended or all frames are pinned
     */
    Page allocatePage() throws IOException;

    /**
     * Writes back every dirty page.
     *
     * @throws IOException If a write fails
     */
    void flushAll() throws IOException;

    /**
     * Checks whether a page is currently resident.
     *
     * @param pageId The page ID
     * @return true if the page occupies a frame
     */
    boolean contains(PageId pageId);

    int getSize();

    int getCapacity();

    /**
     * Gets the name of the page file this pool serves.
     *
     * @return The file name
     */
    String getFileName();

    int getDirtyPageCount();

    /**
     * Gets a snapshot of the pool counters.
     *
     * @return The statistics
     */
    BufferPoolStatistics getStatistics();

    /**
     * Gets the eviction log, oldest first. Empty when logging is disabled.
     *
     * @return A copy of the eviction log
     */
    List<EvictionEvent> getEvictionLog();

    /**
     * Zeroes the counters and clears the eviction log.
     */
    void resetStatistics();

    /**
     * Flushes all dirty pages and drops every frame.
     *
     * @throws IOException If a write fails
     */
    void close() throws IOException;
}
