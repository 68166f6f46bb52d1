package net.seitter.heapstore.storage;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * In-memory image of one fixed-size page. While resident in a buffer pool a page acts
 * as the pool's frame: it carries the dirty flag and the pin count the pool uses for
 * write-back and eviction decisions.
 *
 * <p>Callers only ever see a page between a fetch and the matching unpin; the bytes must
 * not be read or written after the page has been unpinned.
 */
public class Page {
    private final PageId pageId;
    private final byte[] data;
    private boolean dirty;
    private int pinCount;

    /**
     * Creates a zero-filled page.
     *
     * @param pageId The page identifier
     * @param pageSize The size of the page in bytes
     */
    public Page(PageId pageId, int pageSize) {
        this.pageId = pageId;
        this.data = new byte[pageSize];
    }

    /**
     * Creates a page holding a copy of the given bytes.
     *
     * @param pageId The page identifier
     * @param data The page content
     */
    public Page(PageId pageId, byte[] data) {
        this.pageId = pageId;
        this.data = Arrays.copyOf(data, data.length);
    }

    public PageId getPageId() {
        return pageId;
    }

    public int getPageNumber() {
        return pageId.getPageNumber();
    }

    /**
     * Gets the backing array. Writes through it are not tracked; callers report them
     * by unpinning with the dirty flag set.
     *
     * @return The page bytes
     */
    public byte[] getData() {
        return data;
    }

    /**
     * Wraps the page bytes in a fresh big-endian buffer positioned at 0.
     *
     * @return A buffer view of the page
     */
    public ByteBuffer getBuffer() {
        return ByteBuffer.wrap(data);
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        this.dirty = true;
    }

    public void markClean() {
        this.dirty = false;
    }

    public int getPinCount() {
        return pinCount;
    }

    public boolean isPinned() {
        return pinCount > 0;
    }

    public void pin() {
        pinCount++;
    }

    /**
     * Decrements the pin count.
     *
     * @return true if the page was pinned, false if the count was already 0
     */
    public boolean unpin() {
        if (pinCount > 0) {
            pinCount--;
            return true;
        }
        return false;
    }

    public int getPageSize() {
        return data.length;
    }

    @Override
    public String toString() {
        return "Page{" + pageId + ", pins=" + pinCount + (dirty ? ", dirty" : "") + "}";
    }
}
