package net.seitter.heapstore.storage.layout;

import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.StorageException;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout of an index entry-log page: a flat, append-only array of serialized entries
 * in write order. Each entry is stored as [length (2 bytes)] [entry bytes]. The page
 * has no ordering or tree structure; the header's item count is the number of entries
 * and its free space offset is the end of the last entry.
 */
public class IndexPageLayout extends PageLayout {
    public static final int LENGTH_PREFIX_SIZE = 2;

    public IndexPageLayout(Page page) {
        super(page);
    }

    @Override
    public void initialize() {
        writeHeader(PageType.INDEX_ENTRY_LOG, HEADER_SIZE);
    }

    @Override
    protected PageType expectedType() {
        return PageType.INDEX_ENTRY_LOG;
    }

    /**
     * Gets the largest entry an empty page of the given size can hold.
     *
     * @param pageSize The page size
     * @return The maximum entry length in bytes
     */
    public static int maxEntrySize(int pageSize) {
        return Math.min(0xFFFF, pageSize - HEADER_SIZE - LENGTH_PREFIX_SIZE);
    }

    public int getEntryCount() {
        return getItemCount();
    }

    /**
     * Appends an entry after the last one.
     *
     * @param entry The serialized entry
     * @return true if the entry was written, false if the page has no room for it
     */
    public boolean appendEntry(byte[] entry) {
        if (entry.length > 0xFFFF || LENGTH_PREFIX_SIZE + entry.length > getFreeSpace()) {
            return false;
        }

        int offset = getFreeSpaceOffset();
        buffer.putShort(offset, (short) entry.length);
        buffer.put(offset + LENGTH_PREFIX_SIZE, entry);

        setFreeSpaceOffset(offset + LENGTH_PREFIX_SIZE + entry.length);
        setItemCount(getItemCount() + 1);
        return true;
    }

    /**
     * Reads every entry in write order.
     *
     * @return The serialized entries
     * @throws StorageException If an entry runs past the recorded end of the page content
     */
    public List<byte[]> getEntries() throws StorageException {
        int entryCount = getEntryCount();
        int end = getFreeSpaceOffset();
        List<byte[]> entries = new ArrayList<>(entryCount);

        int offset = HEADER_SIZE;
        for (int i = 0; i < entryCount; i++) {
            if (offset + LENGTH_PREFIX_SIZE > end) {
                throw formatError("Entry " + i + " starts beyond the end of the entry log at " + end);
            }
            int length = buffer.getShort(offset) & 0xFFFF;
            offset += LENGTH_PREFIX_SIZE;
            if (offset + length > end) {
                throw formatError("Entry " + i + " of length " + length + " runs past the end of the entry log");
            }
            byte[] entry = new byte[length];
            buffer.get(offset, entry);
            entries.add(entry);
            offset += length;
        }
        return entries;
    }

    @Override
    public int getFreeSpace() {
        return page.getPageSize() - getFreeSpaceOffset();
    }
}
