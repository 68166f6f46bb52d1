package net.seitter.heapstore.btree;

import net.seitter.heapstore.buffer.BufferPoolUtils;
import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.StorageException;
import net.seitter.heapstore.storage.layout.IndexPageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * The on-disk form of an index: entry-log pages holding {key, row} entries in write order.
 * Entries are only ever appended to the last page.
 */
public class IndexLog {
    private static final Logger logger = LoggerFactory.getLogger(IndexLog.class);

    private final PageFileHandle handle;
    private final int maxEntrySize;

    public IndexLog(PageFileHandle handle) {
        this.handle = handle;
        this.maxEntrySize = IndexPageLayout.maxEntrySize(handle.getPageSize());
    }

    public PageFileHandle getHandle() {
        return handle;
    }

    /**
     * Appends an entry, allocating a new page when the last one is full.
     *
     * @param entry The entry to persist
     * @throws IOException If the entry is larger than a page can hold, or page I/O fails
     */
    public void append(IndexEntry entry) throws IOException {
        byte[] bytes = entry.encode();
        if (bytes.length > maxEntrySize) {
            throw new StorageException(ErrorKind.PAGE_FULL, "Index entry of " + bytes.length +
                    " bytes exceeds the maximum entry size " + maxEntrySize + " of " + handle.getFileName());
        }

        int pageCount = handle.getPageCount();
        if (pageCount > 0) {
            boolean appended = BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageCount - 1), false,
                    page -> writableLayout(page).appendEntry(bytes));
            if (appended) {
                return;
            }
        }

        BufferPoolUtils.withNewPage(handle.getBufferPool(), page -> {
            IndexPageLayout layout = new IndexPageLayout(page);
            layout.initialize();
            if (!layout.appendEntry(bytes)) {
                throw new StorageException(ErrorKind.PAGE_FULL, "Index entry of " + bytes.length +
                        " bytes does not fit an empty page of " + handle.getFileName());
            }
            logger.debug("Index log {} grew to {} pages", handle.getFileName(), page.getPageNumber() + 1);
            return null;
        });
    }

    /**
     * Reads every entry in file order: page by page, then in write order within a page.
     *
     * @return The entries
     * @throws IOException If a page cannot be read or holds a malformed entry
     */
    public List<IndexEntry> readAll() throws IOException {
        List<IndexEntry> entries = new ArrayList<>();
        int pageCount = handle.getPageCount();
        for (int pageNumber = 0; pageNumber < pageCount; pageNumber++) {
            BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), false, page -> {
                IndexPageLayout layout = new IndexPageLayout(page);
                if (!layout.isFormatted()) {
                    return null;
                }
                layout.verify();
                for (byte[] bytes : layout.getEntries()) {
                    entries.add(decode(bytes, page));
                }
                return null;
            });
        }
        return entries;
    }

    /**
     * Counts the persisted entries without decoding them.
     *
     * @return The entry count
     * @throws IOException If a page cannot be read
     */
    public long getEntryCount() throws IOException {
        long count = 0;
        int pageCount = handle.getPageCount();
        for (int pageNumber = 0; pageNumber < pageCount; pageNumber++) {
            count += BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), false, page -> {
                IndexPageLayout layout = new IndexPageLayout(page);
                if (!layout.isFormatted()) {
                    return 0;
                }
                layout.verify();
                return layout.getEntryCount();
            });
        }
        return count;
    }

    private static IndexEntry decode(byte[] bytes, Page page) throws StorageException {
        try {
            return IndexEntry.decode(bytes);
        } catch (IllegalArgumentException e) {
            throw new StorageException(ErrorKind.PAGE_FORMAT, "Malformed index entry in page " + page.getPageId(), e);
        }
    }

    private static IndexPageLayout writableLayout(Page page) throws StorageException {
        IndexPageLayout layout = new IndexPageLayout(page);
        if (layout.isFormatted()) {
            layout.verify();
        } else {
            layout.initialize();
        }
        return layout;
    }
}
