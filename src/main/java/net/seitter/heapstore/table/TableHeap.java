package net.seitter.heapstore.table;

import net.seitter.heapstore.buffer.BufferPoolUtils;
import net.seitter.heapstore.buffer.IBufferPoolManager;
import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.RowCodec;
import net.seitter.heapstore.schema.Schema;
import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.StorageException;
import net.seitter.heapstore.storage.layout.DataPageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Row-level storage of one table over the data pages of its page file.
 *
 * <p>The heap keeps no metadata page: the page count is derived from the file size and
 * rows are appended to the current insertion page, which is the last page unless
 * {@link #deleteAll()} emptied the file. Every page access goes through the shared
 * buffer pool of the file and is unpinned before the call returns.
 */
public class TableHeap {
    private static final Logger logger = LoggerFactory.getLogger(TableHeap.class);

    private final String name;
    private final PageFileHandle handle;
    private final RowCodec codec;
    private final int maxTupleSize;

    // Page that receives the next append; -1 means the last page of the file
    private int insertPage = -1;

    public TableHeap(String name, PageFileHandle handle, Schema schema) {
        this.name = name;
        this.handle = handle;
        this.codec = new RowCodec(schema);
        this.maxTupleSize = DataPageLayout.maxTupleSize(handle.getPageSize());
    }

    public String getName() {
        return name;
    }

    public Schema getSchema() {
        return codec.getSchema();
    }

    public PageFileHandle getHandle() {
        return handle;
    }

    /**
     * Checks a row against the schema and converts its values to the stored kinds.
     *
     * @param row The row
     * @return The row as it would be read back
     * @throws IllegalArgumentException If the row does not match the schema
     */
    public Row normalize(Row row) {
        return codec.normalize(row);
    }

    /**
     * Gets the number of data pages, derived from the file size.
     *
     * @return The page count
     * @throws IOException If the file size cannot be read
     */
    public int getPageCount() throws IOException {
        return handle.getPageCount();
    }

    /**
     * Appends a row. If the insertion page is full, the row goes to the next page,
     * which is allocated if the file has none.
     *
     * @param row The row to append
     * @return The location of the new tuple
     * @throws IOException If the row can never fit a page, or page I/O fails
     * @throws IllegalArgumentException If the row does not match the schema
     */
    public RecordId append(Row row) throws IOException {
        return insertTuple(encode(row));
    }

    private RecordId insertTuple(byte[] tuple) throws IOException {
        IBufferPoolManager bufferPool = handle.getBufferPool();
        int pageCount = handle.getPageCount();
        int target = insertPage >= 0 && insertPage < pageCount ? insertPage : pageCount - 1;

        if (target >= 0) {
            int slot = BufferPoolUtils.withPage(bufferPool, handle.pageId(target), false,
                    page -> writableLayout(page).insertTuple(tuple));
            if (slot >= 0) {
                insertPage = target;
                return new RecordId(target, slot);
            }
            logger.debug("Page {} of table '{}' is full", target, name);

            // Pages after the insertion page exist only after deleteAll emptied them
            if (target + 1 < pageCount) {
                int next = target + 1;
                slot = BufferPoolUtils.withPage(bufferPool, handle.pageId(next), false,
                        page -> writableLayout(page).insertTuple(tuple));
                if (slot >= 0) {
                    insertPage = next;
                    return new RecordId(next, slot);
                }
                throw new StorageException(ErrorKind.PAGE_FULL, "Tuple of " + tuple.length +
                        " bytes does not fit page " + next + " of table '" + name + "'");
            }
        }

        RecordId recordId = BufferPoolUtils.withNewPage(bufferPool, page -> {
            DataPageLayout layout = new DataPageLayout(page);
            layout.initialize();
            int slot = layout.insertTuple(tuple);
            if (slot < 0) {
                throw new StorageException(ErrorKind.PAGE_FULL, "Tuple of " + tuple.length +
                        " bytes does not fit an empty page of table '" + name + "'");
            }
            return new RecordId(page.getPageNumber(), slot);
        });
        insertPage = recordId.getPageNumber();
        logger.debug("Table '{}' grew to {} pages", name, insertPage + 1);
        return recordId;
    }

    /**
     * Reads the row at a location.
     *
     * @param recordId The location
     * @return The row, or null if the tuple was deleted
     * @throws IOException If the page does not exist or cannot be read
     */
    public Row get(RecordId recordId) throws IOException {
        return BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(recordId.getPageNumber()), false, page -> {
            DataPageLayout layout = readableLayout(page);
            if (layout == null) {
                throw new IllegalArgumentException("Slot " + recordId.getSlot() + " does not exist in empty page " +
                        recordId.getPageNumber());
            }
            byte[] tuple = layout.getTuple(recordId.getSlot());
            return tuple == null ? null : decode(tuple, page);
        });
    }

    /**
     * Marks the tuple at a location as deleted.
     *
     * @param recordId The location
     * @return true if a live tuple was deleted
     * @throws IOException If the page does not exist or cannot be read
     */
    public boolean delete(RecordId recordId) throws IOException {
        return BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(recordId.getPageNumber()), false, page -> {
            DataPageLayout layout = readableLayout(page);
            return layout != null && layout.deleteTuple(recordId.getSlot());
        });
    }

    /**
     * Removes every row by formatting all pages empty. The file keeps its size and later
     * appends fill the pages again from page 0.
     *
     * @return The number of live rows removed
     * @throws IOException If page I/O fails
     */
    public int deleteAll() throws IOException {
        int pageCount = handle.getPageCount();
        int removed = 0;
        for (int pageNumber = 0; pageNumber < pageCount; pageNumber++) {
            removed += BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), true, page -> {
                DataPageLayout layout = readableLayout(page);
                int live = layout == null ? 0 : layout.getLiveTupleCount();
                new DataPageLayout(page).clear();
                return live;
            });
        }
        insertPage = 0;
        logger.info("Deleted {} rows from table '{}' ({} pages kept)", removed, name, pageCount);
        return removed;
    }

    /**
     * Replaces the row at a location. The new tuple overwrites the old one when it is not
     * longer; otherwise the row is appended elsewhere first and the old slot is deleted
     * once the append has succeeded, so a failed move leaves the old row in place.
     *
     * @param recordId The current location of the row
     * @param row The new row
     * @return The location of the row after the update
     * @throws IOException If page I/O fails
     * @throws IllegalArgumentException If the location holds a deleted tuple
     */
    public RecordId update(RecordId recordId, Row row) throws IOException {
        byte[] tuple = encode(row);
        boolean inPlace = BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(recordId.getPageNumber()),
                false, page -> {
                    DataPageLayout layout = readableLayout(page);
                    if (layout == null) {
                        throw new IllegalArgumentException("Slot " + recordId.getSlot() +
                                " does not exist in empty page " + recordId.getPageNumber());
                    }
                    return layout.updateTuple(recordId.getSlot(), tuple);
                });

        if (inPlace) {
            return recordId;
        }
        RecordId moved = insertTuple(tuple);
        delete(recordId);
        logger.debug("Row {} of table '{}' moved to {}", recordId, name, moved);
        return moved;
    }

    /**
     * Scans all live rows in page order, then slot order. Each call starts a new scan
     * from page 0. Rows appended while a scan runs may or may not be returned.
     *
     * @return A lazy iterator over the rows; I/O failures surface as {@link UncheckedIOException}
     */
    public Iterator<Row> scan() {
        Iterator<TableRecord> records = scanWithLocations();
        return new Iterator<Row>() {
            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public Row next() {
                return records.next().getRow();
            }
        };
    }

    /**
     * Scans all live rows together with their locations, in the same order as {@link #scan()}.
     *
     * @return A lazy iterator over the records
     */
    public Iterator<TableRecord> scanWithLocations() {
        return new PageScanIterator();
    }

    /**
     * Counts the live rows.
     *
     * @return The row count
     * @throws IOException If page I/O fails
     */
    public long count() throws IOException {
        int pageCount = handle.getPageCount();
        long count = 0;
        for (int pageNumber = 0; pageNumber < pageCount; pageNumber++) {
            count += BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), false, page -> {
                DataPageLayout layout = readableLayout(page);
                return layout == null ? 0 : layout.getLiveTupleCount();
            });
        }
        return count;
    }

    /**
     * Describes the occupancy of every page.
     *
     * @return One entry per page, in page order
     * @throws IOException If page I/O fails
     */
    public List<PageInfo> describePages() throws IOException {
        int pageCount = handle.getPageCount();
        List<PageInfo> pages = new ArrayList<>(pageCount);
        for (int pageNumber = 0; pageNumber < pageCount; pageNumber++) {
            int number = pageNumber;
            pages.add(BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), false, page -> {
                DataPageLayout layout = readableLayout(page);
                if (layout == null) {
                    return new PageInfo(number, false, 0, 0, page.getPageSize() - DataPageLayout.HEADER_SIZE);
                }
                return new PageInfo(number, true, layout.getSlotCount(), layout.getLiveTupleCount(),
                        layout.getFreeSpace());
            }));
        }
        return pages;
    }

    private byte[] encode(Row row) throws StorageException {
        byte[] tuple = codec.encode(row);
        if (tuple.length > maxTupleSize) {
            throw new StorageException(ErrorKind.PAGE_FULL, "Row of " + tuple.length +
                    " bytes exceeds the maximum tuple size " + maxTupleSize + " of table '" + name + "'");
        }
        return tuple;
    }

    private Row decode(byte[] tuple, Page page) throws StorageException {
        try {
            return codec.decode(tuple);
        } catch (IllegalArgumentException e) {
            throw new StorageException(ErrorKind.PAGE_FORMAT, "Undecodable tuple in page " + page.getPageId(), e);
        }
    }

    private List<TableRecord> readPage(int pageNumber) throws IOException {
        return BufferPoolUtils.withPage(handle.getBufferPool(), handle.pageId(pageNumber), false, page -> {
            DataPageLayout layout = readableLayout(page);
            if (layout == null) {
                return Collections.<TableRecord>emptyList();
            }
            List<TableRecord> records = new ArrayList<>();
            for (int slot : layout.getLiveSlots()) {
                records.add(new TableRecord(new RecordId(pageNumber, slot), decode(layout.getTuple(slot), page)));
            }
            return records;
        });
    }

    /**
     * Gets the layout of a page for reading, or null if the page was never formatted.
     */
    private static DataPageLayout readableLayout(Page page) throws StorageException {
        DataPageLayout layout = new DataPageLayout(page);
        if (!layout.isFormatted()) {
            return null;
        }
        layout.verify();
        return layout;
    }

    private static DataPageLayout writableLayout(Page page) throws StorageException {
        DataPageLayout layout = new DataPageLayout(page);
        if (layout.isFormatted()) {
            layout.verify();
        } else {
            layout.initialize();
        }
        return layout;
    }

    /**
     * Reads one page at a time, copying its live tuples so no page stays pinned between calls.
     */
    private class PageScanIterator implements Iterator<TableRecord> {
        private int nextPage = 0;
        private Iterator<TableRecord> current = Collections.emptyIterator();

        @Override
        public boolean hasNext() {
            try {
                while (!current.hasNext()) {
                    if (nextPage >= handle.getPageCount()) {
                        return false;
                    }
                    current = readPage(nextPage++).iterator();
                }
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Scan of table '" + name + "' failed at page " + (nextPage - 1), e);
            }
        }

        @Override
        public TableRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
