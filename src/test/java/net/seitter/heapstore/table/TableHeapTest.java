package net.seitter.heapstore.table;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.seitter.heapstore.StorageConfig;
import net.seitter.heapstore.pool.HandlePool;
import net.seitter.heapstore.pool.PageFileHandle;
import net.seitter.heapstore.schema.Column;
import net.seitter.heapstore.schema.DataType;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Schema;
import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.StorageException;

/**
 * Tests for the TableHeap class.
 */
public class TableHeapTest {

    @TempDir
    Path tempDir;

    private static final Schema SCHEMA = Schema.of(
            new Column("id", DataType.INT, 0, false),
            new Column("name", DataType.VARCHAR, 64));

    private HandlePool handlePool;
    private Path tablePath;

    @BeforeEach
    public void setUp() {
        handlePool = new HandlePool(StorageConfig.builder().dataDir(tempDir).build());
        tablePath = tempDir.resolve("people.tbl");
    }

    @AfterEach
    public void tearDown() throws IOException {
        handlePool.closeAll();
    }

    private TableHeap openHeap(int capacity) throws IOException {
        PageFileHandle handle = handlePool.acquire(tablePath, 4096, capacity);
        return new TableHeap("people", handle, SCHEMA);
    }

    private static String name(int i) {
        StringBuilder sb = new StringBuilder("name-" + i + "-");
        while (sb.length() < 55) {
            sb.append('x');
        }
        return sb.toString();
    }

    private static List<Row> drain(Iterator<Row> rows) {
        List<Row> result = new ArrayList<>();
        rows.forEachRemaining(result::add);
        return result;
    }

    @Test
    public void testAppendSpansPagesAndScansInOrder() throws IOException {
        TableHeap heap = openHeap(16);
        for (int i = 0; i < 200; i++) {
            heap.append(Row.of(i, name(i)));
        }

        assertTrue(heap.getPageCount() >= 2, "200 rows of ~62 bytes should need several pages");
        List<Row> rows = drain(heap.scan());
        assertEquals(200, rows.size());
        for (int i = 0; i < 200; i++) {
            assertEquals(Row.of(i, name(i)), rows.get(i), "Row " + i + " out of order");
        }
        assertEquals(200, heap.count());
    }

    @Test
    public void testGetAndDelete() throws IOException {
        TableHeap heap = openHeap(16);
        RecordId first = heap.append(Row.of(1, "A"));
        RecordId second = heap.append(Row.of(2, "B"));

        assertEquals(new RecordId(0, 0), first);
        assertEquals(new RecordId(0, 1), second);
        assertEquals(Row.of(2, "B"), heap.get(second));

        assertTrue(heap.delete(first));
        assertFalse(heap.delete(first), "A tombstone cannot be deleted twice");
        assertNull(heap.get(first));
        assertEquals(List.of(Row.of(2, "B")), drain(heap.scan()));
        assertEquals(1, heap.count());
    }

    @Test
    public void testScanWithLocations() throws IOException {
        TableHeap heap = openHeap(16);
        heap.append(Row.of(1, "A"));
        RecordId second = heap.append(Row.of(2, "B"));
        heap.delete(new RecordId(0, 0));

        Iterator<TableRecord> records = heap.scanWithLocations();
        TableRecord record = records.next();
        assertEquals(second, record.getRecordId());
        assertEquals(Row.of(2, "B"), record.getRow());
        assertFalse(records.hasNext());
    }

    @Test
    public void testDeleteAllRefillsFromFirstPage() throws IOException {
        TableHeap heap = openHeap(16);
        for (int i = 0; i < 150; i++) {
            heap.append(Row.of(i, name(i)));
        }
        int pages = heap.getPageCount();

        assertEquals(150, heap.deleteAll());
        assertEquals(0, heap.count());
        assertEquals(pages, heap.getPageCount(), "The file keeps its size");

        assertEquals(new RecordId(0, 0), heap.append(Row.of(1000, "again")));
        for (int i = 0; i < 150; i++) {
            heap.append(Row.of(i, name(i)));
        }
        assertEquals(pages, heap.getPageCount(), "Emptied pages are reused before the file grows");
        assertEquals(151, heap.count());
    }

    @Test
    public void testUpdate() throws IOException {
        TableHeap heap = openHeap(16);
        RecordId recordId = heap.append(Row.of(1, "Alice"));

        assertEquals(recordId, heap.update(recordId, Row.of(1, "Al")), "A shorter row stays in place");
        assertEquals(Row.of(1, "Al"), heap.get(recordId));

        RecordId moved = heap.update(recordId, Row.of(1, "Alexandra"));
        assertNotEquals(recordId, moved);
        assertNull(heap.get(recordId));
        assertEquals(Row.of(1, "Alexandra"), heap.get(moved));
        assertEquals(1, heap.count());

        assertThrows(IllegalArgumentException.class, () -> heap.update(recordId, Row.of(1, "x")));
    }

    @Test
    public void testFailedMoveKeepsOriginalRow() throws IOException {
        Schema wide = Schema.of(
                new Column("id", DataType.INT, 0, false),
                new Column("name", DataType.VARCHAR, 2000));
        PageFileHandle handle = handlePool.acquire(tempDir.resolve("wide.tbl"), 4096, 1);
        TableHeap heap = new TableHeap("wide", handle, wide);
        Row original = Row.of(1, "a".repeat(1800));
        RecordId first = heap.append(original);
        heap.append(Row.of(2, "b".repeat(1800)));
        RecordId third = heap.append(Row.of(3, "c".repeat(1800)));
        assertEquals(0, first.getPageNumber());
        assertEquals(1, third.getPageNumber(), "Two wide rows fill page 0");

        // The only frame stays pinned, so moving the row to page 1 cannot get a frame
        handle.getBufferPool().fetchPage(handle.pageId(0));
        StorageException e = assertThrows(StorageException.class,
                () -> heap.update(first, Row.of(1, "z".repeat(1900))));
        assertEquals(ErrorKind.POOL_EXHAUSTED, e.getKind());
        handle.getBufferPool().unpinPage(handle.pageId(0), false);

        assertEquals(original, heap.get(first));
        assertEquals(3, heap.count());

        RecordId moved = heap.update(first, Row.of(1, "z".repeat(1900)));
        assertEquals(1, moved.getPageNumber());
        assertNull(heap.get(first));
        assertEquals(Row.of(1, "z".repeat(1900)), heap.get(moved));
        assertEquals(3, heap.count());
    }

    @Test
    public void testOversizeRowAllocatesNothing() throws IOException {
        PageFileHandle handle = handlePool.acquire(tablePath, 4096, 16);
        TableHeap heap = new TableHeap("blobs", handle,
                Schema.of(new Column("data", DataType.VARCHAR, 10000)));

        StorageException e = assertThrows(StorageException.class, () -> heap.append(Row.of("x".repeat(5000))));
        assertEquals(ErrorKind.PAGE_FULL, e.getKind());
        assertEquals(0, heap.getPageCount());
    }

    @Test
    public void testSchemaMismatch() throws IOException {
        TableHeap heap = openHeap(16);
        assertThrows(IllegalArgumentException.class, () -> heap.append(Row.of("one", "A")));
        assertEquals(0, heap.getPageCount());
    }

    @Test
    public void testUnformattedPageReadsEmpty() throws IOException {
        TableHeap heap = openHeap(16);
        heap.getHandle().getPager().allocatePage();

        assertEquals(0, heap.count());
        assertFalse(heap.scan().hasNext());
        assertFalse(heap.describePages().get(0).isFormatted());

        assertEquals(new RecordId(0, 0), heap.append(Row.of(1, "A")));
        assertEquals(1, heap.getPageCount(), "The empty page is formatted instead of allocating another");
    }

    @Test
    public void testDescribePages() throws IOException {
        TableHeap heap = openHeap(16);
        heap.append(Row.of(1, "A"));
        heap.append(Row.of(2, "B"));
        heap.delete(new RecordId(0, 1));

        PageInfo info = heap.describePages().get(0);
        assertEquals(2, info.getSlotCount());
        assertEquals(1, info.getLiveTuples());
        assertEquals(1, info.getTombstones());
        assertTrue(info.getFreeSpace() > 0);
    }

    @Test
    public void testPersistenceAcrossReopen() throws IOException {
        TableHeap heap = openHeap(16);
        for (int i = 0; i < 100; i++) {
            heap.append(Row.of(i, name(i)));
        }
        handlePool.release(tablePath);

        TableHeap reopened = openHeap(16);
        assertEquals(100, reopened.count());
        assertEquals(Row.of(99, name(99)), drain(reopened.scan()).get(99));
    }

    @Test
    public void testSmallPoolDoesNotLeakPins() throws IOException {
        TableHeap heap = openHeap(2);
        for (int i = 0; i < 200; i++) {
            heap.append(Row.of(i, name(i)));
        }

        assertEquals(200, drain(heap.scan()).size());
        assertEquals(200, heap.count());
        heap.describePages();
        heap.get(new RecordId(0, 0));
        heap.deleteAll();

        assertTrue(heap.getPageCount() > 2, "The table must outgrow the pool for this check");
        assertTrue(heap.getHandle().getBufferPool().getSize() <= 2);
    }
}
