package net.seitter.heapstore.storage.layout;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.PageId;
import net.seitter.heapstore.storage.StorageException;

/**
 * Tests for the index entry-log page layout.
 */
public class IndexPageLayoutTest {

    private static final int PAGE_SIZE = 512;

    private Page page;
    private IndexPageLayout layout;

    @BeforeEach
    public void setUp() {
        page = new Page(new PageId("test.idx", 0), PAGE_SIZE);
        layout = new IndexPageLayout(page);
        layout.initialize();
    }

    @Test
    public void testEntriesKeepWriteOrder() throws StorageException {
        assertTrue(layout.appendEntry(new byte[]{3}));
        assertTrue(layout.appendEntry(new byte[]{1, 1}));
        assertTrue(layout.appendEntry(new byte[]{2, 2, 2}));

        List<byte[]> entries = layout.getEntries();
        assertEquals(3, layout.getEntryCount());
        assertArrayEquals(new byte[]{3}, entries.get(0));
        assertArrayEquals(new byte[]{1, 1}, entries.get(1));
        assertArrayEquals(new byte[]{2, 2, 2}, entries.get(2));
    }

    @Test
    public void testAppendFailsWhenFull() throws StorageException {
        byte[] entry = new byte[100];
        int appended = 0;
        while (layout.appendEntry(entry)) {
            appended++;
        }
        assertEquals((PAGE_SIZE - PageLayout.HEADER_SIZE) / 102, appended);
        assertEquals(appended, layout.getEntries().size());
    }

    @Test
    public void testMaxEntryFitsEmptyPage() {
        assertTrue(layout.appendEntry(new byte[IndexPageLayout.maxEntrySize(PAGE_SIZE)]));
        assertEquals(0, layout.getFreeSpace());
        assertFalse(layout.appendEntry(new byte[0]));
    }

    @Test
    public void testOverrunningEntryIsDetected() {
        layout.appendEntry(new byte[]{1, 2, 3});
        // Claim a longer entry than was written
        page.getBuffer().putShort(PageLayout.HEADER_SIZE, (short) 200);

        StorageException e = assertThrows(StorageException.class, () -> layout.getEntries());
        assertEquals(ErrorKind.PAGE_FORMAT, e.getKind());
    }

    @Test
    public void testVerify() throws StorageException {
        layout.verify();
        assertEquals(PageType.INDEX_ENTRY_LOG, layout.getPageType());

        StorageException e = assertThrows(StorageException.class, () -> new DataPageLayout(page).verify());
        assertEquals(ErrorKind.PAGE_FORMAT, e.getKind());
    }
}
