package net.seitter.heapstore.storage.layout;

import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.StorageException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Abstract base class for page layouts.
 * Provides the fixed-offset header shared by every page kind:
 * <pre>
 * [Page Type (1 byte)]
 * [Magic Number (4 bytes)]
 * [Item Count (4 bytes)]        slots or entries, depending on the page kind
 * [Free Space Offset (4 bytes)]
 * [Reserved (3 bytes)]
 * </pre>
 * A page whose header is all zeroes has been allocated but never formatted.
 */
public abstract class PageLayout {
    public static final int HEADER_SIZE = 16;
    public static final int MAGIC_NUMBER = 0xDADADADA;

    private static final int TYPE_OFFSET = 0;
    private static final int MAGIC_OFFSET = 1;
    private static final int COUNT_OFFSET = 5;
    private static final int FREE_SPACE_OFFSET = 9;

    // the page this layout is working on
    protected final Page page;
    protected final ByteBuffer buffer;

    protected PageLayout(Page page) {
        if (page.getPageSize() <= HEADER_SIZE) {
            throw new IllegalArgumentException("Page size " + page.getPageSize() +
                    " is too small for header size " + HEADER_SIZE);
        }
        this.page = page;
        this.buffer = page.getBuffer();
    }

    /**
     * Formats the page as an empty page of this layout's kind.
     */
    public abstract void initialize();

    /**
     * Gets the page type this layout handles.
     *
     * @return The page type
     */
    protected abstract PageType expectedType();

    /**
     * Writes a fresh header and clears the rest of the page.
     *
     * @param pageType The type of the page
     * @param freeSpaceOffset The initial free space offset
     */
    protected void writeHeader(PageType pageType, int freeSpaceOffset) {
        byte[] data = page.getData();
        Arrays.fill(data, (byte) 0);

        buffer.put(TYPE_OFFSET, (byte) pageType.getTypeId());
        buffer.putInt(MAGIC_OFFSET, MAGIC_NUMBER);
        buffer.putInt(COUNT_OFFSET, 0);
        buffer.putInt(FREE_SPACE_OFFSET, freeSpaceOffset);

        page.markDirty();
    }

    /**
     * Checks whether the page has ever been formatted.
     *
     * @return false if the header is all zeroes
     */
    public boolean isFormatted() {
        for (int i = 0; i < HEADER_SIZE; i++) {
            if (buffer.get(i) != 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads the header and checks it against this layout.
     *
     * @throws StorageException If the magic number, type tag or counters are inconsistent
     */
    public void verify() throws StorageException {
        int magic = buffer.getInt(MAGIC_OFFSET);
        if (magic != MAGIC_NUMBER) {
            throw formatError("Invalid magic number: expected " +
                    String.format("0x%08X", MAGIC_NUMBER) + ", got " + String.format("0x%08X", magic));
        }

        PageType pageType;
        try {
            pageType = PageType.fromTypeId(buffer.get(TYPE_OFFSET) & 0xFF);
        } catch (IllegalArgumentException e) {
            throw formatError(e.getMessage());
        }
        if (pageType != expectedType()) {
            throw formatError("Expected a " + expectedType() + " page, found " + pageType);
        }

        int freeSpaceOffset = getFreeSpaceOffset();
        if (getItemCount() < 0 || freeSpaceOffset < HEADER_SIZE || freeSpaceOffset > page.getPageSize()) {
            throw formatError("Corrupt header: count=" + getItemCount() + ", free space offset=" + freeSpaceOffset);
        }
    }

    /**
     * Gets the page type recorded in the header.
     *
     * @return The page type
     */
    public PageType getPageType() {
        return PageType.fromTypeId(buffer.get(TYPE_OFFSET) & 0xFF);
    }

    protected int getItemCount() {
        return buffer.getInt(COUNT_OFFSET);
    }

    protected void setItemCount(int count) {
        buffer.putInt(COUNT_OFFSET, count);
        page.markDirty();
    }

    public int getFreeSpaceOffset() {
        return buffer.getInt(FREE_SPACE_OFFSET);
    }

    protected void setFreeSpaceOffset(int freeSpaceOffset) {
        buffer.putInt(FREE_SPACE_OFFSET, freeSpaceOffset);
        page.markDirty();
    }

    /**
     * Gets the page associated with this layout.
     *
     * @return The page
     */
    public Page getPage() {
        return page;
    }

    /**
     * Gets the number of contiguous bytes still available.
     *
     * @return The free space in bytes
     */
    public abstract int getFreeSpace();

    protected StorageException formatError(String message) {
        return new StorageException(ErrorKind.PAGE_FORMAT, "Page " + page.getPageId() + ": " + message);
    }
}
