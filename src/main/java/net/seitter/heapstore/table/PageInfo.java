package net.seitter.heapstore.table;

/**
 * Occupancy of one data page, for inspection.
 */
public class PageInfo {
    private final int pageNumber;
    private final boolean formatted;
    private final int slotCount;
    private final int liveTuples;
    private final int freeSpace;

    public PageInfo(int pageNumber, boolean formatted, int slotCount, int liveTuples, int freeSpace) {
        this.pageNumber = pageNumber;
        this.formatted = formatted;
        this.slotCount = slotCount;
        this.liveTuples = liveTuples;
        this.freeSpace = freeSpace;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public boolean isFormatted() {
        return formatted;
    }

    public int getSlotCount() {
        return slotCount;
    }

    public int getLiveTuples() {
        return liveTuples;
    }

    /**
     * Gets the contiguous free space between the slot directory and the tuples.
     */
    public int getFreeSpace() {
        return freeSpace;
    }

    public int getTombstones() {
        return slotCount - liveTuples;
    }

    @Override
    public String toString() {
        return "page " + pageNumber + ": " + liveTuples + " live / " + slotCount + " slots, " +
                freeSpace + " bytes free";
    }
}
