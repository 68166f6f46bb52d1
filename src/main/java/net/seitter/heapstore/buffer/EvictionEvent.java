package net.seitter.heapstore.buffer;

import java.time.Instant;

/**
 * One entry of a buffer pool's eviction log.
 */
public class EvictionEvent {
    private final long sequence;
    private final String fileName;
    private final int pageNumber;
    private final boolean dirty;
    private final Instant timestamp;

    /**
     * Creates an eviction log entry.
     *
     * @param sequence The position of the eviction within the pool's lifetime, starting at 1
     * @param fileName The page file the page belongs to
     * @param pageNumber The evicted page number
     * @param dirty Whether the eviction required a write-back
     * @param timestamp When the eviction happened
     */
    public EvictionEvent(long sequence, String fileName, int pageNumber, boolean dirty, Instant timestamp) {
        this.sequence = sequence;
        this.fileName = fileName;
        this.pageNumber = pageNumber;
        this.dirty = dirty;
        this.timestamp = timestamp;
    }

    public long getSequence() {
        return sequence;
    }

    public String getFileName() {
        return fileName;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public boolean isDirty() {
        return dirty;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + fileName + ":" + pageNumber + (dirty ? " (written back)" : "");
    }
}
