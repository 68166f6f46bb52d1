package net.seitter.heapstore.buffer;

/**
 * Point-in-time snapshot of a buffer pool's counters.
 * Serialized as JSON by the statistics server and the console.
 */
public class BufferPoolStatistics {
    private final String fileName;
    private final String policy;
    private final int capacity;
    private final int size;
    private final int dirtyPages;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long pagesRead;
    private final long pagesWritten;
    private final long allocations;

    public BufferPoolStatistics(String fileName, String policy, int capacity, int size, int dirtyPages,
                                long hits, long misses, long evictions, long pagesRead, long pagesWritten,
                                long allocations) {
        this.fileName = fileName;
        this.policy = policy;
        this.capacity = capacity;
        this.size = size;
        this.dirtyPages = dirtyPages;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.pagesRead = pagesRead;
        this.pagesWritten = pagesWritten;
        this.allocations = allocations;
    }

    public String getFileName() {
        return fileName;
    }

    public String getPolicy() {
        return policy;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getSize() {
        return size;
    }

    public int getDirtyPages() {
        return dirtyPages;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getPagesRead() {
        return pagesRead;
    }

    public long getPagesWritten() {
        return pagesWritten;
    }

    public long getAllocations() {
        return allocations;
    }

    /**
     * Gets the fraction of fetches served from memory.
     *
     * @return hits / (hits + misses), or 0.0 before the first fetch
     */
    public double getHitRate() {
        long accesses = hits + misses;
        return accesses > 0 ? (double) hits / accesses : 0.0;
    }

    @Override
    public String toString() {
        return String.format("%s [%s] %d/%d pages, %d dirty, hits=%d misses=%d evictions=%d read=%d written=%d " +
                        "allocated=%d hitRate=%.2f%%",
                fileName, policy, size, capacity, dirtyPages, hits, misses, evictions, pagesRead, pagesWritten,
                allocations, getHitRate() * 100.0);
    }
}
