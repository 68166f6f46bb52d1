package net.seitter.heapstore.buffer;

import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.PageId;
import net.seitter.heapstore.storage.Pager;
import net.seitter.heapstore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manages a buffer pool for a single page file.
 * The buffer pool caches pages in memory to reduce disk I/O and never holds more
 * than {@code capacity} pages at once.
 */
public class BufferPoolManager implements IBufferPoolManager {
    private static final Logger logger = LoggerFactory.getLogger(BufferPoolManager.class);

    private final Pager pager;
    private final int capacity;
    private final ReplacementPolicy policy;
    private final Map<Integer, Page> pageTable;
    private final boolean evictionLogEnabled;
    private final List<EvictionEvent> evictionLog = new ArrayList<>();

    // Statistics counters
    private final AtomicLong pageHits = new AtomicLong(0);
    private final AtomicLong pageMisses = new AtomicLong(0);
    private final AtomicLong pageEvictions = new AtomicLong(0);
    private final AtomicLong pagesRead = new AtomicLong(0);
    private final AtomicLong pagesWritten = new AtomicLong(0);
    private final AtomicLong pageAllocations = new AtomicLong(0);

    /**
     * Creates a buffer pool with strict LRU replacement and no eviction log.
     *
     * @param pager The pager of the file this pool serves
     * @param capacity The maximum number of resident pages
     */
    public BufferPoolManager(Pager pager, int capacity) {
        this(pager, capacity, EvictionPolicyType.LRU.create(capacity), false);
    }

    /**
     * Creates a new buffer pool manager.
     *
     * @param pager The pager of the file this pool serves
     * @param capacity The maximum number of resident pages
     * @param policy The replacement policy
     * @param evictionLogEnabled Whether every eviction is recorded in the eviction log
     */
    public BufferPoolManager(Pager pager, int capacity, ReplacementPolicy policy, boolean evictionLogEnabled) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer pool capacity must be positive: " + capacity);
        }
        this.pager = pager;
        this.capacity = capacity;
        this.policy = policy;
        this.pageTable = new HashMap<>(capacity);
        this.evictionLogEnabled = evictionLogEnabled;

        logger.info("Buffer pool for '{}' initialized with capacity: {} pages, policy: {}",
                pager.getFileName(), capacity, policy.getName());
    }

    @Override
    public synchronized Page fetchPage(PageId pageId) throws IOException {
        int pageNumber = checkOwnership(pageId);

        // Check if the page is already in the buffer pool
        Page page = pageTable.get(pageNumber);
        if (page != null) {
            policy.hit(pageNumber);
            page.pin();
            pageHits.incrementAndGet();

            logger.debug("Page {} hit in buffer pool", pageId);
            return page;
        }

        // Reject unallocated pages before giving up a frame for them
        int pageCount = pager.getPageCount();
        if (pageNumber < 0 || pageNumber >= pageCount) {
            throw new StorageException(ErrorKind.OUT_OF_RANGE, "Page " + pageId +
                    " is out of range (" + pageCount + " pages)");
        }

        if (pageTable.size() >= capacity) {
            evictPage();
        }

        byte[] data = pager.readPage(pageNumber);
        pagesRead.incrementAndGet();

        page = new Page(pageId, data);
        install(page);
        pageMisses.incrementAndGet();

        logger.debug("Page {} loaded from disk to buffer pool", pageId);
        return page;
    }

    @Override
    public synchronized void unpinPage(PageId pageId, boolean isDirty) {
        Page page = pageTable.get(pageId.getPageNumber());
        if (page == null || !page.getPageId().equals(pageId)) {
            logger.warn("Attempted to unpin page {} that is not in the buffer pool", pageId);
            return;
        }

        if (isDirty) {
            page.markDirty();
        }

        if (!page.unpin()) {
            logger.warn("Attempted to unpin page {} with pin count already at 0", pageId);
        }
    }

    @Override
    public synchronized boolean flushPage(PageId pageId) throws IOException {
        int pageNumber = checkOwnership(pageId);
        Page page = pageTable.get(pageNumber);
        if (page == null) {
            logger.warn("Attempted to flush page {} that is not in the buffer pool", pageId);
            return false;
        }

        if (page.isDirty()) {
            writeBack(page);
            logger.debug("Flushed dirty page {} to disk", pageId);
            return true;
        }
        return false;
    }

    @Override
    public synchronized Page allocatePage() throws IOException {
        // Make room first so a pinned-full pool does not grow the file
        if (pageTable.size() >= capacity) {
            evictPage();
        }

        int pageNumber = pager.allocatePage();
        Page page = new Page(pager.pageId(pageNumber), pager.getPageSize());
        install(page);
        pageAllocations.incrementAndGet();

        logger.debug("Allocated new page {} and added to buffer pool", page.getPageId());
        return page;
    }

    /**
     * Evicts the page chosen by the replacement policy, writing it back first if it is dirty.
     *
     * @throws IOException If every frame is pinned or the write-back fails
     */
    private void evictPage() throws IOException {
        int victimNumber = policy.evict(pageNumber -> !pageTable.get(pageNumber).isPinned());
        if (victimNumber < 0) {
            throw new StorageException(ErrorKind.POOL_EXHAUSTED, "Cannot evict any page from the buffer pool of '" +
                    pager.getFileName() + "': all " + pageTable.size() + " frames are pinned");
        }

        Page victim = pageTable.get(victimNumber);
        boolean dirty = victim.isDirty();
        if (dirty) {
            // The page stays resident if the write-back fails
            writeBack(victim);
        }

        pageTable.remove(victimNumber);
        policy.cleanup(victimNumber);
        long sequence = pageEvictions.incrementAndGet();

        if (evictionLogEnabled) {
            evictionLog.add(new EvictionEvent(sequence, pager.getFileName(), victimNumber, dirty, Instant.now()));
        }
        logger.debug("Evicted {} page {}", dirty ? "dirty" : "clean", victim.getPageId());
    }

    @Override
    public synchronized void flushAll() throws IOException {
        int flushed = 0;
        for (Page page : pageTable.values()) {
            if (page.isDirty()) {
                writeBack(page);
                flushed++;
            }
        }
        logger.debug("Flushed {} dirty pages of '{}'", flushed, pager.getFileName());
    }

    @Override
    public synchronized boolean contains(PageId pageId) {
        Page page = pageTable.get(pageId.getPageNumber());
        return page != null && page.getPageId().equals(pageId);
    }

    @Override
    public synchronized int getSize() {
        return pageTable.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public String getFileName() {
        return pager.getFileName();
    }

    @Override
    public synchronized int getDirtyPageCount() {
        int dirty = 0;
        for (Page page : pageTable.values()) {
            if (page.isDirty()) {
                dirty++;
            }
        }
        return dirty;
    }

    @Override
    public synchronized BufferPoolStatistics getStatistics() {
        return new BufferPoolStatistics(pager.getFileName(), policy.getName(), capacity, pageTable.size(),
                getDirtyPageCount(), pageHits.get(), pageMisses.get(), pageEvictions.get(),
                pagesRead.get(), pagesWritten.get(), pageAllocations.get());
    }

    @Override
    public synchronized List<EvictionEvent> getEvictionLog() {
        return new ArrayList<>(evictionLog);
    }

    @Override
    public synchronized void resetStatistics() {
        pageHits.set(0);
        pageMisses.set(0);
        pageEvictions.set(0);
        pagesRead.set(0);
        pagesWritten.set(0);
        pageAllocations.set(0);
        evictionLog.clear();
    }

    @Override
    public synchronized void close() throws IOException {
        flushAll();

        for (Page page : pageTable.values()) {
            if (page.isPinned()) {
                logger.warn("Closing buffer pool of '{}' while page {} is still pinned ({} pins)",
                        pager.getFileName(), page.getPageId(), page.getPinCount());
            }
            policy.cleanup(page.getPageNumber());
        }
        pageTable.clear();

        logger.info("Buffer pool for '{}' closed", pager.getFileName());
    }

    private void install(Page page) {
        pageTable.put(page.getPageNumber(), page);
        policy.init(page.getPageNumber());
        page.pin();
    }

    private void writeBack(Page page) throws IOException {
        pager.writePage(page.getPageNumber(), page.getData());
        page.markClean();
        pagesWritten.incrementAndGet();
    }

    private int checkOwnership(PageId pageId) {
        if (!pageId.getFileName().equals(pager.getFileName())) {
            throw new IllegalArgumentException("Page ID belongs to file '" +
                    pageId.getFileName() + "', not '" + pager.getFileName() + "'");
        }
        return pageId.getPageNumber();
    }
}
