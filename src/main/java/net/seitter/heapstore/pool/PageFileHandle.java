package net.seitter.heapstore.pool;

import net.seitter.heapstore.buffer.IBufferPoolManager;
import net.seitter.heapstore.storage.PageId;
import net.seitter.heapstore.storage.Pager;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The shared pager and buffer pool of one physical page file, handed out by a
 * {@link HandlePool}. Every holder of the handle sees the same cached pages.
 */
public class PageFileHandle {
    private final Path path;
    private final Pager pager;
    private final IBufferPoolManager bufferPool;
    private int referenceCount;
    private boolean closed;

    PageFileHandle(Path path, Pager pager, IBufferPoolManager bufferPool) {
        this.path = path;
        this.pager = pager;
        this.bufferPool = bufferPool;
    }

    public Path getPath() {
        return path;
    }

    public Pager getPager() {
        return pager;
    }

    public IBufferPoolManager getBufferPool() {
        return bufferPool;
    }

    public String getFileName() {
        return pager.getFileName();
    }

    public int getPageSize() {
        return pager.getPageSize();
    }

    /**
     * Gets the number of pages in the file, derived from its size.
     *
     * @return The page count
     * @throws IOException If the file size cannot be read
     */
    public int getPageCount() throws IOException {
        return pager.getPageCount();
    }

    public PageId pageId(int pageNumber) {
        return pager.pageId(pageNumber);
    }

    public synchronized int getReferenceCount() {
        return referenceCount;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    synchronized void retain() {
        referenceCount++;
    }

    synchronized int releaseReference() {
        return --referenceCount;
    }

    /**
     * Flushes every dirty frame and closes the pool and the file.
     */
    synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            bufferPool.close();
            pager.sync();
        } finally {
            pager.close();
        }
    }

    @Override
    public String toString() {
        return "PageFileHandle{" + path + ", refs=" + referenceCount + "}";
    }
}
