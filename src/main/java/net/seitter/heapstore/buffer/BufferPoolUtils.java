package net.seitter.heapstore.buffer;

import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.PageId;

import java.io.IOException;

/**
 * Helpers that pair every fetch with its unpin, so pages are released on every
 * exit path including exceptions.
 */
public final class BufferPoolUtils {

    private BufferPoolUtils() {
    }

    /**
     * An operation on a pinned page.
     *
     * @param <T> The return type of the operation
     */
    @FunctionalInterface
    public interface PageOperation<T> {
        T execute(Page page) throws IOException;
    }

    /**
     * Fetches a page, runs the operation and unpins the page. The page is reported dirty
     * if {@code markDirty} is set or the operation marked it dirty itself.
     *
     * @param <T> The return type of the operation
     * @param bufferPool The buffer pool to use
     * @param pageId The ID of the page to operate on
     * @param markDirty Whether the operation modifies the page
     * @param operation The operation to perform on the page
     * @return The result of the operation
     * @throws IOException If fetching the page or the operation fails
     */
    public static <T> T withPage(IBufferPoolManager bufferPool, PageId pageId,
                                 boolean markDirty, PageOperation<T> operation) throws IOException {
        Page page = bufferPool.fetchPage(pageId);
        try {
            return operation.execute(page);
        } finally {
            bufferPool.unpinPage(pageId, markDirty || page.isDirty());
        }
    }

    /**
     * Allocates a new page, runs the operation (typically formatting the page) and unpins
     * the page as dirty.
     *
     * @param <T> The return type of the operation
     * @param bufferPool The buffer pool to use
     * @param operation The operation to perform on the new page
     * @return The result of the operation
     * @throws IOException If allocation or the operation fails
     */
    public static <T> T withNewPage(IBufferPoolManager bufferPool, PageOperation<T> operation) throws IOException {
        Page page = bufferPool.allocatePage();
        try {
            return operation.execute(page);
        } finally {
            bufferPool.unpinPage(page.getPageId(), true);
        }
    }
}
