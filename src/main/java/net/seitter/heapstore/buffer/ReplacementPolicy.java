package net.seitter.heapstore.buffer;

import java.util.function.IntPredicate;

/**
 * Strategy deciding which resident page a full buffer pool gives up. Implementations
 * only see page numbers; pin state is supplied by the pool at eviction time.
 * Given the same sequence of calls, an implementation must always choose the same victims.
 */
public interface ReplacementPolicy {
    /**
     * Called when a page becomes resident (after a miss or an allocation).
     *
     * @param pageNumber The page number
     */
    void init(int pageNumber);

    /**
     * Called when a resident page is fetched again.
     *
     * @param pageNumber The page number
     */
    void hit(int pageNumber);

    /**
     * Chooses the page to evict. The policy must not forget the page yet; the pool
     * calls {@link #cleanup(int)} once the page is actually gone.
     *
     * @param evictable Tells whether a page may be evicted (it is not pinned)
     * @return The victim's page number, or -1 if no resident page is evictable
     */
    int evict(IntPredicate evictable);

    /**
     * Called when a page leaves the pool.
     *
     * @param pageNumber The page number
     */
    void cleanup(int pageNumber);

    /**
     * Gets the policy name shown in statistics.
     *
     * @return The policy name
     */
    String getName();
}
