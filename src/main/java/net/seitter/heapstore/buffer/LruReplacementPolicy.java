package net.seitter.heapstore.buffer;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.function.IntPredicate;

/**
 * Strict least-recently-used replacement. Every fetch moves the page to the
 * most-recent end; the victim is the least recently touched unpinned page.
 */
public class LruReplacementPolicy implements ReplacementPolicy {
    // Iteration order runs from least to most recently used
    private final LinkedHashSet<Integer> recency = new LinkedHashSet<>();

    @Override
    public void init(int pageNumber) {
        recency.remove(pageNumber);
        recency.add(pageNumber);
    }

    @Override
    public void hit(int pageNumber) {
        recency.remove(pageNumber);
        recency.add(pageNumber);
    }

    @Override
    public int evict(IntPredicate evictable) {
        Iterator<Integer> it = recency.iterator();
        while (it.hasNext()) {
            int pageNumber = it.next();
            if (evictable.test(pageNumber)) {
                return pageNumber;
            }
        }
        return -1;
    }

    @Override
    public void cleanup(int pageNumber) {
        recency.remove(pageNumber);
    }

    @Override
    public String getName() {
        return EvictionPolicyType.LRU.name();
    }
}
