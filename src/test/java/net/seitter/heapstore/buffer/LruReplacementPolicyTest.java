package net.seitter.heapstore.buffer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for the LruReplacementPolicy class.
 */
public class LruReplacementPolicyTest {

    @Test
    public void testEvictsLeastRecentlyUsed() {
        LruReplacementPolicy lru = new LruReplacementPolicy();
        lru.init(1);
        lru.init(2);
        lru.init(3);
        lru.hit(1);

        assertEquals(2, lru.evict(page -> true));
        lru.cleanup(2);
        assertEquals(3, lru.evict(page -> true));
    }

    @Test
    public void testSkipsUnevictablePages() {
        LruReplacementPolicy lru = new LruReplacementPolicy();
        lru.init(1);
        lru.init(2);

        assertEquals(2, lru.evict(page -> page != 1));
        assertEquals(-1, lru.evict(page -> false));
    }

    @Test
    public void testEmptyPolicy() {
        assertEquals(-1, new LruReplacementPolicy().evict(page -> true));
        assertEquals("LRU", new LruReplacementPolicy().getName());
    }
}
