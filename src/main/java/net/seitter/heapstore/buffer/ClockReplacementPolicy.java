package net.seitter.heapstore.buffer;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Clock (second chance) replacement. Resident pages occupy slots of a fixed ring,
 * each with a reference bit that is set when the page is loaded or fetched. The
 * clock hand sweeps the ring, clearing set bits, and evicts the first unpinned page
 * whose bit is already clear.
 */
public class ClockReplacementPolicy implements ReplacementPolicy {
    private static final int EMPTY = -1;

    private final int[] ring;
    private final boolean[] referenced;
    private final Map<Integer, Integer> slotOfPage = new HashMap<>();
    private int hand;

    /**
     * Creates a clock with one slot per buffer pool frame.
     *
     * @param capacity The buffer pool capacity
     */
    public ClockReplacementPolicy(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.ring = new int[capacity];
        this.referenced = new boolean[capacity];
        Arrays.fill(ring, EMPTY);
    }

    @Override
    public void init(int pageNumber) {
        Integer existing = slotOfPage.get(pageNumber);
        if (existing != null) {
            referenced[existing] = true;
            return;
        }
        // First free slot at or after the hand
        for (int i = 0; i < ring.length; i++) {
            int slot = (hand + i) % ring.length;
            if (ring[slot] == EMPTY) {
                ring[slot] = pageNumber;
                referenced[slot] = true;
                slotOfPage.put(pageNumber, slot);
                return;
            }
        }
        throw new IllegalStateException("Clock ring is full, cannot place page " + pageNumber);
    }

    @Override
    public void hit(int pageNumber) {
        Integer slot = slotOfPage.get(pageNumber);
        if (slot != null) {
            referenced[slot] = true;
        }
    }

    @Override
    public int evict(IntPredicate evictable) {
        // Two full turns: the first may only clear reference bits
        for (int step = 0; step < 2 * ring.length; step++) {
            int slot = hand;
            hand = (hand + 1) % ring.length;

            int pageNumber = ring[slot];
            if (pageNumber == EMPTY || !evictable.test(pageNumber)) {
                continue;
            }
            if (referenced[slot]) {
                referenced[slot] = false;
                continue;
            }
            return pageNumber;
        }
        return -1;
    }

    @Override
    public void cleanup(int pageNumber) {
        Integer slot = slotOfPage.remove(pageNumber);
        if (slot != null) {
            ring[slot] = EMPTY;
            referenced[slot] = false;
        }
    }

    @Override
    public String getName() {
        return EvictionPolicyType.CLOCK.name();
    }
}
