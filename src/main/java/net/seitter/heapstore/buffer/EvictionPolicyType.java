package net.seitter.heapstore.buffer;

import java.util.Locale;

/**
 * The replacement policies a buffer pool can be configured with.
 */
public enum EvictionPolicyType {
    LRU,
    CLOCK;

    /**
     * Creates a fresh policy instance for a pool of the given capacity.
     *
     * @param capacity The buffer pool capacity
     * @return The policy
     */
    public ReplacementPolicy create(int capacity) {
        switch (this) {
            case LRU:
                return new LruReplacementPolicy();
            case CLOCK:
                return new ClockReplacementPolicy(capacity);
            default:
                throw new IllegalStateException("Unhandled eviction policy: " + this);
        }
    }

    /**
     * Parses a policy name, ignoring case.
     *
     * @param name The policy name
     * @return The policy type
     */
    public static EvictionPolicyType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown eviction policy: " + name, e);
        }
    }
}
