package net.seitter.heapstore.index;

/**
 * The index structures the registry can build.
 */
public enum IndexType {
    BTREE
}
