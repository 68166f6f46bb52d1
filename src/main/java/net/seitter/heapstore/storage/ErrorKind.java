package net.seitter.heapstore.storage;

/**
 * Classifies the failures raised by the storage core.
 */
public enum ErrorKind {
    /** Page number beyond the end of the file. */
    OUT_OF_RANGE,
    /** Not enough contiguous space left in a page. */
    PAGE_FULL,
    /** Every frame of a full buffer pool is pinned. */
    POOL_EXHAUSTED,
    /** Header tag, magic number or slot directory does not match the expected layout. */
    PAGE_FORMAT,
    /** The underlying file could not be extended. */
    ALLOCATION
}
