package net.seitter.heapstore.storage.layout;

/**
 * Enum representing the kinds of pages stored in page files.
 * The type ID is the tag byte at offset 0 of every formatted page.
 */
public enum PageType {
    UNUSED(0),
    TABLE_DATA(2),
    INDEX_ENTRY_LOG(6);

    private final int typeId;

    PageType(int typeId) {
        this.typeId = typeId;
    }

    public int getTypeId() {
        return typeId;
    }

    public static PageType fromTypeId(int typeId) {
        for (PageType type : values()) {
            if (type.typeId == typeId) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown page type ID: " + typeId);
    }
}
