package net.seitter.heapstore.table;

import java.util.Objects;

/**
 * The physical location of a tuple: a page number within the table file and a slot
 * within that page. Locations change when an update moves a row.
 */
public final class RecordId implements Comparable<RecordId> {
    private final int pageNumber;
    private final int slot;

    public RecordId(int pageNumber, int slot) {
        this.pageNumber = pageNumber;
        this.slot = slot;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public int getSlot() {
        return slot;
    }

    @Override
    public int compareTo(RecordId other) {
        int result = Integer.compare(pageNumber, other.pageNumber);
        return result != 0 ? result : Integer.compare(slot, other.slot);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return pageNumber == recordId.pageNumber && slot == recordId.slot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageNumber, slot);
    }

    @Override
    public String toString() {
        return "(" + pageNumber + "," + slot + ")";
    }
}
