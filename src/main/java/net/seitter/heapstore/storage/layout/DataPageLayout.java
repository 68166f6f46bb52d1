package net.seitter.heapstore.storage.layout;

import net.seitter.heapstore.storage.Page;
import net.seitter.heapstore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Slotted layout of a table data page.
 *
 * <p>The slot directory grows from the end of the header towards the back of the page;
 * tuples are packed from the end of the page towards the front. The header's item count
 * is the number of slots and its free space offset is the start of the tuple area.
 * Each slot entry is 8 bytes: [tuple offset (4)] [tuple length (2)] [flags (2)].
 * Deleting a tuple only sets the tombstone flag; the bytes are not reclaimed.
 */
public class DataPageLayout extends PageLayout {
    private static final Logger logger = LoggerFactory.getLogger(DataPageLayout.class);

    public static final int SLOT_SIZE = 8;
    public static final int SLOT_DIRECTORY_START = HEADER_SIZE;

    private static final int FLAG_TOMBSTONE = 1;

    public DataPageLayout(Page page) {
        super(page);
    }

    @Override
    public void initialize() {
        // Tuple area is empty: it starts at the very end of the page
        writeHeader(PageType.TABLE_DATA, page.getPageSize());
        logger.debug("Initialized data page {}", page.getPageId());
    }

    @Override
    protected PageType expectedType() {
        return PageType.TABLE_DATA;
    }

    /**
     * Gets the largest tuple an empty page of the given size can hold.
     *
     * @param pageSize The page size
     * @return The maximum tuple length in bytes
     */
    public static int maxTupleSize(int pageSize) {
        return Math.min(0xFFFF, pageSize - HEADER_SIZE - SLOT_SIZE);
    }

    /**
     * Gets the number of slots, including tombstones.
     *
     * @return The slot count
     */
    public int getSlotCount() {
        return getItemCount();
    }

    /**
     * Inserts a tuple into a new slot.
     *
     * @param tuple The serialized tuple
     * @return The slot number, or -1 if the tuple plus one slot entry does not fit
     */
    public int insertTuple(byte[] tuple) {
        int slotCount = getSlotCount();
        if (tuple.length > 0xFFFF || tuple.length + SLOT_SIZE > getFreeSpace()) {
            logger.debug("Not enough space to add tuple of size {} to page {} - available: {}",
                    tuple.length, page.getPageId(), getFreeSpace());
            return -1;
        }

        int tupleOffset = getFreeSpaceOffset() - tuple.length;
        buffer.put(tupleOffset, tuple);

        writeSlot(slotCount, tupleOffset, tuple.length, 0);
        setItemCount(slotCount + 1);
        setFreeSpaceOffset(tupleOffset);
        return slotCount;
    }

    /**
     * Reads the tuple in a slot.
     *
     * @param slot The slot number
     * @return The tuple bytes, or null if the slot holds a tombstone
     * @throws StorageException If the slot entry points outside the tuple area
     */
    public byte[] getTuple(int slot) throws StorageException {
        checkSlot(slot);
        if (isDeleted(slot)) {
            return null;
        }

        int offset = slotOffset(slot);
        int length = slotLength(slot);
        if (offset < SLOT_DIRECTORY_START + getSlotCount() * SLOT_SIZE || offset + length > page.getPageSize()) {
            throw formatError("Slot " + slot + " points outside the tuple area (offset=" + offset +
                    ", length=" + length + ")");
        }

        byte[] tuple = new byte[length];
        buffer.get(offset, tuple);
        return tuple;
    }

    /**
     * Marks a slot as deleted.
     *
     * @param slot The slot number
     * @return true if the slot was live, false if it already held a tombstone
     */
    public boolean deleteTuple(int slot) {
        checkSlot(slot);
        if (isDeleted(slot)) {
            return false;
        }
        writeSlot(slot, slotOffset(slot), slotLength(slot), slotFlags(slot) | FLAG_TOMBSTONE);
        return true;
    }

    /**
     * Overwrites a live tuple in place if the new encoding is no longer than the old one.
     *
     * @param slot The slot number
     * @param tuple The new serialized tuple
     * @return true if the tuple was overwritten, false if it does not fit the slot
     */
    public boolean updateTuple(int slot, byte[] tuple) {
        checkSlot(slot);
        if (isDeleted(slot)) {
            throw new IllegalArgumentException("Slot " + slot + " of page " + page.getPageId() + " is deleted");
        }
        if (tuple.length > slotLength(slot)) {
            return false;
        }

        int offset = slotOffset(slot);
        buffer.put(offset, tuple);
        writeSlot(slot, offset, tuple.length, slotFlags(slot));
        return true;
    }

    /**
     * Marks every slot of the page as gone by reformatting it.
     */
    public void clear() {
        initialize();
    }

    public boolean isDeleted(int slot) {
        checkSlot(slot);
        return (slotFlags(slot) & FLAG_TOMBSTONE) != 0;
    }

    /**
     * Gets the slot numbers of all live tuples in slot order.
     *
     * @return The live slots
     */
    public List<Integer> getLiveSlots() {
        List<Integer> slots = new ArrayList<>();
        int slotCount = getSlotCount();
        for (int slot = 0; slot < slotCount; slot++) {
            if (!isDeleted(slot)) {
                slots.add(slot);
            }
        }
        return slots;
    }

    public int getLiveTupleCount() {
        return getLiveSlots().size();
    }

    /**
     * Gets the gap between the end of the slot directory and the start of the tuple area.
     *
     * @return The amount of free space in bytes
     */
    @Override
    public int getFreeSpace() {
        int directoryEnd = SLOT_DIRECTORY_START + getSlotCount() * SLOT_SIZE;
        return Math.max(0, getFreeSpaceOffset() - directoryEnd);
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= getSlotCount()) {
            throw new IllegalArgumentException("Slot " + slot + " does not exist in page " + page.getPageId() +
                    " (" + getSlotCount() + " slots)");
        }
    }

    private int slotPosition(int slot) {
        return SLOT_DIRECTORY_START + slot * SLOT_SIZE;
    }

    private int slotOffset(int slot) {
        return buffer.getInt(slotPosition(slot));
    }

    private int slotLength(int slot) {
        return buffer.getShort(slotPosition(slot) + 4) & 0xFFFF;
    }

    private int slotFlags(int slot) {
        return buffer.getShort(slotPosition(slot) + 6) & 0xFFFF;
    }

    private void writeSlot(int slot, int offset, int length, int flags) {
        int position = slotPosition(slot);
        buffer.putInt(position, offset);
        buffer.putShort(position + 4, (short) length);
        buffer.putShort(position + 6, (short) flags);
        page.markDirty();
    }
}
