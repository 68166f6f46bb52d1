package net.seitter.heapstore.table;

import net.seitter.heapstore.schema.Row;

/**
 * A row together with the location it was read from.
 */
public final class TableRecord {
    private final RecordId recordId;
    private final Row row;

    public TableRecord(RecordId recordId, Row row) {
        this.recordId = recordId;
        this.row = row;
    }

    public RecordId getRecordId() {
        return recordId;
    }

    public Row getRow() {
        return row;
    }

    @Override
    public String toString() {
        return recordId + " " + row;
    }
}
