package net.seitter.heapstore.btree;

import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Value;
import net.seitter.heapstore.schema.ValueCodec;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * One persisted index record: the key and a full snapshot of the indexed row.
 */
public final class IndexEntry {
    private final Value key;
    private final Row row;

    public IndexEntry(Value key, Row row) {
        this.key = Objects.requireNonNull(key, "key");
        this.row = Objects.requireNonNull(row, "row");
    }

    public Value getKey() {
        return key;
    }

    public Row getRow() {
        return row;
    }

    public byte[] encode() {
        return ValueCodec.encodeEntry(key, row);
    }

    /**
     * Decodes an entry written by {@link #encode()}.
     *
     * @param data The entry bytes
     * @return The entry
     * @throws IllegalArgumentException If the bytes are not a valid entry
     */
    public static IndexEntry decode(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        Value key = ValueCodec.read(buffer);
        Row row = ValueCodec.readRow(buffer);
        if (buffer.hasRemaining()) {
            throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after index entry");
        }
        return new IndexEntry(key, row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexEntry that = (IndexEntry) o;
        return key.equals(that.key) && row.equals(that.row);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, row);
    }

    @Override
    public String toString() {
        return key + " -> " + row;
    }
}
