package net.seitter.heapstore.schema;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes rows of one schema into the tuple bytes stored on data pages.
 *
 * <p>Layout: a null bitmap of {@code ceil(columns / 8)} bytes (bit set means NULL),
 * followed by every non-null value in column order. INT and FLOAT take 4 bytes, BIGINT
 * and DOUBLE 8 bytes, VARCHAR a u16 byte length plus UTF-8 bytes, CHAR(n) exactly n
 * bytes padded with spaces. Multi-byte numbers are big-endian.
 */
public class RowCodec {
    private static final byte PAD = ' ';

    private final Schema schema;
    private final int bitmapSize;

    public RowCodec(Schema schema) {
        this.schema = schema;
        this.bitmapSize = (schema.size() + 7) / 8;
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Validates a row against the schema and converts each value to its column's kind.
     *
     * @param row The row to check
     * @return The row with canonical values
     * @throws IllegalArgumentException If the row does not match the schema
     */
    public Row normalize(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("Row must not be null");
        }
        if (row.size() != schema.size()) {
            throw new IllegalArgumentException("Row has " + row.size() + " values, schema has " +
                    schema.size() + " columns");
        }
        List<Value> values = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            values.add(schema.getColumn(i).coerce(row.get(i)));
        }
        return new Row(values);
    }

    /**
     * Serializes a row.
     *
     * @param row The row to encode
     * @return The tuple bytes
     * @throws IllegalArgumentException If the row does not match the schema
     */
    public byte[] encode(Row row) {
        Row normalized = normalize(row);
        byte[][] texts = new byte[schema.size()][];
        int size = bitmapSize;

        for (int i = 0; i < schema.size(); i++) {
            Value value = normalized.get(i);
            if (value.isNull()) {
                continue;
            }
            Column column = schema.getColumn(i);
            switch (column.getDataType()) {
                case VARCHAR:
                    texts[i] = value.asString().getBytes(StandardCharsets.UTF_8);
                    if (texts[i].length > 0xFFFF) {
                        throw new IllegalArgumentException("Encoded value for column " + column.getName() +
                                " is longer than 65535 bytes");
                    }
                    size += 2 + texts[i].length;
                    break;
                case CHAR:
                    texts[i] = value.asString().getBytes(StandardCharsets.UTF_8);
                    if (texts[i].length > column.getLength()) {
                        throw new IllegalArgumentException("Encoded value for column " + column.getName() +
                                " is longer than " + column.getLength() + " bytes");
                    }
                    size += column.getLength();
                    break;
                default:
                    size += column.getDataType().getFixedSize();
                    break;
            }
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        byte[] bitmap = new byte[bitmapSize];
        for (int i = 0; i < schema.size(); i++) {
            if (normalized.get(i).isNull()) {
                bitmap[i / 8] |= (byte) (1 << (i % 8));
            }
        }
        buffer.put(bitmap);

        for (int i = 0; i < schema.size(); i++) {
            Value value = normalized.get(i);
            if (value.isNull()) {
                continue;
            }
            Column column = schema.getColumn(i);
            switch (column.getDataType()) {
                case INT:
                    buffer.putInt((Integer) value.getPayload());
                    break;
                case BIGINT:
                    buffer.putLong((Long) value.getPayload());
                    break;
                case FLOAT:
                    buffer.putFloat((Float) value.getPayload());
                    break;
                case DOUBLE:
                    buffer.putDouble((Double) value.getPayload());
                    break;
                case VARCHAR:
                    buffer.putShort((short) texts[i].length);
                    buffer.put(texts[i]);
                    break;
                case CHAR:
                    byte[] padded = Arrays.copyOf(texts[i], column.getLength());
                    Arrays.fill(padded, texts[i].length, padded.length, PAD);
                    buffer.put(padded);
                    break;
                default:
                    throw new IllegalStateException("Unhandled data type " + column.getDataType());
            }
        }
        return buffer.array();
    }

    /**
     * Deserializes tuple bytes written by {@link #encode(Row)}.
     *
     * @param data The tuple bytes
     * @return The decoded row
     * @throws IllegalArgumentException If the bytes are too short for the schema
     */
    public Row decode(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        try {
            byte[] bitmap = new byte[bitmapSize];
            buffer.get(bitmap);

            List<Value> values = new ArrayList<>(schema.size());
            for (int i = 0; i < schema.size(); i++) {
                if ((bitmap[i / 8] & (1 << (i % 8))) != 0) {
                    values.add(Value.NULL);
                    continue;
                }
                Column column = schema.getColumn(i);
                switch (column.getDataType()) {
                    case INT:
                        values.add(Value.ofInt(buffer.getInt()));
                        break;
                    case BIGINT:
                        values.add(Value.ofBigInt(buffer.getLong()));
                        break;
                    case FLOAT:
                        values.add(Value.ofFloat(buffer.getFloat()));
                        break;
                    case DOUBLE:
                        values.add(Value.ofDouble(buffer.getDouble()));
                        break;
                    case VARCHAR: {
                        byte[] bytes = new byte[buffer.getShort() & 0xFFFF];
                        buffer.get(bytes);
                        values.add(Value.ofText(new String(bytes, StandardCharsets.UTF_8)));
                        break;
                    }
                    case CHAR: {
                        byte[] bytes = new byte[column.getLength()];
                        buffer.get(bytes);
                        int end = bytes.length;
                        while (end > 0 && bytes[end - 1] == PAD) {
                            end--;
                        }
                        values.add(Value.ofFixedText(new String(bytes, 0, end, StandardCharsets.UTF_8)));
                        break;
                    }
                    default:
                        throw new IllegalStateException("Unhandled data type " + column.getDataType());
                }
            }
            return new Row(values);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Tuple of " + data.length + " bytes is too short for schema " +
                    schema, e);
        }
    }
}
