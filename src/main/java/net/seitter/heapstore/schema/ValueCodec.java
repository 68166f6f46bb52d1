package net.seitter.heapstore.schema;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Self-describing value encoding: a one-byte kind tag followed by the payload.
 * Used where bytes must be decoded without a schema, such as index entry logs.
 */
public final class ValueCodec {

    private ValueCodec() {
    }

    /**
     * Computes the encoded size of a value.
     *
     * @param value The value
     * @return The number of bytes {@link #write} will produce
     */
    public static int sizeOf(Value value) {
        switch (value.getKind()) {
            case NULL:
                return 1;
            case INT:
            case FLOAT:
                return 5;
            case BIGINT:
            case DOUBLE:
                return 9;
            case TEXT:
            case FIXED_TEXT:
                return 3 + textBytes(value).length;
            default:
                throw new IllegalStateException("Unhandled kind " + value.getKind());
        }
    }

    public static void write(ByteBuffer buffer, Value value) {
        buffer.put((byte) value.getKind().ordinal());
        switch (value.getKind()) {
            case NULL:
                break;
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
            case TEXT:
            case FIXED_TEXT:
                byte[] bytes = textBytes(value);
                buffer.putShort((short) bytes.length);
                buffer.put(bytes);
                break;
            default:
                throw new IllegalStateException("Unhandled kind " + value.getKind());
        }
    }

    /**
     * Reads one value written by {@link #write}.
     *
     * @param buffer The buffer positioned at the tag byte
     * @return The value
     * @throws IllegalArgumentException If the tag is unknown or the buffer ends early
     */
    public static Value read(ByteBuffer buffer) {
        try {
            int tag = buffer.get();
            Value.Kind[] kinds = Value.Kind.values();
            if (tag < 0 || tag >= kinds.length) {
                throw new IllegalArgumentException("Unknown value tag " + tag);
            }
            switch (kinds[tag]) {
                case NULL:
                    return Value.NULL;
                case INT:
                    return Value.ofInt(buffer.getInt());
                case BIGINT:
                    return Value.ofBigInt(buffer.getLong());
                case FLOAT:
                    return Value.ofFloat(buffer.getFloat());
                case DOUBLE:
                    return Value.ofDouble(buffer.getDouble());
                case TEXT:
                case FIXED_TEXT: {
                    byte[] bytes = new byte[buffer.getShort() & 0xFFFF];
                    buffer.get(bytes);
                    String text = new String(bytes, StandardCharsets.UTF_8);
                    return kinds[tag] == Value.Kind.TEXT ? Value.ofText(text) : Value.ofFixedText(text);
                }
                default:
                    throw new IllegalArgumentException("Unknown value tag " + tag);
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Encoded value is truncated", e);
        }
    }

    /**
     * Encodes a key and a row as one entry: the key, a u16 value count, then the values.
     */
    public static byte[] encodeEntry(Value key, Row row) {
        int size = sizeOf(key) + 2;
        for (Value value : row.getValues()) {
            size += sizeOf(value);
        }
        ByteBuffer buffer = ByteBuffer.allocate(size);
        write(buffer, key);
        buffer.putShort((short) row.size());
        for (Value value : row.getValues()) {
            write(buffer, value);
        }
        return buffer.array();
    }

    /**
     * Decodes the row part of an entry whose key has already been read.
     */
    public static Row readRow(ByteBuffer buffer) {
        int count;
        try {
            count = buffer.getShort() & 0xFFFF;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Encoded row is truncated", e);
        }
        List<Value> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(read(buffer));
        }
        return new Row(values);
    }

    private static byte[] textBytes(Value value) {
        byte[] bytes = value.asString().getBytes(StandardCharsets.UTF_8);
        if (bytes.length > 0xFFFF) {
            throw new IllegalArgumentException("Text value is longer than 65535 bytes");
        }
        return bytes;
    }
}
