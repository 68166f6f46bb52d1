package net.seitter.heapstore.schema;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for the RowCodec class.
 */
public class RowCodecTest {

    private static final Schema SCHEMA = Schema.of(
            new Column("id", DataType.INT, 0, false),
            new Column("name", DataType.VARCHAR, 20),
            new Column("code", DataType.CHAR, 4),
            new Column("score", DataType.DOUBLE));

    @Test
    public void testFixedWidthLayout() {
        RowCodec codec = new RowCodec(Schema.of(new Column("a", DataType.INT), new Column("b", DataType.BIGINT)));

        byte[] tuple = codec.encode(Row.of(1, 2L));

        // One bitmap byte, then 4 + 8 bytes big-endian
        assertEquals(13, tuple.length);
        assertEquals(0, tuple[0]);
        assertEquals(1, tuple[4]);
        assertEquals(2, tuple[12]);
    }

    @Test
    public void testEncodeDecode() {
        RowCodec codec = new RowCodec(SCHEMA);
        Row row = Row.of(7, "Alice", Value.ofFixedText("AB"), 3.25);

        Row decoded = codec.decode(codec.encode(row));

        assertEquals(row, decoded);
        assertEquals("AB", decoded.get(2).asString(), "CHAR padding is trimmed");
    }

    @Test
    public void testNulls() {
        RowCodec codec = new RowCodec(SCHEMA);
        Row row = Row.of(1, Value.NULL, Value.NULL, Value.NULL);

        byte[] tuple = codec.encode(row);

        assertEquals(1 + 4, tuple.length, "NULL columns take no space");
        assertEquals(0b1110, tuple[0]);
        assertEquals(row, codec.decode(tuple));
    }

    @Test
    public void testNotNullColumn() {
        RowCodec codec = new RowCodec(SCHEMA);
        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of(Value.NULL, "x", "y", 1.0)));
    }

    @Test
    public void testWidening() {
        RowCodec codec = new RowCodec(SCHEMA);

        Row normalized = codec.normalize(Row.of(5L, "n", "c", 2));

        assertEquals(Value.ofInt(5), normalized.get(0));
        assertEquals(Value.ofFixedText("c"), normalized.get(2));
        assertEquals(Value.ofDouble(2.0), normalized.get(3));
    }

    @Test
    public void testNormalizeMatchesStoredCharForm() {
        RowCodec codec = new RowCodec(SCHEMA);
        Row row = Row.of(1, "pad ", "ab  ", 1.0);

        Row normalized = codec.normalize(row);

        assertEquals(Value.ofFixedText("ab"), normalized.get(2));
        assertEquals(Value.ofText("pad "), normalized.get(1), "VARCHAR keeps trailing spaces");
        assertEquals(normalized, codec.decode(codec.encode(row)));
        assertEquals(Value.ofFixedText("ab"), codec.normalize(Row.of(1, "x", "ab      ", 1.0)).get(2),
                "Trailing padding does not count against the CHAR length");
    }

    @Test
    public void testRejectsBadValues() {
        RowCodec codec = new RowCodec(SCHEMA);

        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of(1, "x".repeat(21), "c", 1.0)),
                "VARCHAR length is enforced");
        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of(1, "x", "toolong", 1.0)));
        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of((long) Integer.MAX_VALUE + 1,
                "x", "c", 1.0)), "INT overflow is rejected");
        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of("1", "x", "c", 1.0)));
        assertThrows(IllegalArgumentException.class, () -> codec.encode(Row.of(1, "x")));
    }

    @Test
    public void testTruncatedTuple() {
        RowCodec codec = new RowCodec(SCHEMA);
        byte[] tuple = codec.encode(Row.of(1, "Alice", "AB", 1.0));

        assertThrows(IllegalArgumentException.class, () -> codec.decode(java.util.Arrays.copyOf(tuple, 6)));
    }

    @Test
    public void testSchemaLookup() {
        assertEquals(1, SCHEMA.indexOf("NAME"));
        assertEquals(-1, SCHEMA.indexOf("missing"));
        assertThrows(IllegalArgumentException.class, () -> SCHEMA.getColumn("missing"));
        assertThrows(IllegalArgumentException.class,
                () -> Schema.of(new Column("a", DataType.INT), new Column("A", DataType.INT)));
        assertThrows(IllegalArgumentException.class, () -> new Column("s", DataType.VARCHAR, 0));
    }
}
