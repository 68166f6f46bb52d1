package net.seitter.heapstore.schema;

import java.util.Objects;

/**
 * A single typed column value. Values are immutable and ordered so they can serve
 * as index keys.
 *
 * <p>Ordering: NULL sorts first; two numeric values compare numerically; two text
 * values compare lexicographically; a numeric value compared with a text value
 * compares by string form.
 */
public final class Value implements Comparable<Value> {

    /**
     * The variant a value holds.
     */
    public enum Kind {
        NULL,
        INT,
        BIGINT,
        TEXT,
        FIXED_TEXT,
        FLOAT,
        DOUBLE
    }

    public static final Value NULL = new Value(Kind.NULL, null);

    private final Kind kind;
    private final Object payload;

    private Value(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static Value ofInt(int value) {
        return new Value(Kind.INT, value);
    }

    public static Value ofBigInt(long value) {
        return new Value(Kind.BIGINT, value);
    }

    public static Value ofText(String value) {
        return new Value(Kind.TEXT, Objects.requireNonNull(value, "text"));
    }

    public static Value ofFixedText(String value) {
        return new Value(Kind.FIXED_TEXT, Objects.requireNonNull(value, "text"));
    }

    public static Value ofFloat(float value) {
        return new Value(Kind.FLOAT, value);
    }

    public static Value ofDouble(double value) {
        return new Value(Kind.DOUBLE, value);
    }

    /**
     * Wraps a plain Java object: Integer, Long, String, Float, Double, a Value or null.
     *
     * @param object The object to wrap
     * @return The value
     */
    public static Value of(Object object) {
        if (object == null) {
            return NULL;
        } else if (object instanceof Value) {
            return (Value) object;
        } else if (object instanceof Integer) {
            return ofInt((Integer) object);
        } else if (object instanceof Long) {
            return ofBigInt((Long) object);
        } else if (object instanceof String) {
            return ofText((String) object);
        } else if (object instanceof Float) {
            return ofFloat((Float) object);
        } else if (object instanceof Double) {
            return ofDouble((Double) object);
        }
        throw new IllegalArgumentException("Unsupported value class: " + object.getClass().getName());
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the wrapped Java object (Integer, Long, String, Float, Double) or null.
     *
     * @return The payload
     */
    public Object getPayload() {
        return payload;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.BIGINT || kind == Kind.FLOAT || kind == Kind.DOUBLE;
    }

    public boolean isIntegral() {
        return kind == Kind.INT || kind == Kind.BIGINT;
    }

    public boolean isText() {
        return kind == Kind.TEXT || kind == Kind.FIXED_TEXT;
    }

    public long asLong() {
        requireNumeric();
        return ((Number) payload).longValue();
    }

    public double asDouble() {
        requireNumeric();
        return ((Number) payload).doubleValue();
    }

    public String asString() {
        return isNull() ? null : String.valueOf(payload);
    }

    @Override
    public int compareTo(Value other) {
        if (isNull() || other.isNull()) {
            return Boolean.compare(!isNull(), !other.isNull());
        }
        if (isNumeric() && other.isNumeric()) {
            if (isIntegral() && other.isIntegral()) {
                return Long.compare(asLong(), other.asLong());
            }
            return Double.compare(asDouble(), other.asDouble());
        }
        return asString().compareTo(other.asString());
    }

    private void requireNumeric() {
        if (!isNumeric()) {
            throw new IllegalStateException("Value " + this + " of kind " + kind + " is not numeric");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value value = (Value) o;
        return kind == value.kind && Objects.equals(payload, value.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        if (isNull()) {
            return "NULL";
        }
        return isText() ? "'" + payload + "'" : String.valueOf(payload);
    }
}
