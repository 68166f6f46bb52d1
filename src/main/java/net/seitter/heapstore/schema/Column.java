package net.seitter.heapstore.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Represents a column in a table schema.
 */
public class Column {
    private final String name;
    private final DataType dataType;
    private final int length;
    private final boolean nullable;

    /**
     * Creates a new column.
     *
     * @param name The name of the column
     * @param dataType The data type of the column
     * @param length The maximum length in characters (VARCHAR/CHAR only, ignored otherwise)
     * @param nullable Whether the column accepts NULL
     */
    @JsonCreator
    public Column(@JsonProperty("name") String name,
                  @JsonProperty("dataType") DataType dataType,
                  @JsonProperty("length") int length,
                  @JsonProperty("nullable") boolean nullable) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        this.name = name;
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        if (dataType.hasLength()) {
            if (length <= 0 || length > 0xFFFF) {
                throw new IllegalArgumentException("Column " + name + " of type " + dataType +
                        " needs a length between 1 and 65535, got " + length);
            }
            this.length = length;
        } else {
            this.length = 0;
        }
        this.nullable = nullable;
    }

    /**
     * Creates a nullable column of a type without a length.
     */
    public Column(String name, DataType dataType) {
        this(name, dataType, 0, true);
    }

    /**
     * Creates a nullable column with a length.
     */
    public Column(String name, DataType dataType, int length) {
        this(name, dataType, length, true);
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public int getLength() {
        return length;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * Converts a value to the canonical kind stored for this column, widening numbers
     * where no precision is lost. CHAR values lose their trailing spaces, matching the
     * form read back from a padded tuple.
     *
     * @param value The value to convert
     * @return The converted value
     * @throws IllegalArgumentException If the value does not fit the column
     */
    public Value coerce(Value value) {
        if (value == null || value.isNull()) {
            if (!nullable) {
                throw new IllegalArgumentException("Column " + name + " does not accept NULL");
            }
            return Value.NULL;
        }

        switch (dataType) {
            case INT:
                if (value.isIntegral()) {
                    long l = value.asLong();
                    if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                        return value.getKind() == Value.Kind.INT ? value : Value.ofInt((int) l);
                    }
                }
                break;
            case BIGINT:
                if (value.isIntegral()) {
                    return value.getKind() == Value.Kind.BIGINT ? value : Value.ofBigInt(value.asLong());
                }
                break;
            case FLOAT:
                if (value.isNumeric()) {
                    return value.getKind() == Value.Kind.FLOAT ? value : Value.ofFloat((float) value.asDouble());
                }
                break;
            case DOUBLE:
                if (value.isNumeric()) {
                    return value.getKind() == Value.Kind.DOUBLE ? value : Value.ofDouble(value.asDouble());
                }
                break;
            case VARCHAR:
            case CHAR:
                if (value.isText()) {
                    String text = value.asString();
                    if (dataType == DataType.CHAR) {
                        text = stripPadding(text);
                    }
                    if (text.length() > length) {
                        throw new IllegalArgumentException("Value for column " + name + " exceeds " +
                                dataType + "(" + length + "): " + text.length() + " characters");
                    }
                    return dataType == DataType.VARCHAR ? Value.ofText(text) : Value.ofFixedText(text);
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Value " + value + " of kind " + value.getKind() +
                " does not fit column " + this);
    }

    private static String stripPadding(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ' ') {
            end--;
        }
        return text.substring(0, end);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" ").append(dataType);
        if (dataType.hasLength()) {
            sb.append("(").append(length).append(")");
        }
        if (!nullable) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Column column = (Column) o;
        return length == column.length && nullable == column.nullable &&
                name.equals(column.name) && dataType == column.dataType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, length, nullable);
    }
}
