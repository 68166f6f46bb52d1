package net.seitter.heapstore.schema;

import java.util.Locale;

/**
 * Represents the column types the storage engine can encode.
 */
public enum DataType {
    INT(4),
    BIGINT(8),
    VARCHAR(-1),
    CHAR(-1),
    FLOAT(4),
    DOUBLE(8);

    private final int fixedSize;

    DataType(int fixedSize) {
        this.fixedSize = fixedSize;
    }

    /**
     * Gets the encoded size of a non-null value, or -1 if it depends on the column length.
     *
     * @return The size in bytes
     */
    public int getFixedSize() {
        return fixedSize;
    }

    /**
     * Checks whether columns of this type need a declared length.
     *
     * @return true for VARCHAR and CHAR
     */
    public boolean hasLength() {
        return this == VARCHAR || this == CHAR;
    }

    public boolean isNumeric() {
        return this == INT || this == BIGINT || this == FLOAT || this == DOUBLE;
    }

    /**
     * Converts an SQL type name to the corresponding DataType.
     *
     * @param sqlType The SQL type name, without a length suffix
     * @return The corresponding DataType
     */
    public static DataType fromSqlType(String sqlType) {
        String upperType = sqlType.trim().toUpperCase(Locale.ROOT);
        switch (upperType) {
            case "INT":
            case "INTEGER":
                return INT;
            case "BIGINT":
                return BIGINT;
            case "VARCHAR":
            case "TEXT":
            case "STRING":
                return VARCHAR;
            case "CHAR":
                return CHAR;
            case "FLOAT":
            case "REAL":
                return FLOAT;
            case "DOUBLE":
                return DOUBLE;
            default:
                throw new IllegalArgumentException("Unsupported SQL type: " + sqlType);
        }
    }
}
