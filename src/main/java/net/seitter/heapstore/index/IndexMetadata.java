package net.seitter.heapstore.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The catalog record of one index.
 */
public class IndexMetadata {
    private final String table;
    private final String name;
    private final String column;
    private final String path;
    private final IndexType type;
    private final boolean unique;

    /**
     * Creates an index record.
     *
     * @param table The indexed table
     * @param name The index name, unique within the table
     * @param column The indexed column
     * @param path The path of the index page file
     * @param type The index structure
     * @param unique Whether the index was declared unique; recorded only, not enforced
     */
    @JsonCreator
    public IndexMetadata(@JsonProperty("table") String table,
                         @JsonProperty("name") String name,
                         @JsonProperty("column") String column,
                         @JsonProperty("path") String path,
                         @JsonProperty("type") IndexType type,
                         @JsonProperty("unique") boolean unique) {
        this.table = Objects.requireNonNull(table, "table");
        this.name = Objects.requireNonNull(name, "name");
        this.column = Objects.requireNonNull(column, "column");
        this.path = Objects.requireNonNull(path, "path");
        this.type = type == null ? IndexType.BTREE : type;
        this.unique = unique;
    }

    public String getTable() {
        return table;
    }

    public String getName() {
        return name;
    }

    public String getColumn() {
        return column;
    }

    public String getPath() {
        return path;
    }

    public IndexType getType() {
        return type;
    }

    public boolean isUnique() {
        return unique;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexMetadata that = (IndexMetadata) o;
        return unique == that.unique && table.equals(that.table) && name.equals(that.name) &&
                column.equals(that.column) && path.equals(that.path) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, name, column, path, type, unique);
    }

    @Override
    public String toString() {
        return (unique ? "UNIQUE " : "") + type + " INDEX " + name + " ON " + table + "(" + column + ") -> " + path;
    }
}
