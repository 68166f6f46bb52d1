package net.seitter.heapstore.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The ordered column list of a table. Column lookup by name is case-insensitive.
 */
public class Schema {
    private final List<Column> columns;
    private final Map<String, Integer> columnIndexes = new HashMap<>();

    @JsonCreator
    public Schema(@JsonProperty("columns") List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("A schema needs at least one column");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        for (int i = 0; i < columns.size(); i++) {
            String key = columns.get(i).getName().toLowerCase(Locale.ROOT);
            if (columnIndexes.put(key, i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + columns.get(i).getName());
            }
        }
    }

    public static Schema of(Column... columns) {
        return new Schema(List.of(columns));
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Finds the position of a column.
     *
     * @param name The column name, in any case
     * @return The column index, or -1 if there is no such column
     */
    public int indexOf(String name) {
        Integer index = columnIndexes.get(name.toLowerCase(Locale.ROOT));
        return index == null ? -1 : index;
    }

    public Column getColumn(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column named " + name);
        }
        return columns.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columns.equals(((Schema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
