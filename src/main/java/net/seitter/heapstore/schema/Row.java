package net.seitter.heapstore.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, ordered sequence of column values.
 */
public final class Row {
    private final List<Value> values;

    public Row(List<Value> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Builds a row from plain Java objects, see {@link Value#of(Object)}.
     *
     * @param objects The column values in schema order
     * @return The row
     */
    public static Row of(Object... objects) {
        List<Value> values = new ArrayList<>(objects.length);
        for (Object object : objects) {
            values.add(Value.of(object));
        }
        return new Row(values);
    }

    public Value get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Value> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values.get(i));
        }
        return sb.append(")").toString();
    }
}
