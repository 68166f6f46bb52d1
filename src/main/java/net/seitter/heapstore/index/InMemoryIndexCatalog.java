package net.seitter.heapstore.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * An index catalog that lives only as long as the process.
 */
public class InMemoryIndexCatalog implements IndexCatalog {
    protected final List<IndexMetadata> indexes = new ArrayList<>();

    @Override
    public synchronized void addIndex(IndexMetadata metadata) throws IOException {
        if (getIndex(metadata.getTable(), metadata.getName()) != null) {
            throw new IllegalStateException("Index '" + metadata.getName() + "' already exists on table '" +
                    metadata.getTable() + "'");
        }
        indexes.add(metadata);
    }

    @Override
    public synchronized boolean dropIndex(String table, String name) throws IOException {
        return indexes.removeIf(metadata -> metadata.getTable().equals(table) && metadata.getName().equals(name));
    }

    @Override
    public synchronized IndexMetadata getIndex(String table, String name) {
        for (IndexMetadata metadata : indexes) {
            if (metadata.getTable().equals(table) && metadata.getName().equals(name)) {
                return metadata;
            }
        }
        return null;
    }

    @Override
    public synchronized List<IndexMetadata> listIndexes(String table) {
        List<IndexMetadata> result = new ArrayList<>();
        for (IndexMetadata metadata : indexes) {
            if (table == null || metadata.getTable().equals(table)) {
                result.add(metadata);
            }
        }
        return result;
    }
}
