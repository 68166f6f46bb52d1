package net.seitter.heapstore.index;

import java.io.IOException;
import java.util.List;

/**
 * The metadata store that records which indexes exist.
 * Implementations only keep records; they never touch index files.
 */
public interface IndexCatalog {

    /**
     * Records a new index.
     *
     * @param metadata The index record
     * @throws IOException If the record cannot be persisted
     * @throws IllegalStateException If the table already has an index of that name
     */
    void addIndex(IndexMetadata metadata) throws IOException;

    /**
     * Removes an index record.
     *
     * @param table The table name
     * @param name The index name
     * @return true if a record was removed
     * @throws IOException If the change cannot be persisted
     */
    boolean dropIndex(String table, String name) throws IOException;

    /**
     * Gets an index record.
     *
     * @param table The table name
     * @param name The index name
     * @return The record, or null if there is none
     */
    IndexMetadata getIndex(String table, String name);

    /**
     * Lists index records in creation order.
     *
     * @param table The table name, or null for the indexes of every table
     * @return The records
     */
    List<IndexMetadata> listIndexes(String table);

    /**
     * Finds the first index on a column, comparing column names case-insensitively.
     *
     * @param table The table name
     * @param column The column name
     * @return The record, or null if the column has no index
     */
    default IndexMetadata findIndexByColumn(String table, String column) {
        for (IndexMetadata metadata : listIndexes(table)) {
            if (metadata.getColumn().equalsIgnoreCase(column)) {
                return metadata;
            }
        }
        return null;
    }
}
