package net.seitter.heapstore.index;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the JsonIndexCatalog class.
 */
public class JsonIndexCatalogTest {

    @TempDir
    Path tempDir;

    private IndexMetadata metadata(String table, String name, String column) {
        return new IndexMetadata(table, name, column, tempDir.resolve(name + ".idx").toString(),
                IndexType.BTREE, false);
    }

    @Test
    public void testRecordsSurviveReload() throws IOException {
        Path file = tempDir.resolve("indexes.json");
        JsonIndexCatalog catalog = new JsonIndexCatalog(file);
        catalog.addIndex(metadata("t", "a", "id"));
        catalog.addIndex(metadata("t", "b", "name"));
        catalog.addIndex(metadata("u", "a", "id"));

        JsonIndexCatalog reloaded = new JsonIndexCatalog(file);

        assertEquals(3, reloaded.listIndexes(null).size());
        assertEquals(2, reloaded.listIndexes("t").size());
        assertEquals(metadata("t", "b", "name"), reloaded.getIndex("t", "b"));
        assertEquals("b", reloaded.listIndexes("t").get(1).getName(), "Creation order is kept");
        assertFalse(Files.exists(tempDir.resolve("indexes.json.tmp")));
    }

    @Test
    public void testDrop() throws IOException {
        Path file = tempDir.resolve("indexes.json");
        JsonIndexCatalog catalog = new JsonIndexCatalog(file);
        catalog.addIndex(metadata("t", "a", "id"));

        assertTrue(catalog.dropIndex("t", "a"));
        assertFalse(catalog.dropIndex("t", "a"));
        assertTrue(new JsonIndexCatalog(file).listIndexes(null).isEmpty());
    }

    @Test
    public void testDuplicateIsRejected() throws IOException {
        JsonIndexCatalog catalog = new JsonIndexCatalog(tempDir.resolve("indexes.json"));
        catalog.addIndex(metadata("t", "a", "id"));

        assertThrows(IllegalStateException.class, () -> catalog.addIndex(metadata("t", "a", "name")));
        assertEquals(1, catalog.listIndexes("t").size());
    }

    @Test
    public void testMissingTypeDefaultsToBtree() throws IOException {
        Path file = tempDir.resolve("indexes.json");
        Files.writeString(file, "[{\"table\":\"t\",\"name\":\"a\",\"column\":\"id\",\"path\":\"a.idx\"}]");

        IndexMetadata loaded = new JsonIndexCatalog(file).getIndex("t", "a");

        assertEquals(IndexType.BTREE, loaded.getType());
        assertFalse(loaded.isUnique());
    }

    @Test
    public void testCorruptFile() throws IOException {
        Path file = tempDir.resolve("indexes.json");
        Files.writeString(file, "{not json");

        assertThrows(IOException.class, () -> new JsonIndexCatalog(file));
    }

    @Test
    public void testInMemoryCatalog() throws IOException {
        IndexCatalog catalog = new InMemoryIndexCatalog();
        catalog.addIndex(metadata("t", "a", "Name"));

        assertEquals("a", catalog.findIndexByColumn("t", "name").getName());
        assertNull(catalog.getIndex("t", "b"));
        assertEquals("BTREE INDEX a ON t(Name) -> " + tempDir.resolve("a.idx"), catalog.getIndex("t", "a").toString());
    }
}
