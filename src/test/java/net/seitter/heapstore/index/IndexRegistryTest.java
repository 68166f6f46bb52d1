package net.seitter.heapstore.index;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.seitter.heapstore.StorageConfig;
import net.seitter.heapstore.StorageEngine;
import net.seitter.heapstore.btree.BPlusTreeIndex;
import net.seitter.heapstore.schema.Column;
import net.seitter.heapstore.schema.DataType;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Schema;
import net.seitter.heapstore.schema.Value;

/**
 * Tests for the IndexRegistry class.
 */
public class IndexRegistryTest {

    @TempDir
    Path tempDir;

    private static final Schema SCHEMA = Schema.of(
            new Column("id", DataType.INT),
            new Column("name", DataType.VARCHAR, 32));

    private StorageConfig config;
    private StorageEngine engine;
    private IndexRegistry registry;

    @BeforeEach
    public void setUp() throws IOException {
        config = StorageConfig.builder().dataDir(tempDir).btreeOrder(4).build();
        engine = new StorageEngine(config);
        registry = engine.getIndexRegistry();

        engine.createTable("t", SCHEMA);
        engine.insert("t", Row.of(1, "A"));
        engine.insert("t", Row.of(3, "B"));
        engine.insert("t", Row.of(3, "C"));
    }

    @AfterEach
    public void tearDown() throws IOException {
        engine.shutdown();
    }

    @Test
    public void testCreateAndFind() throws IOException {
        IndexMetadata metadata = registry.createIndex("t", "id", "by_id");

        assertEquals(tempDir.resolve("__idx__t__by_id.idx").toString(), metadata.getPath());
        assertTrue(Files.exists(tempDir.resolve("__idx__t__by_id.idx")));
        assertTrue(registry.isLoaded("t", "by_id"));

        BPlusTreeIndex index = registry.load("t", "by_id");
        assertEquals(List.of(Row.of(3, "B"), Row.of(3, "C")), index.find(Value.ofInt(3)));
        assertEquals(List.of(Row.of(1, "A")), index.find(Value.ofInt(1)));
        assertTrue(index.find(Value.ofInt(2)).isEmpty());
        assertEquals(3, index.getPersistedEntryCount());
    }

    @Test
    public void testMarkUnloadedRebuildsFromDisk() throws IOException {
        registry.createIndex("t", "id", "by_id");
        registry.markUnloaded("t", "by_id");

        assertFalse(registry.isLoaded("t", "by_id"));
        assertEquals(2, registry.load("t", "by_id").find(Value.ofInt(3)).size());
        assertTrue(registry.isLoaded("t", "by_id"));
    }

    @Test
    public void testDropKeepsFileAndBlocksRecreate() throws IOException {
        registry.createIndex("t", "id", "by_id");
        Path file = registry.indexPath("t", "by_id");

        assertTrue(registry.dropIndex("t", "by_id"));
        assertFalse(registry.dropIndex("t", "by_id"));
        assertTrue(Files.exists(file), "A dropped index leaves its file behind");
        assertTrue(registry.listIndexes("t").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.load("t", "by_id"));

        assertThrows(IllegalStateException.class, () -> registry.createIndex("t", "id", "by_id"),
                "An orphaned file blocks an index of the same name");

        Files.delete(file);
        registry.createIndex("t", "id", "by_id");
        assertEquals(3, registry.load("t", "by_id").size());
    }

    @Test
    public void testDropWithFileDeletion() throws IOException {
        registry.createIndex("t", "name", "by_name");
        Path file = registry.indexPath("t", "by_name");

        assertTrue(registry.dropIndex("t", "by_name", true));
        assertFalse(Files.exists(file));
        assertFalse(engine.getHandlePool().isOpen(file));
    }

    @Test
    public void testDuplicateIndex() throws IOException {
        registry.createIndex("t", "id", "by_id");
        assertThrows(IllegalStateException.class, () -> registry.createIndex("t", "name", "by_id"));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> registry.createIndex("missing", "id", "i"));
        assertThrows(IllegalArgumentException.class, () -> registry.createIndex("t", "missing", "i"));
        assertThrows(IllegalArgumentException.class, () -> registry.createIndex("t", "id", "bad name"));
        assertFalse(Files.exists(registry.indexPath("t", "i")), "No file is left by a rejected create");
    }

    @Test
    public void testInsertUpdatesEveryIndex() throws IOException {
        registry.createIndex("t", "id", "by_id");
        registry.createIndex("t", "name", "by_name");

        engine.insert("t", Row.of(3, "D"));

        assertEquals(3, registry.load("t", "by_id").find(Value.ofInt(3)).size());
        assertEquals(List.of(Row.of(3, "D")), registry.load("t", "by_name").find(Value.ofText("D")));
        assertEquals(4, registry.load("t", "by_name").getPersistedEntryCount());
        assertEquals(0, registry.insert("other", Row.of(1)), "A table without indexes is skipped");
    }

    @Test
    public void testIndexesSurviveRestart() throws IOException {
        registry.createIndex("t", "id", "by_id", true);
        engine.insert("t", Row.of(5, "E"));
        engine.shutdown();

        engine = new StorageEngine(config);
        registry = engine.getIndexRegistry();

        IndexMetadata metadata = registry.listIndexes("t").get(0);
        assertTrue(metadata.isUnique());
        assertFalse(registry.isLoaded("t", "by_id"));
        assertEquals(List.of(Row.of(5, "E")), registry.load("t", "by_id").find(Value.ofInt(5)));
        assertEquals(4, registry.load("t", "by_id").size());
    }

    @Test
    public void testFindIndexByColumn() throws IOException {
        registry.createIndex("t", "name", "by_name");

        assertEquals("by_name", registry.findIndexByColumn("t", "NAME").getName());
        assertNull(registry.findIndexByColumn("t", "id"));
        assertNull(registry.findIndexByColumn("other", "name"));
    }

    @Test
    public void testRangeThroughIndex() throws IOException {
        for (int i = 10; i < 20; i++) {
            engine.insert("t", Row.of(i, "n" + i));
        }
        registry.createIndex("t", "id", "by_id");

        int count = 0;
        Iterator<Row> rows = registry.load("t", "by_id").range(Value.ofInt(3), Value.ofInt(12), false, true);
        while (rows.hasNext()) {
            assertTrue(rows.next().get(0).asLong() > 3);
            count++;
        }
        assertEquals(3, count);
    }

    @Test
    public void testCharKeysMatchTableRows() throws IOException {
        engine.createTable("codes", Schema.of(
                new Column("code", DataType.CHAR, 4),
                new Column("id", DataType.INT)));
        engine.insert("codes", Row.of("ab ", 1));
        registry.createIndex("codes", "code", "by_code");
        engine.insert("codes", Row.of("ab ", 2));

        List<Row> scanned = new ArrayList<>();
        engine.getTable("codes").scan().forEachRemaining(scanned::add);
        assertEquals(List.of(Row.of(Value.ofFixedText("ab"), 1), Row.of(Value.ofFixedText("ab"), 2)), scanned);

        BPlusTreeIndex index = registry.load("codes", "by_code");
        assertEquals(scanned, index.find(Value.ofFixedText("ab")));
        assertEquals(List.of(Value.ofFixedText("ab")), index.load().keys());

        registry.markUnloaded("codes", "by_code");
        assertEquals(scanned, registry.load("codes", "by_code").find(Value.ofFixedText("ab")));
    }
}
