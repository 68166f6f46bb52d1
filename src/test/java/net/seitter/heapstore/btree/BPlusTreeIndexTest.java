package net.seitter.heapstore.btree;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.seitter.heapstore.StorageConfig;
import net.seitter.heapstore.pool.HandlePool;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Value;
import net.seitter.heapstore.storage.ErrorKind;
import net.seitter.heapstore.storage.StorageException;

/**
 * Tests for the BPlusTreeIndex class and its entry log.
 */
public class BPlusTreeIndexTest {

    @TempDir
    Path tempDir;

    private static final int PAGE_SIZE = 512;

    private HandlePool handlePool;
    private Path indexPath;

    @BeforeEach
    public void setUp() {
        handlePool = new HandlePool(StorageConfig.builder().dataDir(tempDir).build());
        indexPath = tempDir.resolve("__idx__people__by_id.idx");
    }

    @AfterEach
    public void tearDown() throws IOException {
        handlePool.closeAll();
    }

    private BPlusTreeIndex open() throws IOException {
        return new BPlusTreeIndex("by_id", handlePool.acquire(indexPath, PAGE_SIZE, 8), 4);
    }

    @Test
    public void testRebuildFromLog() throws IOException {
        BPlusTreeIndex index = open();
        for (int i = 0; i < 120; i++) {
            index.insert(Value.ofInt(i % 40), Row.of(i % 40, "row-" + i));
        }
        assertTrue(index.getHandle().getPageCount() > 1, "The log should span several small pages");
        assertEquals(120, index.getPersistedEntryCount());

        handlePool.release(indexPath);
        BPlusTreeIndex reopened = open();
        assertFalse(reopened.isLoaded());

        assertEquals(120, reopened.size());
        assertTrue(reopened.isLoaded());
        assertEquals(List.of(Row.of(7, "row-7"), Row.of(7, "row-47"), Row.of(7, "row-87")),
                reopened.find(Value.ofInt(7)), "Duplicates are rebuilt in log order");
        reopened.load().checkInvariants();
    }

    @Test
    public void testUnloadRebuildsSameTree() throws IOException {
        BPlusTreeIndex index = open();
        index.insert(Value.ofText("b"), Row.of("b"));
        index.insert(Value.ofText("a"), Row.of("a"));
        BPlusTree before = index.load();

        index.unload();
        assertFalse(index.isLoaded());

        BPlusTree after = index.load();
        assertNotSame(before, after);
        assertEquals(before.keys(), after.keys());
    }

    private static final int KEYS = 30;

    private static Map<String, List<Row>> snapshot(BPlusTreeIndex index) throws IOException {
        Map<String, List<Row>> results = new LinkedHashMap<>();
        for (int key = -1; key <= KEYS; key++) {
            results.put("find " + key, index.find(Value.ofInt(key)));
        }
        List<Value> bounds = Arrays.asList(null, Value.ofInt(-1), Value.ofInt(0), Value.ofInt(7),
                Value.ofInt(15), Value.ofInt(KEYS - 1), Value.ofInt(KEYS));
        boolean[] flags = {true, false};
        for (Value lower : bounds) {
            for (Value upper : bounds) {
                for (boolean lowerInclusive : flags) {
                    for (boolean upperInclusive : flags) {
                        List<Row> rows = new ArrayList<>();
                        index.range(lower, upper, lowerInclusive, upperInclusive).forEachRemaining(rows::add);
                        results.put("range " + lower + (lowerInclusive ? "[" : "(") + upper +
                                (upperInclusive ? "]" : ")"), rows);
                    }
                }
            }
        }
        return results;
    }

    @Test
    public void testRebuiltTreeAnswersLikeOriginal() throws IOException {
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < KEYS * 4; i++) {
            keys.add(i % KEYS);
        }
        Collections.shuffle(keys, new Random(42));

        BPlusTreeIndex index = open();
        for (int i = 0; i < keys.size(); i++) {
            index.insert(Value.ofInt(keys.get(i)), Row.of(keys.get(i), "row-" + i));
        }
        index.load().checkInvariants();
        Map<String, List<Row>> expected = snapshot(index);
        assertEquals(4, expected.get("find 7").size());
        assertTrue(expected.get("find -1").isEmpty());
        assertEquals(KEYS * 4, expected.get("range null[null]").size());

        handlePool.release(indexPath);
        BPlusTreeIndex reopened = open();
        assertFalse(reopened.isLoaded());
        Map<String, List<Row>> rebuilt = snapshot(reopened);
        reopened.load().checkInvariants();
        for (Map.Entry<String, List<Row>> entry : expected.entrySet()) {
            assertEquals(entry.getValue(), rebuilt.get(entry.getKey()), entry.getKey());
        }

        reopened.unload();
        assertEquals(expected, snapshot(reopened));
    }

    @Test
    public void testRange() throws IOException {
        BPlusTreeIndex index = open();
        for (int i = 10; i > 0; i--) {
            index.insert(Value.ofInt(i), Row.of(i));
        }

        List<Row> rows = new ArrayList<>();
        Iterator<Row> range = index.range(Value.ofInt(3), Value.ofInt(6), true, false);
        range.forEachRemaining(rows::add);

        assertEquals(List.of(Row.of(3), Row.of(4), Row.of(5)), rows);
    }

    @Test
    public void testOversizeEntry() throws IOException {
        BPlusTreeIndex index = open();

        StorageException e = assertThrows(StorageException.class,
                () -> index.insert(Value.ofText("k"), Row.of("x".repeat(PAGE_SIZE))));
        assertEquals(ErrorKind.PAGE_FULL, e.getKind());
        assertEquals(0, index.getPersistedEntryCount());
        assertEquals(0, index.size(), "A failed write must not reach the tree");
    }

    @Test
    public void testEntryEncoding() {
        IndexEntry entry = new IndexEntry(Value.NULL, Row.of(1, Value.NULL, "x", 2.5));

        assertEquals(entry, IndexEntry.decode(entry.encode()));

        byte[] bytes = entry.encode();
        byte[] padded = Arrays.copyOf(bytes, bytes.length + 1);
        assertThrows(IllegalArgumentException.class, () -> IndexEntry.decode(padded));
    }
}
