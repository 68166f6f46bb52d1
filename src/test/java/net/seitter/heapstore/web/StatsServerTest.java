package net.seitter.heapstore.web;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import net.seitter.heapstore.StorageConfig;
import net.seitter.heapstore.StorageEngine;
import net.seitter.heapstore.schema.Column;
import net.seitter.heapstore.schema.DataType;
import net.seitter.heapstore.schema.Row;
import net.seitter.heapstore.schema.Schema;

/**
 * Tests for the StatsServer class.
 */
public class StatsServerTest {

    @TempDir
    Path tempDir;

    private StorageEngine engine;
    private StatsServer server;
    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    public void setUp() throws IOException {
        engine = new StorageEngine(StorageConfig.builder().dataDir(tempDir).build());
        engine.createTable("t", Schema.of(new Column("id", DataType.INT)));
        engine.insert("t", Row.of(1));
        engine.getIndexRegistry().createIndex("t", "id", "by_id");

        server = new StatsServer(engine, 0);
        server.start();
    }

    @AfterEach
    public void tearDown() throws IOException {
        server.stop();
        engine.shutdown();
    }

    private JsonNode get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode(), "Unexpected status for " + path);
        return objectMapper.readTree(response.body());
    }

    @Test
    public void testStatus() throws Exception {
        assertTrue(server.isRunning());
        assertTrue(server.getPort() > 0);

        JsonNode status = get("/api/status");
        assertEquals("running", status.get("status").asText());
        assertEquals(4096, status.get("pageSize").asInt());
        assertEquals("LRU", status.get("evictionPolicy").asText());
        assertEquals("t", status.get("tables").get(0).asText());
        assertEquals(2, status.get("openFiles").asInt());
    }

    @Test
    public void testBufferPools() throws Exception {
        JsonNode pools = get("/api/bufferpools");

        assertEquals(2, pools.size());
        assertEquals("t.tbl", pools.get(0).get("fileName").asText());
        assertTrue(pools.get(0).has("hitRate"));
        assertTrue(get("/api/bufferpools/evictions").isArray());
    }

    @Test
    public void testIndexes() throws Exception {
        JsonNode all = get("/api/indexes");
        assertEquals(1, all.size());
        assertEquals("by_id", all.get(0).get("name").asText());
        assertEquals("BTREE", all.get(0).get("type").asText());

        assertEquals(1, get("/api/indexes/t").size());
        assertEquals(0, get("/api/indexes/other").size());
    }

    @Test
    public void testStopIsIdempotent() {
        server.stop();
        server.stop();
        assertFalse(server.isRunning());
    }
}
