package net.seitter.heapstore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.seitter.heapstore.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the schemas of registered tables in a JSON file so tables can be reopened
 * in a later session.
 */
public class JsonSchemaStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonSchemaStore.class);

    private static final TypeReference<LinkedHashMap<String, Schema>> SCHEMAS =
            new TypeReference<LinkedHashMap<String, Schema>>() {
            };

    private final Path file;
    private final ObjectMapper objectMapper = ObjectMappers.create();
    private final Map<String, Schema> schemas = new LinkedHashMap<>();

    public JsonSchemaStore(Path file) throws IOException {
        this.file = file;
        if (Files.exists(file)) {
            schemas.putAll(objectMapper.readValue(file.toFile(), SCHEMAS));
            logger.info("Loaded {} table schemas from {}", schemas.size(), file);
        }
    }

    public synchronized Schema get(String table) {
        return schemas.get(table);
    }

    public synchronized boolean contains(String table) {
        return schemas.containsKey(table);
    }

    /**
     * Records the schema of a table, replacing any previous one.
     *
     * @param table The table name
     * @param schema The schema
     * @throws IOException If the file cannot be written
     */
    public synchronized void put(String table, Schema schema) throws IOException {
        Schema previous = schemas.put(table, schema);
        if (schema.equals(previous)) {
            return;
        }
        save();
    }

    /**
     * Removes the schema of a table.
     *
     * @param table The table name
     * @return true if a schema was removed
     * @throws IOException If the file cannot be written
     */
    public synchronized boolean remove(String table) throws IOException {
        if (schemas.remove(table) == null) {
            return false;
        }
        save();
        return true;
    }

    public synchronized List<String> tableNames() {
        return new ArrayList<>(schemas.keySet());
    }

    private void save() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), schemas);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        logger.debug("Saved {} table schemas to {}", schemas.size(), file);
    }
}
