package net.seitter.heapstore.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.seitter.heapstore.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * An index catalog persisted as a JSON array of index records. The whole file is
 * rewritten after every change.
 */
public class JsonIndexCatalog extends InMemoryIndexCatalog {
    private static final Logger logger = LoggerFactory.getLogger(JsonIndexCatalog.class);

    private static final TypeReference<List<IndexMetadata>> RECORDS = new TypeReference<List<IndexMetadata>>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper = ObjectMappers.create();

    /**
     * Opens the catalog file, reading its records if it exists.
     *
     * @param file The catalog file
     * @throws IOException If the file exists but cannot be parsed
     */
    public JsonIndexCatalog(Path file) throws IOException {
        this.file = file;
        if (Files.exists(file)) {
            List<IndexMetadata> records = objectMapper.readValue(file.toFile(), RECORDS);
            indexes.addAll(records);
            logger.info("Loaded {} index records from {}", records.size(), file);
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void addIndex(IndexMetadata metadata) throws IOException {
        super.addIndex(metadata);
        try {
            save();
        } catch (IOException e) {
            indexes.remove(metadata);
            throw e;
        }
    }

    @Override
    public synchronized boolean dropIndex(String table, String name) throws IOException {
        IndexMetadata metadata = getIndex(table, name);
        if (metadata == null) {
            return false;
        }
        int position = indexes.indexOf(metadata);
        indexes.remove(position);
        try {
            save();
        } catch (IOException e) {
            indexes.add(position, metadata);
            throw e;
        }
        return true;
    }

    private void save() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), indexes);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        logger.debug("Saved {} index records to {}", indexes.size(), file);
    }
}
